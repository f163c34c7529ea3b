package me.golemcore.coder.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Assistant reply produced by one turn. Cost and tokens only grow while the
 * turn runs; the error is set at most once.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssistantMessage {

    private String id;
    private String sessionId;
    private String parentId;
    private String agent;
    private String providerId;
    private String modelId;
    private String finish;

    @Builder.Default
    private double cost = 0.0;

    @Builder.Default
    private TokenUsage tokens = TokenUsage.EMPTY;

    private MessageError error;
    private Instant createdAt;
    private Instant completedAt;

    public void addCost(double stepCost) {
        if (stepCost > 0 && Double.isFinite(stepCost)) {
            cost += stepCost;
        }
    }

    public void addTokens(TokenUsage stepTokens) {
        tokens = (tokens != null ? tokens : TokenUsage.EMPTY).plus(stepTokens);
    }

    public boolean hasError() {
        return error != null;
    }
}
