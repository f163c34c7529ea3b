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

import lombok.Builder;

/**
 * Model capabilities the turn needs: context limits and per-million token
 * prices.
 */
@Builder
public record ModelInfo(String providerId, String modelId, Limit limit, Cost cost) {

    @Builder
    public record Limit(int context, int input, int output) {
    }

    @Builder
    public record Cost(double input, double output, double cacheRead, double cacheWrite) {

        public static final Cost FREE = new Cost(0, 0, 0, 0);
    }
}
