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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Durable, incrementally visible unit of an assistant message.
 *
 * <p>
 * Parts are created by the first stream event that names them, mutated in
 * place by deltas and finalized by their terminal event. They are never deleted
 * by the turn processor.
 */
@Data
@NoArgsConstructor
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TextPart.class, name = "text"),
        @JsonSubTypes.Type(value = ReasoningPart.class, name = "reasoning"),
        @JsonSubTypes.Type(value = ToolPart.class, name = "tool"),
        @JsonSubTypes.Type(value = StepStartPart.class, name = "step-start"),
        @JsonSubTypes.Type(value = StepFinishPart.class, name = "step-finish"),
        @JsonSubTypes.Type(value = PatchPart.class, name = "patch")
})
public abstract class Part {

    private String id;
    private String messageId;
    private String sessionId;

    protected Part(String id, String messageId, String sessionId) {
        this.id = id;
        this.messageId = messageId;
        this.sessionId = sessionId;
    }

    public abstract PartType type();
}
