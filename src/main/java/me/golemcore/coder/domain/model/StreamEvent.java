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

import java.util.Map;
import java.util.Objects;

/**
 * Typed event of a model stream.
 *
 * <p>
 * Ids of text and reasoning events are provider ids; tool events are keyed by
 * the tool call id.
 */
public sealed interface StreamEvent {

    StreamEventType type();

    record Start() implements StreamEvent {
        @Override
        public StreamEventType type() {
            return StreamEventType.START;
        }
    }

    record ReasoningStart(String id, Map<String, Object> metadata) implements StreamEvent {
        public ReasoningStart {
            Objects.requireNonNull(id, "id");
        }

        @Override
        public StreamEventType type() {
            return StreamEventType.REASONING_START;
        }
    }

    record ReasoningDelta(String id, String text, Map<String, Object> metadata) implements StreamEvent {
        @Override
        public StreamEventType type() {
            return StreamEventType.REASONING_DELTA;
        }
    }

    record ReasoningEnd(String id, Map<String, Object> metadata) implements StreamEvent {
        @Override
        public StreamEventType type() {
            return StreamEventType.REASONING_END;
        }
    }

    record ToolInputStart(String id, String toolName) implements StreamEvent {
        public ToolInputStart {
            Objects.requireNonNull(id, "id");
        }

        @Override
        public StreamEventType type() {
            return StreamEventType.TOOL_INPUT_START;
        }
    }

    record ToolInputDelta(String id, String delta) implements StreamEvent {
        @Override
        public StreamEventType type() {
            return StreamEventType.TOOL_INPUT_DELTA;
        }
    }

    record ToolInputEnd(String id) implements StreamEvent {
        @Override
        public StreamEventType type() {
            return StreamEventType.TOOL_INPUT_END;
        }
    }

    record ToolCall(String toolCallId, String toolName, Map<String, Object> input, Map<String, Object> metadata)
            implements StreamEvent {
        public ToolCall {
            Objects.requireNonNull(toolCallId, "toolCallId");
            input = input != null ? input : Map.of();
        }

        @Override
        public StreamEventType type() {
            return StreamEventType.TOOL_CALL;
        }
    }

    record ToolResult(String toolCallId, Map<String, Object> input, ToolOutput output) implements StreamEvent {
        @Override
        public StreamEventType type() {
            return StreamEventType.TOOL_RESULT;
        }
    }

    record ToolError(String toolCallId, Map<String, Object> input, Throwable error) implements StreamEvent {
        @Override
        public StreamEventType type() {
            return StreamEventType.TOOL_ERROR;
        }
    }

    record StreamError(Throwable error) implements StreamEvent {
        public StreamError {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public StreamEventType type() {
            return StreamEventType.ERROR;
        }
    }

    record StartStep() implements StreamEvent {
        @Override
        public StreamEventType type() {
            return StreamEventType.START_STEP;
        }
    }

    record FinishStep(String finishReason, StepUsage usage, Map<String, Object> metadata) implements StreamEvent {
        @Override
        public StreamEventType type() {
            return StreamEventType.FINISH_STEP;
        }
    }

    record TextStart(String id, Map<String, Object> metadata) implements StreamEvent {
        @Override
        public StreamEventType type() {
            return StreamEventType.TEXT_START;
        }
    }

    record TextDelta(String id, String text, Map<String, Object> metadata) implements StreamEvent {
        @Override
        public StreamEventType type() {
            return StreamEventType.TEXT_DELTA;
        }
    }

    record TextEnd(String id, Map<String, Object> metadata) implements StreamEvent {
        @Override
        public StreamEventType type() {
            return StreamEventType.TEXT_END;
        }
    }

    record Finish(String finishReason) implements StreamEvent {
        @Override
        public StreamEventType type() {
            return StreamEventType.FINISH;
        }
    }

    record Unknown(String rawType, Map<String, Object> payload) implements StreamEvent {
        @Override
        public StreamEventType type() {
            return StreamEventType.UNKNOWN;
        }
    }
}
