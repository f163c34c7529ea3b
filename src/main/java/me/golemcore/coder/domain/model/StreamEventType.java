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

/**
 * Kinds of events emitted by a model stream, with their wire names.
 */
public enum StreamEventType {
    START("start"),
    REASONING_START("reasoning-start"),
    REASONING_DELTA("reasoning-delta"),
    REASONING_END("reasoning-end"),
    TOOL_INPUT_START("tool-input-start"),
    TOOL_INPUT_DELTA("tool-input-delta"),
    TOOL_INPUT_END("tool-input-end"),
    TOOL_CALL("tool-call"),
    TOOL_RESULT("tool-result"),
    TOOL_ERROR("tool-error"),
    ERROR("error"),
    START_STEP("start-step"),
    FINISH_STEP("finish-step"),
    TEXT_START("text-start"),
    TEXT_DELTA("text-delta"),
    TEXT_END("text-end"),
    FINISH("finish"),
    UNKNOWN("unknown");

    private final String wireName;

    StreamEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
