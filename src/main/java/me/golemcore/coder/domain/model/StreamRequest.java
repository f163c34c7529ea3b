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

import java.util.List;
import java.util.Map;

/**
 * Everything the model backend needs to open one stream. Reopening a stream
 * after a retry reuses the same request.
 */
@Builder
public record StreamRequest(String sessionId, String agent, ModelInfo model, String systemPrompt,
        List<ConversationMessage> messages, Map<String, Object> options) {
}
