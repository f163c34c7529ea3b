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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;

import java.util.Map;

/**
 * Terminal error recorded on an assistant message.
 */
@Builder
public record MessageError(String name, String message, String code, boolean retryable, Integer statusCode,
        Long retryAfterMs, Map<String, String> metadata) {

    public static final String ABORTED = "MessageAbortedError";
    public static final String API_ERROR = "APIError";
    public static final String CONTEXT_OVERFLOW = "ContextOverflowError";
    public static final String PERMISSION_REJECTED = "PermissionRejectedError";
    public static final String UNKNOWN = "UnknownError";

    @JsonIgnore
    public boolean isAborted() {
        return ABORTED.equals(name);
    }
}
