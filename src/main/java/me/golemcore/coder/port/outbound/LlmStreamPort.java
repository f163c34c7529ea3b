package me.golemcore.coder.port.outbound;

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

import me.golemcore.coder.domain.model.StreamEvent;
import me.golemcore.coder.domain.model.StreamRequest;
import reactor.core.publisher.Flux;

/**
 * Port for opening a streaming completion against a model backend.
 */
public interface LlmStreamPort {

    /**
     * Open a new stream. Each call starts a fresh request; the returned flux is
     * cold and may be subscribed once.
     */
    Flux<StreamEvent> stream(StreamRequest request);

    String getProviderId();
}
