package me.golemcore.coder.adapter.outbound.llm;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.coder.domain.model.StepUsage;
import me.golemcore.coder.domain.model.StreamEvent;
import me.golemcore.coder.domain.model.StreamRequest;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

/**
 * No-op stream adapter for testing and when no model backend is configured.
 *
 * <p>
 * Emits a single placeholder text step without calling any external API.
 *
 * <p>
 * Provider ID: {@code "none"}
 */
@Component
@Slf4j
public class NoOpLlmStreamAdapter implements LlmStreamProviderAdapter {

    static final String PLACEHOLDER = "[No LLM configured]";
    private static final String TEXT_ID = "noop-text";

    @Override
    public String getProviderId() {
        return "none";
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public Flux<StreamEvent> stream(StreamRequest request) {
        log.warn("NoOpLlmStreamAdapter: stream() called - no LLM configured");
        return Flux.just(
                new StreamEvent.Start(),
                new StreamEvent.StartStep(),
                new StreamEvent.TextStart(TEXT_ID, null),
                new StreamEvent.TextDelta(TEXT_ID, PLACEHOLDER, null),
                new StreamEvent.TextEnd(TEXT_ID, null),
                new StreamEvent.FinishStep("stop", StepUsage.builder().build(), null),
                new StreamEvent.Finish("stop"));
    }
}
