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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.coder.domain.model.StreamEvent;
import me.golemcore.coder.domain.model.StreamRequest;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import me.golemcore.coder.port.outbound.LlmStreamPort;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Factory for selecting the model stream adapter based on configuration.
 *
 * <p>
 * Selects the active adapter by {@code coder.llm.provider}:
 * <ul>
 * <li>langchain4j - OpenAI-compatible and Anthropic models via langchain4j
 * <li>none - No-op adapter for testing
 * </ul>
 *
 * <p>
 * Falls back to {@code none} when the configured provider is unknown.
 *
 * @see LlmStreamProviderAdapter
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class LlmStreamAdapterFactory implements LlmStreamPort {

    private static final String PROVIDER_NONE = "none";

    private final CoderProperties properties;
    private final List<LlmStreamProviderAdapter> adapters;

    private final Map<String, LlmStreamProviderAdapter> adaptersByProvider = new ConcurrentHashMap<>();
    private LlmStreamProviderAdapter activeAdapter;

    @PostConstruct
    public void init() {
        for (LlmStreamProviderAdapter adapter : adapters) {
            adaptersByProvider.put(adapter.getProviderId(), adapter);
            log.debug("Registered LLM stream adapter: {}", adapter.getProviderId());
        }

        String provider = properties.getLlm().getProvider();
        activeAdapter = adaptersByProvider.get(provider);

        if (activeAdapter == null) {
            activeAdapter = adaptersByProvider.get(PROVIDER_NONE);
            if (activeAdapter == null && !adapters.isEmpty()) {
                activeAdapter = adapters.get(0);
            }
            log.warn("Provider '{}' not found, using: {}",
                    provider, activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE);
        } else {
            log.info("Active LLM provider: {}", provider);
            if (!activeAdapter.isAvailable()) {
                log.warn("LLM provider '{}' is not fully configured", provider);
            }
        }
    }

    public LlmStreamPort getActiveAdapter() {
        return activeAdapter;
    }

    @Override
    public String getProviderId() {
        return activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE;
    }

    @Override
    public Flux<StreamEvent> stream(StreamRequest request) {
        if (activeAdapter == null) {
            return Flux.error(new IllegalStateException("No LLM stream adapter is registered"));
        }
        return activeAdapter.stream(request);
    }
}
