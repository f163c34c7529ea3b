package me.golemcore.coder.adapter.outbound.llm;

import me.golemcore.coder.domain.model.StreamEvent;
import me.golemcore.coder.domain.model.StreamRequest;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LlmStreamAdapterFactoryTest {

    @Test
    void shouldSelectConfiguredProvider() {
        LlmStreamProviderAdapter custom = adapter("custom");
        CoderProperties properties = new CoderProperties();
        properties.getLlm().setProvider("custom");
        LlmStreamAdapterFactory factory = new LlmStreamAdapterFactory(properties,
                List.of(new NoOpLlmStreamAdapter(), custom));

        factory.init();

        assertSame(custom, factory.getActiveAdapter());
        assertEquals("custom", factory.getProviderId());
    }

    @Test
    void shouldFallBackToNoOpForUnknownProvider() {
        CoderProperties properties = new CoderProperties();
        properties.getLlm().setProvider("missing");
        NoOpLlmStreamAdapter noOp = new NoOpLlmStreamAdapter();
        LlmStreamAdapterFactory factory = new LlmStreamAdapterFactory(properties, List.of(adapter("other"), noOp));

        factory.init();

        assertSame(noOp, factory.getActiveAdapter());
    }

    @Test
    void shouldDelegateStreamToActiveAdapter() {
        LlmStreamProviderAdapter custom = adapter("custom");
        when(custom.stream(any())).thenReturn(Flux.just(new StreamEvent.Finish("stop")));
        CoderProperties properties = new CoderProperties();
        properties.getLlm().setProvider("custom");
        LlmStreamAdapterFactory factory = new LlmStreamAdapterFactory(properties, List.of(custom));
        factory.init();

        StepVerifier.create(factory.stream(StreamRequest.builder().build()))
                .expectNext(new StreamEvent.Finish("stop"))
                .verifyComplete();
    }

    @Test
    void shouldFailStreamWithoutAdapters() {
        LlmStreamAdapterFactory factory = new LlmStreamAdapterFactory(new CoderProperties(), List.of());
        factory.init();

        StepVerifier.create(factory.stream(StreamRequest.builder().build()))
                .expectError(IllegalStateException.class)
                .verify();
    }

    private static LlmStreamProviderAdapter adapter(String providerId) {
        LlmStreamProviderAdapter adapter = mock(LlmStreamProviderAdapter.class);
        when(adapter.getProviderId()).thenReturn(providerId);
        when(adapter.isAvailable()).thenReturn(true);
        return adapter;
    }
}
