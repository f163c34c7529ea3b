package me.golemcore.coder.infrastructure.event;

import me.golemcore.coder.domain.model.MessageError;
import me.golemcore.coder.domain.model.SessionErrorEvent;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class SpringEventBusTest {

    @Test
    void shouldDelegateToApplicationEventPublisher() {
        ApplicationEventPublisher publisher = mock(ApplicationEventPublisher.class);
        SpringEventBus eventBus = new SpringEventBus(publisher);
        SessionErrorEvent event = new SessionErrorEvent("ses-1", "msg-1",
                MessageError.builder().name(MessageError.UNKNOWN).message("boom").build());

        eventBus.publish(event);

        verify(publisher).publishEvent(event);
    }

    @Test
    void shouldNotPropagateListenerFailures() {
        ApplicationEventPublisher publisher = mock(ApplicationEventPublisher.class);
        doThrow(new IllegalStateException("listener broke")).when(publisher).publishEvent(any(Object.class));
        SpringEventBus eventBus = new SpringEventBus(publisher);

        assertDoesNotThrow(() -> eventBus.publish("event"));
    }
}
