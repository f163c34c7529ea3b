package me.golemcore.coder.domain.turn;

import me.golemcore.coder.domain.model.TurnAbortedException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TurnCancellationTest {

    @Test
    void shouldKeepFirstReason() {
        TurnCancellation cancellation = new TurnCancellation();

        assertTrue(cancellation.cancel("first"));
        assertFalse(cancellation.cancel("second"));

        assertEquals("first", cancellation.getReason());
        TurnAbortedException aborted = assertThrows(TurnAbortedException.class, cancellation::throwIfCancelled);
        assertEquals("first", aborted.getMessage());
    }

    @Test
    void shouldSignalLateSubscribers() {
        TurnCancellation cancellation = new TurnCancellation();
        cancellation.cancel(null);

        assertEquals("Turn aborted", cancellation.whenCancelled().block(Duration.ofSeconds(1)));
    }

    @Test
    void shouldNotThrowWhileActive() {
        TurnCancellation cancellation = new TurnCancellation();

        assertDoesNotThrow(cancellation::throwIfCancelled);
        assertFalse(cancellation.isCancelled());
    }
}
