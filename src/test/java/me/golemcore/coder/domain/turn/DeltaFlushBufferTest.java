package me.golemcore.coder.domain.turn;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeltaFlushBufferTest {

    private static final Duration INTERVAL = Duration.ofMillis(50);

    private VirtualTimeScheduler scheduler;
    private List<String[]> flushes;
    private TurnCancellation cancellation;
    private DeltaFlushBuffer buffer;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        flushes = new ArrayList<>();
        cancellation = new TurnCancellation();
        buffer = new DeltaFlushBuffer(scheduler, INTERVAL,
                (partId, fullText, delta) -> flushes.add(new String[] { partId, fullText, delta }), cancellation);
    }

    @AfterEach
    void tearDown() {
        buffer.close();
        scheduler.dispose();
    }

    @Test
    void shouldCoalesceFragmentsWithinOneInterval() {
        buffer.append("p1", "Hel");
        buffer.append("p1", "lo");

        scheduler.advanceTimeBy(Duration.ofMillis(49));
        assertTrue(flushes.isEmpty());

        scheduler.advanceTimeBy(Duration.ofMillis(1));
        assertEquals(1, flushes.size());
        assertEquals("Hello", flushes.get(0)[1]);
        assertEquals("Hello", flushes.get(0)[2]);
    }

    @Test
    void shouldPassOnlyNewSuffixAsDelta() {
        buffer.append("p1", "Hello");
        scheduler.advanceTimeBy(INTERVAL);
        buffer.append("p1", ", world");
        scheduler.advanceTimeBy(INTERVAL);

        assertEquals(2, flushes.size());
        assertEquals("Hello, world", flushes.get(1)[1]);
        assertEquals(", world", flushes.get(1)[2]);
    }

    @Test
    void shouldFlushEveryDirtyPart() {
        buffer.append("text", "a");
        buffer.append("reasoning", "b");

        buffer.flushAll();

        assertEquals(2, flushes.size());
        assertEquals("text", flushes.get(0)[0]);
        assertEquals("reasoning", flushes.get(1)[0]);

        buffer.flushAll();
        assertEquals(2, flushes.size());
    }

    @Test
    void shouldReturnFullTextAndStopFlushingOnFinalize() {
        buffer.append("p1", "Hello");
        buffer.append("p1", " there");

        String text = buffer.finalize("p1");
        scheduler.advanceTimeBy(Duration.ofSeconds(1));

        assertEquals("Hello there", text);
        assertTrue(flushes.isEmpty());
    }

    @Test
    void shouldReturnEmptyTextForUnknownPart() {
        assertEquals("", buffer.finalize("missing"));
    }

    @Test
    void shouldIgnoreEmptyFragments() {
        buffer.append("p1", "");
        buffer.append("p1", null);

        scheduler.advanceTimeBy(INTERVAL);

        assertTrue(flushes.isEmpty());
    }

    @Test
    void shouldSkipTimerFlushAfterCancellation() {
        buffer.append("p1", "partial");
        cancellation.cancel("stop");

        scheduler.advanceTimeBy(INTERVAL);

        assertTrue(flushes.isEmpty());
    }

    @Test
    void shouldDropPendingFlushOnClose() {
        buffer.append("p1", "partial");
        buffer.close();

        scheduler.advanceTimeBy(INTERVAL);

        assertTrue(flushes.isEmpty());
        assertThrows(IllegalStateException.class, () -> buffer.append("p1", "more"));
    }

    @Test
    void shouldRethrowSinkFailureOnNextAppend() {
        IllegalStateException failure = new IllegalStateException("store down");
        DeltaFlushBuffer failing = new DeltaFlushBuffer(scheduler, INTERVAL, (partId, fullText, delta) -> {
            throw failure;
        }, cancellation);
        failing.append("p1", "a");
        scheduler.advanceTimeBy(INTERVAL);

        IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> failing.append("p1", "b"));

        assertSame(failure, thrown);
        failing.close();
    }
}
