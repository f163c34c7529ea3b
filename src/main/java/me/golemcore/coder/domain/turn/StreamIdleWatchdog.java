package me.golemcore.coder.domain.turn;

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
import me.golemcore.coder.domain.model.LlmStreamException;
import me.golemcore.coder.domain.model.StreamIdleTimeoutException;
import me.golemcore.coder.domain.model.TurnAbortedException;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Guards a stream against silent stalls.
 *
 * <p>
 * Every wait for the next element races its arrival against the deadline
 * returned by the supplier at the moment of waiting, so the deadline may change
 * between elements. Time the consumer spends between two waits is not counted.
 * Cancellation wakes a pending wait and wins over a timeout.
 */
@Slf4j
public class StreamIdleWatchdog {

    /**
     * Subscribe to {@code source} and expose it as a blocking sequence.
     *
     * @param deadlineMs
     *            current idle deadline; a value {@code <= 0} when the stream is
     *            opened disables the timer for the whole stream, a value
     *            {@code <= 0} for one wait disarms it for that wait only
     */
    public <T> WatchedStream<T> watch(Flux<T> source, LongSupplier deadlineMs, TurnCancellation cancellation) {
        boolean enabled = deadlineMs.getAsLong() > 0;
        if (!enabled) {
            log.debug("[Watchdog] idle timer disabled");
        }
        return new WatchedStream<>(source, enabled ? deadlineMs : () -> 0L, cancellation);
    }

    /**
     * Blocking view of a watched stream. Close it to cancel the upstream
     * subscription.
     */
    public static final class WatchedStream<T> implements Iterator<T>, AutoCloseable {

        private static final Object COMPLETE = new Object();
        private static final Object CANCELLED = new Object();

        private final BlockingQueue<Object> signals = new LinkedBlockingQueue<>();
        private final LongSupplier deadlineMs;
        private final TurnCancellation cancellation;
        private final Disposable subscription;
        private final Disposable cancellationHook;

        private Object lookahead;
        private boolean done;

        private WatchedStream(Flux<T> source, LongSupplier deadlineMs, TurnCancellation cancellation) {
            this.deadlineMs = deadlineMs;
            this.cancellation = cancellation;
            this.cancellationHook = cancellation != null
                    ? cancellation.whenCancelled().subscribe(reason -> signals.offer(CANCELLED))
                    : null;
            this.subscription = source.subscribe(
                    signals::offer,
                    error -> signals.offer(new Failure(error)),
                    () -> signals.offer(COMPLETE));
        }

        @Override
        public boolean hasNext() {
            if (lookahead != null) {
                return true;
            }
            if (done) {
                return false;
            }
            Object signal = await();
            if (signal == COMPLETE) {
                done = true;
                close();
                return false;
            }
            if (signal instanceof Failure failure) {
                done = true;
                close();
                throw propagate(failure.error());
            }
            lookahead = signal;
            return true;
        }

        @Override
        @SuppressWarnings("unchecked")
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            T element = (T) lookahead;
            lookahead = null;
            return element;
        }

        @Override
        public void close() {
            subscription.dispose();
            if (cancellationHook != null) {
                cancellationHook.dispose();
            }
        }

        private Object await() {
            throwIfCancelled();
            long timeoutMs = deadlineMs.getAsLong();
            Object signal;
            try {
                signal = timeoutMs > 0
                        ? signals.poll(timeoutMs, TimeUnit.MILLISECONDS)
                        : signals.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                done = true;
                close();
                throw new TurnAbortedException("Interrupted while waiting for stream data");
            }
            throwIfCancelled();
            if (signal == null) {
                done = true;
                close();
                log.info("[Watchdog] no stream data for {}ms", timeoutMs);
                throw new StreamIdleTimeoutException(timeoutMs);
            }
            return signal;
        }

        private void throwIfCancelled() {
            if (cancellation != null && cancellation.isCancelled()) {
                done = true;
                close();
                cancellation.throwIfCancelled();
            }
        }

        private static RuntimeException propagate(Throwable error) {
            if (error instanceof RuntimeException runtimeException) {
                return runtimeException;
            }
            if (error instanceof Error fatal) {
                throw fatal;
            }
            return new LlmStreamException(error);
        }

        private record Failure(Throwable error) {
        }
    }
}
