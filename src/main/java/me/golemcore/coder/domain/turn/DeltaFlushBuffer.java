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
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Accumulates streamed text fragments per part and persists them at a bounded
 * rate.
 *
 * <p>
 * Fragments are kept as a list and joined only when flushed, so appending
 * stays linear in the text size. A flush hands the sink the full text together
 * with the suffix appended since the previous flush. Flushes and
 * {@link #finalize(String)} hold the same lock: nothing is flushed for a part
 * after it was finalized.
 */
@Slf4j
public class DeltaFlushBuffer implements AutoCloseable {

    /**
     * Receives the accumulated text of a part.
     */
    @FunctionalInterface
    public interface FlushSink {
        void flush(String partId, String fullText, String delta);
    }

    private final Object lock = new Object();
    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final Scheduler scheduler;
    private final long intervalMs;
    private final FlushSink sink;
    private final TurnCancellation cancellation;

    private Disposable scheduledFlush;
    private RuntimeException flushFailure;
    private boolean closed;

    public DeltaFlushBuffer(Scheduler scheduler, Duration interval, FlushSink sink, TurnCancellation cancellation) {
        this.scheduler = scheduler;
        this.intervalMs = Math.max(0, interval.toMillis());
        this.sink = sink;
        this.cancellation = cancellation;
    }

    /**
     * Append a fragment and schedule a flush if none is pending.
     *
     * @throws RuntimeException
     *             the failure of a previous background flush
     */
    public void append(String partId, String fragment) {
        if (fragment == null || fragment.isEmpty()) {
            return;
        }
        synchronized (lock) {
            rethrowFlushFailure();
            if (closed) {
                throw new IllegalStateException("Delta flush buffer is closed");
            }
            entries.computeIfAbsent(partId, id -> new Entry()).chunks.add(fragment);
            if (scheduledFlush == null) {
                scheduledFlush = scheduler.schedule(this::onTimer, intervalMs, TimeUnit.MILLISECONDS);
            }
        }
    }

    /**
     * Flush every part with unflushed fragments right away.
     */
    public void flushAll() {
        synchronized (lock) {
            cancelScheduledFlush();
            flushDirtyEntries();
        }
    }

    /**
     * Remove the part and return its full text. Returns an empty string when no
     * fragment was appended.
     */
    public String finalize(String partId) {
        synchronized (lock) {
            rethrowFlushFailure();
            Entry entry = entries.remove(partId);
            if (entries.isEmpty()) {
                cancelScheduledFlush();
            }
            return entry != null ? String.join("", entry.chunks) : "";
        }
    }

    /**
     * Drop all entries and cancel a pending flush without running it.
     */
    @Override
    public void close() {
        synchronized (lock) {
            closed = true;
            cancelScheduledFlush();
            entries.clear();
        }
    }

    private void onTimer() {
        synchronized (lock) {
            scheduledFlush = null;
            if (closed || cancellation != null && cancellation.isCancelled()) {
                return;
            }
            flushDirtyEntries();
        }
    }

    private void flushDirtyEntries() {
        for (Map.Entry<String, Entry> item : entries.entrySet()) {
            Entry entry = item.getValue();
            int size = entry.chunks.size();
            if (entry.flushedCount >= size) {
                continue;
            }
            String fullText = String.join("", entry.chunks);
            String delta = String.join("", entry.chunks.subList(entry.flushedCount, size));
            entry.flushedCount = size;
            try {
                sink.flush(item.getKey(), fullText, delta);
            } catch (RuntimeException e) {
                log.warn("[Flush] failed to persist part {}: {}", item.getKey(), e.getMessage());
                if (flushFailure == null) {
                    flushFailure = e;
                }
            }
        }
    }

    private void cancelScheduledFlush() {
        if (scheduledFlush != null) {
            scheduledFlush.dispose();
            scheduledFlush = null;
        }
    }

    private void rethrowFlushFailure() {
        if (flushFailure != null) {
            RuntimeException failure = flushFailure;
            flushFailure = null;
            throw failure;
        }
    }

    private static final class Entry {
        private final List<String> chunks = new ArrayList<>();
        private int flushedCount;
    }
}
