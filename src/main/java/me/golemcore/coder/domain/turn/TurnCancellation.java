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

import me.golemcore.coder.domain.model.TurnAbortedException;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation token of one turn, observed at every point where
 * the turn waits.
 */
public final class TurnCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Sinks.One<String> signal = Sinks.one();
    private volatile String reason;

    /**
     * Cancel the turn. Only the first call has an effect.
     *
     * @return true if this call cancelled the turn
     */
    public boolean cancel(String reason) {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        this.reason = reason != null ? reason : "Turn aborted";
        signal.tryEmitValue(this.reason);
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public String getReason() {
        return reason;
    }

    /**
     * Emits once the turn is cancelled, also for late subscribers.
     */
    public Mono<String> whenCancelled() {
        return signal.asMono();
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new TurnAbortedException(reason);
        }
    }
}
