package me.golemcore.coder.infrastructure.config;

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

import lombok.Data;
import me.golemcore.coder.domain.model.PermissionAction;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties of the coder runtime, bound from
 * application.properties under the {@code coder.*} prefix.
 *
 * <ul>
 * <li>{@link TurnProperties} - stream liveness, flushing and loop guards</li>
 * <li>{@link RetryProperties} - backoff between stream attempts</li>
 * <li>{@link AutoCompactProperties} - context overflow trigger</li>
 * <li>{@link LlmProperties} - model backend selection</li>
 * <li>{@link PermissionProperties} - fallback permission actions</li>
 * <li>{@link SummaryProperties} - session summarization</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "coder")
@Data
public class CoderProperties {

    private TurnProperties turn = new TurnProperties();
    private RetryProperties retry = new RetryProperties();
    private AutoCompactProperties autoCompact = new AutoCompactProperties();
    private LlmProperties llm = new LlmProperties();
    private PermissionProperties permission = new PermissionProperties();
    private SummaryProperties summary = new SummaryProperties();

    // ==================== TURN ====================

    @Data
    public static class TurnProperties {
        /** Max silence between two stream events. Zero disables the watchdog. */
        private Duration streamIdleTimeout = Duration.ofSeconds(60);

        /** Idle deadline used while tool arguments are still streaming. */
        private Duration toolInputPendingTimeout = Duration.ofMinutes(5);

        private int maxStreamIdleTimeoutRetries = 3;

        /** Identical consecutive tool calls that ask for doom-loop approval. */
        private int doomLoopThreshold = 3;

        /** Min interval between two persisted text updates of a streaming part. */
        private Duration deltaFlushInterval = Duration.ofMillis(50);

        /**
         * Keep consuming the stream after a permission rejection instead of
         * stopping the turn.
         */
        private boolean continueLoopOnDeny = false;

        /** Treat a context overflow error as a compaction request. */
        private boolean compactOnContextOverflow = false;
    }

    // ==================== RETRY ====================

    @Data
    public static class RetryProperties {
        private Duration initialDelay = Duration.ofSeconds(2);
        private double backoffFactor = 2.0;

        /** Cap applied when the provider sent no retry-after hint. */
        private Duration maxDelayWithoutHints = Duration.ofSeconds(30);

        private Duration maxDelay = Duration.ofMillis(Integer.MAX_VALUE);

        /** Transient provider retries per turn. Zero means unbounded. */
        private int maxAttempts = 8;
    }

    // ==================== AUTO COMPACT ====================

    @Data
    public static class AutoCompactProperties {
        private boolean enabled = true;

        /** Tokens kept free for the model output when it declares no limit. */
        private int outputReserveTokens = 32_000;

        /** Share of the usable context that may be filled before compaction. */
        private double safetyMargin = 1.0;
    }

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        private String provider = "none";
        private Langchain4jProperties langchain4j = new Langchain4jProperties();
    }

    @Data
    public static class Langchain4jProperties {
        /** Model used when the turn does not name one. */
        private String defaultModel = "gpt-4o-mini";
        private String baseUrl;
        private String apiKey;
        private Duration timeout = Duration.ofMinutes(5);
    }

    // ==================== PERMISSION ====================

    @Data
    public static class PermissionProperties {
        private PermissionAction defaultAction = PermissionAction.ALLOW;
        private Map<String, PermissionAction> defaults = new HashMap<>(Map.of("doom_loop", PermissionAction.DENY));
    }

    // ==================== SUMMARY ====================

    @Data
    public static class SummaryProperties {
        private boolean enabled = true;
    }
}
