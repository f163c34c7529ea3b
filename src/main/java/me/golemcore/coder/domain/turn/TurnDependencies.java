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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import me.golemcore.coder.domain.service.AscendingIdGenerator;
import me.golemcore.coder.domain.service.CompactionPolicy;
import me.golemcore.coder.domain.service.SessionRetryService;
import me.golemcore.coder.domain.service.UsageCalculator;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import me.golemcore.coder.port.outbound.EventBusPort;
import me.golemcore.coder.port.outbound.LlmStreamPort;
import me.golemcore.coder.port.outbound.PermissionPort;
import me.golemcore.coder.port.outbound.SessionPort;
import me.golemcore.coder.port.outbound.SessionStatusPort;
import me.golemcore.coder.port.outbound.SnapshotPort;
import me.golemcore.coder.port.outbound.SummaryPort;
import me.golemcore.coder.port.outbound.TextCompletionHook;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Collaborators shared by every turn processor.
 */
@Builder
public record TurnDependencies(
        LlmStreamPort llmStreamPort,
        SessionPort sessionPort,
        SnapshotPort snapshotPort,
        PermissionPort permissionPort,
        SessionStatusPort sessionStatusPort,
        SummaryPort summaryPort,
        EventBusPort eventBus,
        SessionRetryService retryService,
        CompactionPolicy compactionPolicy,
        UsageCalculator usageCalculator,
        List<TextCompletionHook> textCompletionHooks,
        StreamIdleWatchdog watchdog,
        AscendingIdGenerator idGenerator,
        CoderProperties.TurnProperties settings,
        int maxRetryAttempts,
        boolean summaryEnabled,
        Scheduler scheduler,
        Executor summaryExecutor,
        Clock clock,
        ObjectMapper objectMapper) {

    public TurnDependencies {
        textCompletionHooks = textCompletionHooks != null ? List.copyOf(textCompletionHooks) : List.of();
    }
}
