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
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/** Spring wiring for the turn processor (domain orchestrator + ports). */
@Configuration
public class TurnProcessorConfiguration {

    @Bean
    public StreamIdleWatchdog streamIdleWatchdog() {
        return new StreamIdleWatchdog();
    }

    @Bean
    public SessionRetryService sessionRetryService(CoderProperties properties,
            @Qualifier("turnScheduler") Scheduler turnScheduler) {
        return new SessionRetryService(properties.getRetry(), turnScheduler);
    }

    @Bean
    public CompactionPolicy compactionPolicy(CoderProperties properties) {
        return new CompactionPolicy(properties.getAutoCompact());
    }

    @Bean
    public TurnProcessorFactory turnProcessorFactory(LlmStreamPort llmStreamPort, SessionPort sessionPort,
            SnapshotPort snapshotPort, PermissionPort permissionPort, SessionStatusPort sessionStatusPort,
            SummaryPort summaryPort, EventBusPort eventBus, SessionRetryService retryService,
            CompactionPolicy compactionPolicy, UsageCalculator usageCalculator,
            ObjectProvider<TextCompletionHook> textCompletionHooks, StreamIdleWatchdog watchdog,
            AscendingIdGenerator idGenerator, CoderProperties properties,
            @Qualifier("turnScheduler") Scheduler turnScheduler,
            @Qualifier("summaryExecutor") ExecutorService summaryExecutor, Clock clock,
            ObjectMapper objectMapper) {
        TurnDependencies dependencies = TurnDependencies.builder()
                .llmStreamPort(llmStreamPort)
                .sessionPort(sessionPort)
                .snapshotPort(snapshotPort)
                .permissionPort(permissionPort)
                .sessionStatusPort(sessionStatusPort)
                .summaryPort(summaryPort)
                .eventBus(eventBus)
                .retryService(retryService)
                .compactionPolicy(compactionPolicy)
                .usageCalculator(usageCalculator)
                .textCompletionHooks(textCompletionHooks.orderedStream().collect(Collectors.toList()))
                .watchdog(watchdog)
                .idGenerator(idGenerator)
                .settings(properties.getTurn())
                .maxRetryAttempts(properties.getRetry().getMaxAttempts())
                .summaryEnabled(properties.getSummary().isEnabled())
                .scheduler(turnScheduler)
                .summaryExecutor(summaryExecutor)
                .clock(clock)
                .objectMapper(objectMapper)
                .build();
        return new TurnProcessorFactory(dependencies);
    }
}
