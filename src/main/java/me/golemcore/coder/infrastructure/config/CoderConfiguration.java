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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.coder.port.outbound.LlmStreamPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Application-wide infrastructure beans and startup logging.
 *
 * <p>
 * Provides the shared {@link Clock}, the {@link ObjectMapper}, the scheduler
 * used by turn timers and the executors that run turns and background
 * summarization.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class CoderConfiguration {

    private final CoderProperties properties;
    private final LlmStreamPort llmStreamPort;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean(destroyMethod = "dispose")
    public static Scheduler turnScheduler() {
        return Schedulers.newParallel("turn-timer", 2, true);
    }

    @Bean(destroyMethod = "shutdownNow")
    public static ExecutorService turnExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("turn-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public static ExecutorService summaryExecutor() {
        return Executors.newSingleThreadExecutor(daemonThreads("summary-"));
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("GolemCore Coder v{} starting...", version);
        log.info("LLM Provider: {}", llmStreamPort.getProviderId());
        log.info("Stream idle timeout: {}, tool input timeout: {}",
                properties.getTurn().getStreamIdleTimeout(), properties.getTurn().getToolInputPendingTimeout());
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
