package me.golemcore.coder;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Coder.
 *
 * <p>
 * GolemCore Coder is the runtime of an AI coding agent. Its core is the turn
 * processor, which consumes the event stream of a model backend and turns it
 * into durable, incrementally visible message parts.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Streaming turns</b> - text and reasoning deltas persisted at a bounded
 * rate</li>
 * <li><b>Liveness</b> - idle watchdog with an extended deadline while tool
 * arguments stream</li>
 * <li><b>Tool-call ledger</b> - exactly-once tool state transitions, orphaned
 * calls aborted at turn end</li>
 * <li><b>Retries</b> - exponential backoff honouring provider hints</li>
 * <li><b>Doom-loop guard</b> - approval required for repeated identical tool
 * calls</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Domain Layer       → TurnProcessor, TurnRunCoordinator, Services
 * Ports              → LlmStreamPort, SessionPort, PermissionPort, ...
 * Infrastructure     → langchain4j stream adapter, in-memory session store
 * </pre>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CoderApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoderApplication.class, args);
    }
}
