package me.golemcore.coder.adapter.outbound.permission;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.coder.domain.model.PermissionAction;
import me.golemcore.coder.domain.model.PermissionRejectedException;
import me.golemcore.coder.domain.model.PermissionRequest;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import me.golemcore.coder.port.outbound.PermissionPort;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Non-interactive permission adapter.
 *
 * <p>
 * Resolves a request from the agent ruleset, then from
 * {@code coder.permission.defaults}, then from
 * {@code coder.permission.default-action}. There is nobody to ask, so
 * {@code ASK} is treated as a denial.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RulesetPermissionAdapter implements PermissionPort {

    private final CoderProperties properties;

    @Override
    public CompletableFuture<Void> ask(PermissionRequest request) {
        PermissionAction action = resolve(request);
        if (action == PermissionAction.ALLOW) {
            log.debug("[Permission] {} allowed for {}", request.permission(), request.patterns());
            return CompletableFuture.completedFuture(null);
        }
        log.info("[Permission] {} denied for {} ({})", request.permission(), request.patterns(), action);
        return CompletableFuture.failedFuture(new PermissionRejectedException(request.permission(),
                "Permission '" + request.permission() + "' was rejected for " + request.patterns()));
    }

    PermissionAction resolve(PermissionRequest request) {
        if (request.ruleset() != null) {
            PermissionAction fromRuleset = request.ruleset().actionFor(request.permission()).orElse(null);
            if (fromRuleset != null) {
                return fromRuleset;
            }
        }
        CoderProperties.PermissionProperties config = properties.getPermission();
        PermissionAction fromDefaults = config.getDefaults().get(request.permission());
        return fromDefaults != null ? fromDefaults : config.getDefaultAction();
    }
}
