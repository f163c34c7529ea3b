package me.golemcore.coder.domain.model;

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

import java.util.Map;
import java.util.Optional;

/**
 * Agent permission rules keyed by permission name.
 */
public record PermissionRuleset(Map<String, PermissionAction> rules) {

    public static final PermissionRuleset EMPTY = new PermissionRuleset(Map.of());

    public PermissionRuleset {
        rules = rules != null ? Map.copyOf(rules) : Map.of();
    }

    public Optional<PermissionAction> actionFor(String permission) {
        return Optional.ofNullable(rules.get(permission));
    }
}
