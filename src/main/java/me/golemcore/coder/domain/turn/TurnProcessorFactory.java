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

import me.golemcore.coder.domain.model.AssistantMessage;
import me.golemcore.coder.domain.model.ModelInfo;
import me.golemcore.coder.domain.model.PermissionRuleset;

/**
 * Creates one {@link TurnProcessor} per assistant turn.
 */
public class TurnProcessorFactory {

    private final TurnDependencies dependencies;

    public TurnProcessorFactory(TurnDependencies dependencies) {
        this.dependencies = dependencies;
    }

    public TurnProcessor create(AssistantMessage message, ModelInfo model, PermissionRuleset ruleset,
            TurnCancellation cancellation) {
        return new TurnProcessor(message, model, ruleset, cancellation, dependencies);
    }
}
