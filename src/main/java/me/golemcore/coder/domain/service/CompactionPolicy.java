package me.golemcore.coder.domain.service;

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
import me.golemcore.coder.domain.model.ModelInfo;
import me.golemcore.coder.domain.model.TokenUsage;
import me.golemcore.coder.infrastructure.config.CoderProperties;

/**
 * Tells whether the tokens of the last step leave no room in the model context
 * window, in which case the session history must be compacted.
 */
@Slf4j
public class CompactionPolicy {

    private final CoderProperties.AutoCompactProperties settings;

    public CompactionPolicy(CoderProperties.AutoCompactProperties settings) {
        this.settings = settings;
    }

    public boolean isOverflow(TokenUsage tokens, ModelInfo model) {
        if (!settings.isEnabled() || tokens == null || model == null || model.limit() == null) {
            return false;
        }
        ModelInfo.Limit limit = model.limit();
        if (limit.context() <= 0) {
            return false;
        }
        int count = tokens.input() + tokens.cacheRead() + tokens.cacheWrite() + tokens.output();
        int reserve = limit.output() > 0
                ? Math.min(limit.output(), settings.getOutputReserveTokens())
                : settings.getOutputReserveTokens();
        int usable = limit.input() > 0 ? limit.input() : limit.context() - reserve;
        double margin = settings.getSafetyMargin() > 0 && settings.getSafetyMargin() <= 1.0
                ? settings.getSafetyMargin()
                : 1.0;
        boolean overflow = count > usable * margin;
        if (overflow) {
            log.info("[Compact] {} tokens exceed usable context {} of model {}", count, usable, model.modelId());
        }
        return overflow;
    }
}
