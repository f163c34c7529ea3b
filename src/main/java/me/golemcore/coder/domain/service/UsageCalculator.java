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

import lombok.Builder;
import me.golemcore.coder.domain.model.ModelInfo;
import me.golemcore.coder.domain.model.StepUsage;
import me.golemcore.coder.domain.model.TokenUsage;
import org.springframework.stereotype.Component;

/**
 * Converts raw step usage into message token counters and cost in USD.
 */
@Component
public class UsageCalculator {

    private static final double TOKENS_PER_PRICE_UNIT = 1_000_000.0;

    @Builder
    public record StepCost(TokenUsage tokens, double cost) {
    }

    public StepCost calculate(StepUsage usage, ModelInfo model) {
        if (usage == null) {
            return new StepCost(TokenUsage.EMPTY, 0.0);
        }
        int cacheRead = safe(usage.cacheReadTokens());
        int cacheWrite = safe(usage.cacheWriteTokens());
        int input = Math.max(0, safe(usage.inputTokens()) - cacheRead - cacheWrite);
        int output = safe(usage.outputTokens());
        int reasoning = safe(usage.reasoningTokens());
        TokenUsage tokens = new TokenUsage(input, output, reasoning, cacheRead, cacheWrite);

        ModelInfo.Cost prices = model != null && model.cost() != null ? model.cost() : ModelInfo.Cost.FREE;
        double cost = (input * price(prices.input())
                + output * price(prices.output())
                + reasoning * price(prices.output())
                + cacheRead * price(prices.cacheRead())
                + cacheWrite * price(prices.cacheWrite())) / TOKENS_PER_PRICE_UNIT;
        return new StepCost(tokens, Double.isFinite(cost) ? cost : 0.0);
    }

    private static int safe(long value) {
        if (value <= 0) {
            return 0;
        }
        return (int) Math.min(value, Integer.MAX_VALUE);
    }

    private static double price(double value) {
        return Double.isFinite(value) && value > 0 ? value : 0.0;
    }
}
