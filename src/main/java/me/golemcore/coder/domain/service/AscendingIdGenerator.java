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

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;

/**
 * Generates identifiers that sort in creation order, e.g.
 * {@code prt_0192f3a4b5c60001a8Zk2Qw9}.
 */
@Component
public class AscendingIdGenerator {

    private static final char[] ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz"
            .toCharArray();
    private static final int RANDOM_LENGTH = 10;

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    private long lastMillis = -1;
    private int counter;

    public AscendingIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String next(String prefix) {
        long millis;
        int sequence;
        synchronized (this) {
            millis = Math.max(clock.millis(), lastMillis);
            if (millis == lastMillis) {
                counter++;
                if (counter > 0xffff) {
                    millis = ++lastMillis;
                    counter = 0;
                }
            } else {
                lastMillis = millis;
                counter = 0;
            }
            sequence = counter;
        }
        StringBuilder id = new StringBuilder(prefix.length() + 1 + 12 + 4 + RANDOM_LENGTH);
        id.append(prefix).append('_').append(String.format("%012x%04x", millis, sequence));
        for (int i = 0; i < RANDOM_LENGTH; i++) {
            id.append(ALPHABET[random.nextInt(ALPHABET.length)]);
        }
        return id.toString();
    }
}
