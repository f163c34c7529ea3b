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

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Files changed in the working directory between two snapshots.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class PatchPart extends Part {

    private String hash;
    private List<String> files;

    public PatchPart(String id, String messageId, String sessionId, Patch patch) {
        super(id, messageId, sessionId);
        this.hash = patch.hash();
        this.files = patch.files();
    }

    @Override
    public PartType type() {
        return PartType.PATCH;
    }
}
