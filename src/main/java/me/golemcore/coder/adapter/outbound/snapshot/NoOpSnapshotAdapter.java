package me.golemcore.coder.adapter.outbound.snapshot;

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

import me.golemcore.coder.domain.model.Patch;
import me.golemcore.coder.port.outbound.SnapshotPort;
import org.springframework.stereotype.Component;

/**
 * Snapshot adapter used when the working directory is not tracked. No snapshot
 * is ever taken, so no patch parts are recorded.
 */
@Component
public class NoOpSnapshotAdapter implements SnapshotPort {

    @Override
    public String track() {
        return null;
    }

    @Override
    public Patch patch(String snapshot) {
        return Patch.empty();
    }
}
