package me.golemcore.coder.port.outbound;

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
import me.golemcore.coder.domain.model.Part;

import java.util.List;

/**
 * Port for persisting assistant messages and their parts. Writes are also
 * broadcast to observers of the session.
 */
public interface SessionPort {

    /**
     * Insert or replace a part.
     */
    void updatePart(Part part);

    /**
     * Replace a streaming part and announce the text appended since the
     * previous update.
     *
     * @param part
     *            part carrying its full accumulated text
     * @param delta
     *            newly appended text
     */
    void updatePart(Part part, String delta);

    void updateMessage(AssistantMessage message);

    /**
     * Parts of a message in creation order.
     */
    List<Part> listParts(String messageId);
}
