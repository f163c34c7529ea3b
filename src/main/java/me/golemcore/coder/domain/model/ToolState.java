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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolState {

    private ToolStatus status;
    private Map<String, Object> input;
    private String raw;
    private String output;
    private String title;
    private String error;
    private Map<String, Object> metadata;
    private List<ToolAttachment> attachments;
    private PartTime time;

    public static ToolState pending() {
        return ToolState.builder()
                .status(ToolStatus.PENDING)
                .input(Map.of())
                .raw("")
                .build();
    }

    @JsonIgnore
    public boolean isFinal() {
        return status != null && status.isFinal();
    }
}
