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
package me.golemcore.handoff.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;

/**
 * A deliverable produced for a customer project. The {@code type} is a
 * lower-case artifact type such as {@code strategy} or {@code launch_plan}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Artifact {

    private String id;
    private String projectId;
    private String type;
    private String title;
    private String content;

    @Builder.Default
    private Status status = Status.DRAFT;

    private Map<String, Object> metadata;
    private Instant createdAt;
    private Instant updatedAt;

    public enum Status {
        DRAFT, IN_PROGRESS, REVIEW, FINAL, ARCHIVED;

        @JsonValue
        public String getWireValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
