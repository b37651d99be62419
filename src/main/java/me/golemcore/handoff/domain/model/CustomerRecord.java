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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Customer workspace read and written by the domain capabilities: lifecycle
 * status, free-form profile info, the event log, action items, projects and
 * artifacts. Stored as one JSON document per customer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerRecord {

    private String id;
    private String name;

    @Builder.Default
    private Status status = Status.LEAD;

    /** Profile fields such as about, vertical, persona, icp, product, team. */
    @Builder.Default
    private Map<String, Object> info = new LinkedHashMap<>();

    @Builder.Default
    private List<CustomerEvent> events = new ArrayList<>();

    @Builder.Default
    private List<ActionItem> actionItems = new ArrayList<>();

    @Builder.Default
    private List<Project> projects = new ArrayList<>();

    @Builder.Default
    private List<Artifact> artifacts = new ArrayList<>();

    private Instant createdAt;
    private Instant updatedAt;

    public enum Status {
        LEAD, PROSPECT, NEGOTIATION, LIVE, ON_HOLD, ARCHIVE;

        @JsonValue
        public String getWireValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
