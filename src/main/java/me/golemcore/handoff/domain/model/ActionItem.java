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
import java.time.LocalDate;
import java.util.Locale;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionItem {

    private String id;
    private Type type;
    private String description;
    private LocalDate dueDate;

    @Builder.Default
    private Status status = Status.TODO;

    private Instant createdAt;

    public enum Type {
        FOLLOW_UP, PROPOSAL, MEETING, DELIVERY, REVIEW, CUSTOM;

        @JsonValue
        public String getWireValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum Status {
        TODO, IN_PROGRESS, DONE, CANCELLED;

        @JsonValue
        public String getWireValue() {
            return name().toLowerCase(Locale.ROOT);
        }

        public boolean isOpen() {
            return this == TODO || this == IN_PROGRESS;
        }
    }
}
