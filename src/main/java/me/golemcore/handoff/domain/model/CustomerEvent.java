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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Entry of the customer event log. {@code eventType} is a lower-case type such
 * as {@code meeting}, {@code delivery} or {@code status_change}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerEvent {

    public static final String TYPE_STATUS_CHANGE = "status_change";
    public static final String TYPE_DELIVERY = "delivery";
    public static final String TYPE_UPDATE = "update";

    private String id;
    private String eventType;
    private String title;
    private String description;
    private List<String> participants;
    private Instant eventDate;
}
