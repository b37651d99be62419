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
package me.golemcore.handoff.domain.capability.customer;

import me.golemcore.handoff.domain.capability.AbstractCustomerCapability;
import me.golemcore.handoff.domain.capability.CapabilityArguments;
import me.golemcore.handoff.domain.model.CapabilityDefinition;
import me.golemcore.handoff.domain.model.CapabilityResult;
import me.golemcore.handoff.domain.model.CustomerEvent;
import me.golemcore.handoff.domain.model.WireValues;
import me.golemcore.handoff.port.outbound.CustomerDataPort;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Logs a customer interaction in the event log.
 */
public class CreateEventLogEntryCapability extends AbstractCustomerCapability {

    public static final String NAME = "createEventLogEntry";

    public enum EventType {
        MEETING, CALL, WORKSHOP, DECISION, DELIVERY, FEEDBACK, ESCALATION, WIN, UPDATE, ANALYSIS, PLANNING
    }

    public CreateEventLogEntryCapability(String customerId, CustomerDataPort customerData, Clock clock) {
        super(customerId, customerData, clock);
    }

    @Override
    public CapabilityDefinition getDefinition() {
        return CapabilityDefinition.builder()
                .name(NAME)
                .description("Log a customer interaction event (meeting, call, workshop, decision, delivery, "
                        + "feedback, escalation, win, update, analysis, planning)")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "eventType", Map.of(
                                        "type", "string",
                                        "enum", WireValues.names(EventType.class)),
                                "title", Map.of("type", "string"),
                                "description", Map.of("type", "string"),
                                "participants", Map.of(
                                        "type", "array",
                                        "items", Map.of("type", "string")),
                                "eventDate", Map.of(
                                        "type", "string",
                                        "description",
                                        "ISO date string for when the event occurred. Defaults to now.")),
                        "required", List.of("eventType", "title")))
                .build();
    }

    @Override
    protected CapabilityResult doExecute(CapabilityArguments args) {
        EventType eventType = args.requireEnum("eventType", EventType.class);
        String title = args.requireString("title");
        String eventDate = args.optionalString("eventDate");

        CustomerEvent event = CustomerEvent.builder()
                .id(newId())
                .eventType(eventType.name().toLowerCase(Locale.ROOT))
                .title(title)
                .description(args.optionalString("description"))
                .participants(args.optionalStringList("participants"))
                .eventDate(eventDate != null && !eventDate.isBlank() ? parseEventDate(eventDate) : now())
                .build();

        customerData.update(customerId, customer -> {
            customer.getEvents().add(event);
            return customer;
        });

        return CapabilityResult.success("Logged " + event.getEventType() + " event: " + title,
                Map.of("success", true, "eventId", event.getId()));
    }

    static Instant parseEventDate(String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            try {
                return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
            } catch (DateTimeParseException nested) {
                throw new IllegalArgumentException("Invalid eventDate: " + value, nested);
            }
        }
    }
}
