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
import me.golemcore.handoff.domain.model.ActionItem;
import me.golemcore.handoff.domain.model.CapabilityDefinition;
import me.golemcore.handoff.domain.model.CapabilityResult;
import me.golemcore.handoff.domain.model.CustomerEvent;
import me.golemcore.handoff.domain.model.WireValues;
import me.golemcore.handoff.port.outbound.CustomerDataPort;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Creates an action item and logs an {@code update} event for it.
 */
public class CreateActionItemCapability extends AbstractCustomerCapability {

    public static final String NAME = "createActionItem";
    private static final int TITLE_EXCERPT_LENGTH = 60;

    public CreateActionItemCapability(String customerId, CustomerDataPort customerData, Clock clock) {
        super(customerId, customerData, clock);
    }

    @Override
    public CapabilityDefinition getDefinition() {
        return CapabilityDefinition.builder()
                .name(NAME)
                .description("Create a new action item for the current customer. "
                        + "Use for follow-ups, proposals, meetings, deliveries, or reviews.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "type", Map.of(
                                        "type", "string",
                                        "enum", WireValues.names(ActionItem.Type.class),
                                        "description", "Defaults to follow_up"),
                                "description", Map.of(
                                        "type", "string",
                                        "description", "What needs to happen"),
                                "due_date", Map.of(
                                        "type", "string",
                                        "description", "ISO date string (YYYY-MM-DD) for when this is due"),
                                "status", Map.of(
                                        "type", "string",
                                        "enum", WireValues.names(ActionItem.Status.class),
                                        "description", "Defaults to todo")),
                        "required", List.of("description")))
                .build();
    }

    @Override
    protected CapabilityResult doExecute(CapabilityArguments args) {
        ActionItem.Type type = args.optionalEnum("type", ActionItem.Type.class, ActionItem.Type.FOLLOW_UP);
        ActionItem.Status status = args.optionalEnum("status", ActionItem.Status.class, ActionItem.Status.TODO);
        String description = args.requireString("description");
        LocalDate dueDate = parseDueDate(args.optionalString("due_date"));

        ActionItem item = ActionItem.builder()
                .id(newId())
                .type(type)
                .description(description)
                .dueDate(dueDate)
                .status(status)
                .createdAt(now())
                .build();

        customerData.update(customerId, customer -> {
            customer.getActionItems().add(item);
            customer.getEvents().add(event(CustomerEvent.TYPE_UPDATE,
                    "Action item created: " + abbreviate(description, TITLE_EXCERPT_LENGTH),
                    "Type: " + type.getWireValue() + (dueDate != null ? ", Due: " + dueDate : "")));
            return customer;
        });

        Map<String, Object> actionItem = new LinkedHashMap<>();
        actionItem.put("id", item.getId());
        actionItem.put("type", type.getWireValue());
        actionItem.put("description", description);
        actionItem.put("due_date", dueDate != null ? dueDate.toString() : null);
        actionItem.put("status", status.getWireValue());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("success", true);
        data.put("actionItem", actionItem);
        return CapabilityResult.success("Created action item " + item.getId(), data);
    }

    private static LocalDate parseDueDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid due_date: " + value + ". Expected YYYY-MM-DD", e);
        }
    }
}
