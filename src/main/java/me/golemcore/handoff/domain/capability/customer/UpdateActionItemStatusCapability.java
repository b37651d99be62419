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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

public class UpdateActionItemStatusCapability extends AbstractCustomerCapability {

    public static final String NAME = "updateActionItemStatus";
    private static final int TITLE_EXCERPT_LENGTH = 60;

    public UpdateActionItemStatusCapability(String customerId, CustomerDataPort customerData, Clock clock) {
        super(customerId, customerData, clock);
    }

    @Override
    public CapabilityDefinition getDefinition() {
        return CapabilityDefinition.builder()
                .name(NAME)
                .description("Update the status of an existing action item (e.g., mark as done or in progress)")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "actionItemId", Map.of(
                                        "type", "string",
                                        "description", "The ID of the action item to update"),
                                "status", Map.of(
                                        "type", "string",
                                        "enum", WireValues.names(ActionItem.Status.class))),
                        "required", List.of("actionItemId", "status")))
                .build();
    }

    @Override
    protected CapabilityResult doExecute(CapabilityArguments args) {
        String actionItemId = args.requireString("actionItemId");
        ActionItem.Status status = args.requireEnum("status", ActionItem.Status.class);
        AtomicReference<ActionItem> updated = new AtomicReference<>();

        customerData.update(customerId, customer -> {
            customer.getActionItems().stream()
                    .filter(item -> actionItemId.equals(item.getId()))
                    .findFirst()
                    .ifPresent(item -> {
                        item.setStatus(status);
                        updated.set(item);
                        customer.getEvents().add(event(CustomerEvent.TYPE_UPDATE,
                                "Action item " + status.getWireValue() + ": "
                                        + abbreviate(item.getDescription(), TITLE_EXCERPT_LENGTH),
                                null));
                    });
            return customer;
        });

        ActionItem item = updated.get();
        if (item == null) {
            return CapabilityResult.failure("Action item not found");
        }

        Map<String, Object> actionItem = new LinkedHashMap<>();
        actionItem.put("id", item.getId());
        actionItem.put("description", item.getDescription());
        actionItem.put("type", item.getType() != null ? item.getType().getWireValue() : null);
        actionItem.put("status", status.getWireValue());
        return CapabilityResult.success("Action item " + item.getId() + " is now " + status.getWireValue(),
                Map.of("success", true, "actionItem", actionItem));
    }
}
