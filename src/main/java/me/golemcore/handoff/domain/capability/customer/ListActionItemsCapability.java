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
import me.golemcore.handoff.domain.model.WireValues;
import me.golemcore.handoff.port.outbound.CustomerDataPort;

import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Lists action items ordered by due date, undated items last.
 */
public class ListActionItemsCapability extends AbstractCustomerCapability {

    public static final String NAME = "listActionItems";

    public ListActionItemsCapability(String customerId, CustomerDataPort customerData, Clock clock) {
        super(customerId, customerData, clock);
    }

    @Override
    public CapabilityDefinition getDefinition() {
        return CapabilityDefinition.builder()
                .name(NAME)
                .description("List action items for the current customer. Optionally filter by status.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "status", Map.of(
                                        "type", "string",
                                        "enum", WireValues.names(ActionItem.Status.class),
                                        "description", "Filter by status. Omit to list all."))))
                .build();
    }

    @Override
    protected CapabilityResult doExecute(CapabilityArguments args) {
        ActionItem.Status filter = args.optionalEnum("status", ActionItem.Status.class, null);

        List<Map<String, Object>> items = requireCustomer().getActionItems().stream()
                .filter(item -> filter == null || item.getStatus() == filter)
                .sorted(Comparator.comparing(ActionItem::getDueDate,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .map(ListActionItemsCapability::toView)
                .collect(Collectors.toList());

        return CapabilityResult.success(items.size() + " action item(s)",
                Map.of("success", true, "count", items.size(), "action_items", items));
    }

    private static Map<String, Object> toView(ActionItem item) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", item.getId());
        view.put("type", item.getType() != null ? item.getType().getWireValue() : null);
        view.put("description", item.getDescription());
        view.put("due_date", item.getDueDate() != null ? item.getDueDate().toString() : null);
        view.put("status", item.getStatus() != null ? item.getStatus().getWireValue() : null);
        return view;
    }
}
