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
import me.golemcore.handoff.domain.model.CustomerRecord;
import me.golemcore.handoff.domain.model.WireValues;
import me.golemcore.handoff.port.outbound.CustomerDataPort;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Moves the customer through the lifecycle and logs a {@code status_change}
 * event with the old and new status.
 */
public class UpdateCustomerStatusCapability extends AbstractCustomerCapability {

    public static final String NAME = "updateCustomerStatus";

    public UpdateCustomerStatusCapability(String customerId, CustomerDataPort customerData, Clock clock) {
        super(customerId, customerData, clock);
    }

    @Override
    public CapabilityDefinition getDefinition() {
        return CapabilityDefinition.builder()
                .name(NAME)
                .description("Update the customer lifecycle status (lead, prospect, negotiation, live, on_hold, archive)")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "newStatus", Map.of(
                                        "type", "string",
                                        "enum", WireValues.names(CustomerRecord.Status.class)),
                                "reason", Map.of(
                                        "type", "string",
                                        "description", "Brief explanation for the status change")),
                        "required", List.of("newStatus", "reason")))
                .build();
    }

    @Override
    protected CapabilityResult doExecute(CapabilityArguments args) {
        CustomerRecord.Status newStatus = args.requireEnum("newStatus", CustomerRecord.Status.class);
        String reason = args.requireString("reason");
        AtomicReference<CustomerRecord.Status> oldStatus = new AtomicReference<>();

        customerData.update(customerId, customer -> {
            oldStatus.set(customer.getStatus());
            customer.setStatus(newStatus);
            customer.getEvents().add(event(CustomerEvent.TYPE_STATUS_CHANGE,
                    "Status changed: " + wire(oldStatus.get()) + " → " + newStatus.getWireValue(),
                    reason));
            return customer;
        });

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("success", true);
        data.put("oldStatus", wire(oldStatus.get()));
        data.put("newStatus", newStatus.getWireValue());
        data.put("reason", reason);
        return CapabilityResult.success(
                "Status changed from " + wire(oldStatus.get()) + " to " + newStatus.getWireValue(), data);
    }

    private static String wire(CustomerRecord.Status status) {
        return status != null ? status.getWireValue() : "unknown";
    }
}
