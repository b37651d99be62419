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
import me.golemcore.handoff.port.outbound.CustomerDataPort;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges key-value pairs into the customer's profile info. Keys not mentioned
 * are left untouched.
 */
public class UpdateCustomerInfoCapability extends AbstractCustomerCapability {

    public static final String NAME = "updateCustomerInfo";

    public UpdateCustomerInfoCapability(String customerId, CustomerDataPort customerData, Clock clock) {
        super(customerId, customerData, clock);
    }

    @Override
    public CapabilityDefinition getDefinition() {
        return CapabilityDefinition.builder()
                .name(NAME)
                .description("Update customer information fields (about, vertical, persona, icp, product). "
                        + "Fields are merged into the existing info.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "updates", Map.of(
                                        "type", "object",
                                        "description", "Key-value pairs of info fields to update "
                                                + "(e.g., { \"vertical\": \"SaaS\", \"persona\": \"VP Product\" })")),
                        "required", List.of("updates")))
                .build();
    }

    @Override
    protected CapabilityResult doExecute(CapabilityArguments args) {
        Map<String, Object> updates = args.requireObject("updates");
        if (updates.isEmpty()) {
            return CapabilityResult.failure("updates must contain at least one field");
        }

        customerData.update(customerId, customer -> {
            Map<String, Object> info = customer.getInfo() != null
                    ? new LinkedHashMap<>(customer.getInfo())
                    : new LinkedHashMap<>();
            info.putAll(updates);
            customer.setInfo(info);
            return customer;
        });

        List<String> updatedFields = new ArrayList<>(updates.keySet());
        return CapabilityResult.success("Updated fields: " + String.join(", ", updatedFields),
                Map.of("success", true, "updatedFields", updatedFields));
    }
}
