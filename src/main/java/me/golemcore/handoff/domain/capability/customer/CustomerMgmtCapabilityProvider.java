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

import lombok.RequiredArgsConstructor;
import me.golemcore.handoff.domain.capability.Capability;
import me.golemcore.handoff.domain.capability.DomainCapabilityProvider;
import me.golemcore.handoff.domain.model.AgentIdentity;
import me.golemcore.handoff.domain.model.TenantContext;
import me.golemcore.handoff.port.outbound.CustomerDataPort;
import me.golemcore.handoff.port.outbound.DomainContextPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Tool catalog of the Customer Management agent: lifecycle status, profile
 * info, event log and action items.
 */
@Component
@RequiredArgsConstructor
public class CustomerMgmtCapabilityProvider implements DomainCapabilityProvider {

    private final CustomerDataPort customerData;
    private final DomainContextPort domainContext;
    private final Clock clock;

    @Override
    public AgentIdentity getAgent() {
        return AgentIdentity.CUSTOMER_MGMT;
    }

    @Override
    public List<Capability> createCapabilities(TenantContext tenant) {
        String customerId = tenant.getCustomerId();
        return List.of(
                new UpdateCustomerStatusCapability(customerId, customerData, clock),
                new UpdateCustomerInfoCapability(customerId, customerData, clock),
                new CreateEventLogEntryCapability(customerId, customerData, clock),
                new GetCustomerSummaryCapability(tenant, customerData, domainContext, clock),
                new CreateActionItemCapability(customerId, customerData, clock),
                new UpdateActionItemStatusCapability(customerId, customerData, clock),
                new ListActionItemsCapability(customerId, customerData, clock));
    }
}
