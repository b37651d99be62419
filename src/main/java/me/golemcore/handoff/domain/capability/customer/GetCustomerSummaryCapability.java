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
import me.golemcore.handoff.domain.model.TenantContext;
import me.golemcore.handoff.port.outbound.CustomerDataPort;
import me.golemcore.handoff.port.outbound.DomainContextPort;

import java.time.Clock;
import java.util.Map;

/**
 * Re-fetches the full customer context, for when data may have changed during
 * the conversation.
 */
public class GetCustomerSummaryCapability extends AbstractCustomerCapability {

    public static final String NAME = "getCustomerSummary";

    private final TenantContext tenant;
    private final DomainContextPort domainContext;

    public GetCustomerSummaryCapability(TenantContext tenant, CustomerDataPort customerData,
            DomainContextPort domainContext, Clock clock) {
        super(tenant.getCustomerId(), customerData, clock);
        this.tenant = tenant;
        this.domainContext = domainContext;
    }

    @Override
    public CapabilityDefinition getDefinition() {
        return CapabilityDefinition.simple(NAME,
                "Re-fetch the complete customer context including info, action items, projects and events. "
                        + "Use when data may have changed during the conversation.");
    }

    @Override
    protected CapabilityResult doExecute(CapabilityArguments args) {
        String context = domainContext.buildContext(tenant);
        return CapabilityResult.success(context, Map.of("context", context));
    }
}
