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
package me.golemcore.handoff.domain.service;

import lombok.RequiredArgsConstructor;
import me.golemcore.handoff.domain.capability.CapabilitySet;
import me.golemcore.handoff.domain.capability.HandoffCapability;
import me.golemcore.handoff.domain.model.AgentIdentity;
import me.golemcore.handoff.domain.model.TenantContext;
import org.springframework.stereotype.Component;

/**
 * Assembles the capabilities offered to one generation session: the agent's
 * domain tools plus, while handoffs remain, a {@link HandoffCapability}
 * targeting the other agent.
 */
@Component
@RequiredArgsConstructor
public class CapabilitySetBuilder {

    private final AgentCatalog agentCatalog;

    /**
     * @param previousAgent
     *            agent that handed off to {@code agent} in this request, or
     *            {@code null}; drives the warning against handing straight back
     * @throws IllegalStateException
     *             if two capabilities share a name
     */
    public CapabilitySet build(AgentIdentity agent, TenantContext tenant, boolean handoffAllowed,
            AgentIdentity previousAgent) {
        CapabilitySet.Builder builder = CapabilitySet.builder()
                .addAll(agentCatalog.domainCapabilities(agent, tenant));
        if (handoffAllowed) {
            builder.add(new HandoffCapability(agent, previousAgent));
        }
        return builder.build();
    }
}
