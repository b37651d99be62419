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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.handoff.domain.capability.Capability;
import me.golemcore.handoff.domain.capability.DomainCapabilityProvider;
import me.golemcore.handoff.domain.model.AgentIdentity;
import me.golemcore.handoff.domain.model.TenantContext;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Maps each agent to its {@link DomainCapabilityProvider}. Built once from the
 * provider beans; every agent must have exactly one provider.
 */
@Component
@Slf4j
public class AgentCatalog {

    private final Map<AgentIdentity, DomainCapabilityProvider> providers = new EnumMap<>(AgentIdentity.class);

    public AgentCatalog(List<DomainCapabilityProvider> providers) {
        for (DomainCapabilityProvider provider : providers) {
            DomainCapabilityProvider existing = this.providers.putIfAbsent(provider.getAgent(), provider);
            if (existing != null) {
                throw new IllegalStateException("Multiple capability providers for agent "
                        + provider.getAgent().getWireValue());
            }
        }
        for (AgentIdentity agent : AgentIdentity.values()) {
            if (!this.providers.containsKey(agent)) {
                throw new IllegalStateException("No capability provider for agent " + agent.getWireValue());
            }
        }
        log.debug("[Handoff] Agent catalog initialized with {} providers", this.providers.size());
    }

    public List<Capability> domainCapabilities(AgentIdentity agent, TenantContext tenant) {
        return providers.get(agent).createCapabilities(tenant);
    }
}
