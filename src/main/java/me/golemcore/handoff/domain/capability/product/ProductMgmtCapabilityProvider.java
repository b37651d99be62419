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
package me.golemcore.handoff.domain.capability.product;

import lombok.RequiredArgsConstructor;
import me.golemcore.handoff.domain.capability.Capability;
import me.golemcore.handoff.domain.capability.DomainCapabilityProvider;
import me.golemcore.handoff.domain.model.AgentIdentity;
import me.golemcore.handoff.domain.model.TenantContext;
import me.golemcore.handoff.port.outbound.CustomerDataPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Tool catalog of the Product Management agent: project and artifact
 * workspace tools followed by the authoring capabilities.
 */
@Component
@RequiredArgsConstructor
public class ProductMgmtCapabilityProvider implements DomainCapabilityProvider {

    private final CustomerDataPort customerData;
    private final Clock clock;

    @Override
    public AgentIdentity getAgent() {
        return AgentIdentity.PRODUCT_MGMT;
    }

    @Override
    public List<Capability> createCapabilities(TenantContext tenant) {
        String customerId = tenant.getCustomerId();
        List<Capability> capabilities = new ArrayList<>();
        capabilities.add(new CreateProjectCapability(customerId, customerData, clock));
        capabilities.add(new CreateArtifactCapability(customerId, customerData, clock));
        capabilities.add(new UpdateArtifactCapability(customerId, customerData, clock));
        capabilities.add(new ListProjectsCapability(customerId, customerData, clock));
        capabilities.add(new ListArtifactsCapability(customerId, customerData, clock));
        for (ArtifactAuthoring authoring : ArtifactAuthoring.values()) {
            capabilities.add(new ArtifactAuthoringCapability(authoring, customerId, customerData, clock));
        }
        return capabilities;
    }
}
