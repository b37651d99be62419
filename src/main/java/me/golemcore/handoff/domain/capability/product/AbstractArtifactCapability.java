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

import me.golemcore.handoff.domain.capability.AbstractCustomerCapability;
import me.golemcore.handoff.domain.model.Artifact;
import me.golemcore.handoff.domain.model.CapabilityResult;
import me.golemcore.handoff.domain.model.CustomerEvent;
import me.golemcore.handoff.port.outbound.CustomerDataPort;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Base class for capabilities that write a draft artifact into a project and
 * record a {@code delivery} event for it.
 */
public abstract class AbstractArtifactCapability extends AbstractCustomerCapability {

    protected AbstractArtifactCapability(String customerId, CustomerDataPort customerData, Clock clock) {
        super(customerId, customerData, clock);
    }

    protected CapabilityResult createArtifact(String projectId, String type, String title, String content,
            Map<String, Object> metadata, String eventTitle) {
        Instant now = now();
        Artifact artifact = Artifact.builder()
                .id(newId())
                .projectId(projectId)
                .type(type)
                .title(title)
                .content(content)
                .status(Artifact.Status.DRAFT)
                .metadata(metadata)
                .createdAt(now)
                .updatedAt(now)
                .build();

        AtomicBoolean projectFound = new AtomicBoolean();
        customerData.update(customerId, customer -> {
            boolean exists = customer.getProjects().stream().anyMatch(p -> projectId.equals(p.getId()));
            projectFound.set(exists);
            if (exists) {
                customer.getArtifacts().add(artifact);
            }
            return customer;
        });
        if (!projectFound.get()) {
            return CapabilityResult.failure("Project not found: " + projectId);
        }

        logEventBestEffort(event(CustomerEvent.TYPE_DELIVERY, eventTitle, "Type: " + type));

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("success", true);
        data.put("artifactId", artifact.getId());
        data.put("title", title);
        data.put("type", type);
        data.put("projectId", projectId);
        return CapabilityResult.success("Created " + type + " artifact " + artifact.getId(), data);
    }
}
