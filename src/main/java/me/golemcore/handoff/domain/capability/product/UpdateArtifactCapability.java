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
import me.golemcore.handoff.domain.capability.CapabilityArguments;
import me.golemcore.handoff.domain.model.Artifact;
import me.golemcore.handoff.domain.model.CapabilityDefinition;
import me.golemcore.handoff.domain.model.CapabilityResult;
import me.golemcore.handoff.domain.model.WireValues;
import me.golemcore.handoff.port.outbound.CustomerDataPort;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Updates content, title or status of an artifact. Omitted fields keep their
 * current value.
 */
public class UpdateArtifactCapability extends AbstractCustomerCapability {

    public static final String NAME = "updateArtifact";

    public UpdateArtifactCapability(String customerId, CustomerDataPort customerData, Clock clock) {
        super(customerId, customerData, clock);
    }

    @Override
    public CapabilityDefinition getDefinition() {
        return CapabilityDefinition.builder()
                .name(NAME)
                .description("Update an existing artifact content, title, or status")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "artifactId", Map.of("type", "string"),
                                "content", Map.of(
                                        "type", "string",
                                        "description", "New content in Markdown format"),
                                "title", Map.of("type", "string"),
                                "status", Map.of(
                                        "type", "string",
                                        "enum", WireValues.names(Artifact.Status.class))),
                        "required", List.of("artifactId")))
                .build();
    }

    @Override
    protected CapabilityResult doExecute(CapabilityArguments args) {
        String artifactId = args.requireString("artifactId");
        String content = args.optionalString("content");
        String title = args.optionalString("title");
        Artifact.Status status = args.optionalEnum("status", Artifact.Status.class, null);

        AtomicBoolean found = new AtomicBoolean();
        customerData.update(customerId, customer -> {
            customer.getArtifacts().stream()
                    .filter(artifact -> artifactId.equals(artifact.getId()))
                    .findFirst()
                    .ifPresent(artifact -> {
                        found.set(true);
                        if (content != null) {
                            artifact.setContent(content);
                        }
                        if (title != null) {
                            artifact.setTitle(title);
                        }
                        if (status != null) {
                            artifact.setStatus(status);
                        }
                        artifact.setUpdatedAt(now());
                    });
            return customer;
        });

        if (!found.get()) {
            return CapabilityResult.failure("Artifact not found: " + artifactId);
        }
        return CapabilityResult.success("Updated artifact " + artifactId,
                Map.of("success", true, "artifactId", artifactId));
    }
}
