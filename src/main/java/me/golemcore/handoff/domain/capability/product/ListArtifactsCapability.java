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
import me.golemcore.handoff.port.outbound.CustomerDataPort;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class ListArtifactsCapability extends AbstractCustomerCapability {

    public static final String NAME = "listArtifacts";

    public ListArtifactsCapability(String customerId, CustomerDataPort customerData, Clock clock) {
        super(customerId, customerData, clock);
    }

    @Override
    public CapabilityDefinition getDefinition() {
        return CapabilityDefinition.builder()
                .name(NAME)
                .description("List artifacts in a project or all artifacts for the customer")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "projectId", Map.of("type", "string"))))
                .build();
    }

    @Override
    protected CapabilityResult doExecute(CapabilityArguments args) {
        String projectId = args.optionalString("projectId");

        List<Map<String, Object>> artifacts = requireCustomer().getArtifacts().stream()
                .filter(artifact -> projectId == null || projectId.equals(artifact.getProjectId()))
                .sorted(Comparator.comparing(Artifact::getUpdatedAt,
                        Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
                .map(artifact -> {
                    Map<String, Object> view = new LinkedHashMap<>();
                    view.put("id", artifact.getId());
                    view.put("title", artifact.getTitle());
                    view.put("type", artifact.getType());
                    view.put("status", artifact.getStatus() != null ? artifact.getStatus().getWireValue() : null);
                    view.put("project_id", artifact.getProjectId());
                    view.put("updated_at", artifact.getUpdatedAt() != null ? artifact.getUpdatedAt().toString() : null);
                    return view;
                })
                .collect(Collectors.toList());

        return CapabilityResult.success(artifacts.size() + " artifact(s)", Map.of("artifacts", artifacts));
    }
}
