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
import me.golemcore.handoff.domain.model.CapabilityDefinition;
import me.golemcore.handoff.domain.model.CapabilityResult;
import me.golemcore.handoff.domain.model.Project;
import me.golemcore.handoff.port.outbound.CustomerDataPort;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public class CreateProjectCapability extends AbstractCustomerCapability {

    public static final String NAME = "createProject";

    public CreateProjectCapability(String customerId, CustomerDataPort customerData, Clock clock) {
        super(customerId, customerData, clock);
    }

    @Override
    public CapabilityDefinition getDefinition() {
        return CapabilityDefinition.builder()
                .name(NAME)
                .description("Create a new product workflow project for the customer")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "name", Map.of("type", "string"),
                                "description", Map.of("type", "string"),
                                "agreementId", Map.of("type", "string")),
                        "required", List.of("name")))
                .build();
    }

    @Override
    protected CapabilityResult doExecute(CapabilityArguments args) {
        String name = args.requireString("name");
        Instant now = now();
        Project project = Project.builder()
                .id(newId())
                .name(name)
                .description(args.optionalString("description"))
                .agreementId(args.optionalString("agreementId"))
                .status(Project.STATUS_ACTIVE)
                .createdAt(now)
                .updatedAt(now)
                .build();

        customerData.update(customerId, customer -> {
            customer.getProjects().add(project);
            return customer;
        });

        return CapabilityResult.success("Created project " + project.getId(),
                Map.of("success", true, "projectId", project.getId(), "projectName", name));
    }
}
