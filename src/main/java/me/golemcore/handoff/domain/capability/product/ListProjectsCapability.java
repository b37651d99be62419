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
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class ListProjectsCapability extends AbstractCustomerCapability {

    public static final String NAME = "listProjects";

    public ListProjectsCapability(String customerId, CustomerDataPort customerData, Clock clock) {
        super(customerId, customerData, clock);
    }

    @Override
    public CapabilityDefinition getDefinition() {
        return CapabilityDefinition.simple(NAME, "List all projects for the customer");
    }

    @Override
    protected CapabilityResult doExecute(CapabilityArguments args) {
        List<Map<String, Object>> projects = requireCustomer().getProjects().stream()
                .sorted(Comparator.comparing(Project::getUpdatedAt,
                        Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
                .map(project -> {
                    Map<String, Object> view = new LinkedHashMap<>();
                    view.put("id", project.getId());
                    view.put("name", project.getName());
                    view.put("status", project.getStatus());
                    view.put("description", project.getDescription());
                    return view;
                })
                .collect(Collectors.toList());

        return CapabilityResult.success(projects.size() + " project(s)", Map.of("projects", projects));
    }
}
