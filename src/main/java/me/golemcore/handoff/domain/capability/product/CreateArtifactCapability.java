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

import me.golemcore.handoff.domain.capability.CapabilityArguments;
import me.golemcore.handoff.domain.model.CapabilityDefinition;
import me.golemcore.handoff.domain.model.CapabilityResult;
import me.golemcore.handoff.domain.model.WireValues;
import me.golemcore.handoff.port.outbound.CustomerDataPort;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Generic artifact creation for types without a dedicated authoring capability.
 */
public class CreateArtifactCapability extends AbstractArtifactCapability {

    public static final String NAME = "createArtifact";

    public enum ArtifactType {
        STRATEGY, RESEARCH, ROADMAP, COMPETITIVE_ANALYSIS, USER_RESEARCH, PRODUCT_SPEC, MEETING_NOTES,
        PRESENTATION, IDEATION, CUSTOM
    }

    public CreateArtifactCapability(String customerId, CustomerDataPort customerData, Clock clock) {
        super(customerId, customerData, clock);
    }

    @Override
    public CapabilityDefinition getDefinition() {
        return CapabilityDefinition.builder()
                .name(NAME)
                .description("Create a new artifact (strategy, research, roadmap, etc.) within a project. "
                        + "Write the full content in Markdown format.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "projectId", Map.of("type", "string"),
                                "type", Map.of(
                                        "type", "string",
                                        "enum", WireValues.names(ArtifactType.class)),
                                "title", Map.of("type", "string"),
                                "content", Map.of(
                                        "type", "string",
                                        "description", "The full artifact content in Markdown format")),
                        "required", List.of("projectId", "type", "title", "content")))
                .build();
    }

    @Override
    protected CapabilityResult doExecute(CapabilityArguments args) {
        String projectId = args.requireString("projectId");
        String type = args.requireEnum("type", ArtifactType.class).name().toLowerCase(Locale.ROOT);
        String title = args.requireString("title");
        String content = args.requireString("content");
        return createArtifact(projectId, type, title, content, null, "Created artifact: " + title);
    }
}
