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
import me.golemcore.handoff.port.outbound.CustomerDataPort;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One authoring capability of the {@link ArtifactAuthoring} catalog. The model
 * writes the full Markdown content; the capability stores it as a draft
 * artifact of the catalog's type.
 */
public class ArtifactAuthoringCapability extends AbstractArtifactCapability {

    private final ArtifactAuthoring authoring;

    public ArtifactAuthoringCapability(ArtifactAuthoring authoring, String customerId,
            CustomerDataPort customerData, Clock clock) {
        super(customerId, customerData, clock);
        this.authoring = authoring;
    }

    @Override
    public CapabilityDefinition getDefinition() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("projectId", Map.of("type", "string"));
        properties.put("title", Map.of("type", "string"));
        properties.put("content", Map.of(
                "type", "string",
                "description", "Full Markdown " + authoring.getArtifactType().replace('_', ' ')
                        + " content. Aim for 1500-3000 words."));
        for (ArtifactAuthoring.MetadataField field : authoring.getMetadataFields()) {
            properties.put(field.name(), field.schema());
        }

        return CapabilityDefinition.builder()
                .name(authoring.getCapabilityName())
                .description(authoring.getDescription())
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", properties,
                        "required", List.of("projectId", "title", "content")))
                .build();
    }

    @Override
    protected CapabilityResult doExecute(CapabilityArguments args) {
        String projectId = args.requireString("projectId");
        String title = args.requireString("title");
        String content = args.requireString("content");

        Map<String, Object> metadata = new LinkedHashMap<>();
        for (ArtifactAuthoring.MetadataField field : authoring.getMetadataFields()) {
            Object value = args.raw(field.name());
            if (value != null) {
                metadata.put(field.name(), value);
            }
        }

        String type = authoring.getArtifactType();
        return createArtifact(projectId, type, title, content, metadata.isEmpty() ? null : metadata,
                "Created " + type + ": " + title);
    }
}
