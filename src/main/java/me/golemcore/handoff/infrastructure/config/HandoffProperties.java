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
package me.golemcore.handoff.infrastructure.config;

import lombok.Data;
import me.golemcore.handoff.domain.model.AgentIdentity;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code handoff.*} prefix:
 * <ul>
 * <li>{@link OrchestratorProperties} - handoff loop bounds and gap
 * detection</li>
 * <li>{@link LlmProperties} - model provider settings</li>
 * <li>{@link StorageProperties} - local persistence</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "handoff")
@Data
public class HandoffProperties {

    private OrchestratorProperties orchestrator = new OrchestratorProperties();
    private LlmProperties llm = new LlmProperties();
    private StorageProperties storage = new StorageProperties();

    @Data
    public static class OrchestratorProperties {
        private int maxHandoffs = 2;
        private int maxStepsPerSession = 10;
        private AgentIdentity defaultAgent = AgentIdentity.CUSTOMER_MGMT;
        private Set<String> readOnlyCapabilities = new LinkedHashSet<>(
                List.of("listProjects", "listArtifacts", "handoff"));
        private Set<AgentIdentity> gapDetectionAgents = new LinkedHashSet<>(List.of(AgentIdentity.PRODUCT_MGMT));
        private int gapMinMessageLength = 20;
        private int gapDescriptionMaxChars = 500;
        private int contextCharBudget = 12000;
    }

    @Data
    public static class LlmProperties {
        private String provider = "anthropic";
        private String model = "claude-sonnet-4-20250514";
        private String apiKey;
        private String baseUrl;
        private long timeoutMs = 120000;
        private int maxTokens = 16384;
        private double temperature = 0.7;
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/handoff";
    }
}
