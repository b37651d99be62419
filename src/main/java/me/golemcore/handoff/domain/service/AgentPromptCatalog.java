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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.handoff.domain.model.AgentIdentity;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Map;

/**
 * Base system prompts of the agents, loaded from
 * {@code classpath:prompts/<agent>.md} at startup.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AgentPromptCatalog {

    private static final String PROMPT_LOCATION = "classpath:prompts/%s.md";

    private final ResourceLoader resourceLoader;
    private final Map<AgentIdentity, String> prompts = new EnumMap<>(AgentIdentity.class);

    @PostConstruct
    public void init() {
        for (AgentIdentity agent : AgentIdentity.values()) {
            prompts.put(agent, load(agent));
        }
        log.info("[Handoff] Loaded {} agent prompts", prompts.size());
    }

    public String basePrompt(AgentIdentity agent) {
        String prompt = prompts.get(agent);
        if (prompt == null) {
            throw new IllegalStateException("No prompt loaded for agent " + agent.getWireValue());
        }
        return prompt;
    }

    private String load(AgentIdentity agent) {
        Resource resource = resourceLoader.getResource(String.format(PROMPT_LOCATION, agent.getWireValue()));
        if (!resource.exists()) {
            throw new IllegalStateException("Prompt resource not found: " + resource.getDescription());
        }
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read prompt for agent " + agent.getWireValue(), e);
        }
    }
}
