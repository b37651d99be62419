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

import lombok.RequiredArgsConstructor;
import me.golemcore.handoff.domain.model.AgentIdentity;
import me.golemcore.handoff.domain.model.ConversationMessage;
import me.golemcore.handoff.infrastructure.config.HandoffProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Picks the agent that starts a turn: the agent of the most recent tagged
 * assistant message, or the configured default when there is none.
 */
@Component
@RequiredArgsConstructor
public class InitialAgentSelector {

    private final HandoffProperties properties;

    public AgentIdentity select(List<ConversationMessage> conversation) {
        for (int i = conversation.size() - 1; i >= 0; i--) {
            ConversationMessage message = conversation.get(i);
            if (message.isAssistant() && message.getAgentTag() != null) {
                return message.getAgentTag();
            }
        }
        return properties.getOrchestrator().getDefaultAgent();
    }
}
