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
import me.golemcore.handoff.domain.model.HandoffPayload;
import org.springframework.stereotype.Component;

/**
 * Builds the system prompt of one loop iteration: the agent's base prompt, the
 * domain context and, right after a handoff, a {@code ## Handoff Context}
 * section carrying the payload.
 */
@Component
@RequiredArgsConstructor
public class PromptComposer {

    private final AgentPromptCatalog promptCatalog;

    public String compose(AgentIdentity agent, String domainContext, HandoffPayload handoff) {
        StringBuilder prompt = new StringBuilder(promptCatalog.basePrompt(agent))
                .append("\n\n")
                .append(domainContext != null ? domainContext : "");
        if (handoff != null) {
            prompt.append("\n\n").append(handoffSection(handoff));
        }
        return prompt.toString();
    }

    private String handoffSection(HandoffPayload handoff) {
        return "## Handoff Context\n"
                + "You received this conversation from the " + handoff.getFromAgent().getLabel() + " Agent.\n"
                + "**Reason for transfer**: " + handoff.getReason() + "\n"
                + "**Conversation summary**: " + handoff.getSummary() + "\n"
                + "**User's pending request**: " + handoff.getPendingRequest() + "\n\n"
                + "Address the user's pending request directly. "
                + "Do not mention the handoff or the other agent to the user.";
    }
}
