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
package me.golemcore.handoff.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Canonical conversation message produced by
 * {@link me.golemcore.handoff.domain.service.ConversationNormalizer}. Immutable
 * for the duration of one request.
 */
@Value
@Builder
public class ConversationMessage {

    MessageRole role;

    @Builder.Default
    String text = "";

    /** Agent that authored an assistant message, if the client recorded one. */
    AgentIdentity agentTag;

    public boolean isUser() {
        return role == MessageRole.USER;
    }

    public boolean isAssistant() {
        return role == MessageRole.ASSISTANT;
    }

    public static ConversationMessage user(String text) {
        return ConversationMessage.builder().role(MessageRole.USER).text(text).build();
    }

    public static ConversationMessage assistant(String text, AgentIdentity agentTag) {
        return ConversationMessage.builder().role(MessageRole.ASSISTANT).text(text).agentTag(agentTag).build();
    }
}
