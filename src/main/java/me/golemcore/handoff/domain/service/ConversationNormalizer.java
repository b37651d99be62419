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

import me.golemcore.handoff.domain.model.AgentIdentity;
import me.golemcore.handoff.domain.model.ConversationMessage;
import me.golemcore.handoff.domain.model.InboundMessage;
import me.golemcore.handoff.domain.model.MessagePart;
import me.golemcore.handoff.domain.model.MessageRole;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Converts inbound client messages into canonical {@link ConversationMessage}s.
 *
 * <p>
 * Text resolution order: the flat {@code content} when non-empty, otherwise the
 * {@code text} parts joined with newlines, otherwise the empty string. Other
 * part types are dropped. The transformation is pure and idempotent.
 *
 * <p>
 * Structurally invalid input is rejected with {@link IllegalArgumentException}
 * before any generation starts.
 */
@Component
public class ConversationNormalizer {

    public List<ConversationMessage> normalize(List<InboundMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("Conversation must contain at least one message");
        }
        List<ConversationMessage> result = new ArrayList<>(messages.size());
        for (int i = 0; i < messages.size(); i++) {
            InboundMessage message = messages.get(i);
            if (message == null) {
                throw new IllegalArgumentException("Message at index " + i + " is null");
            }
            result.add(normalize(message, i));
        }
        return result;
    }

    private ConversationMessage normalize(InboundMessage message, int index) {
        if (message.getContent() == null && message.getParts() == null) {
            throw new IllegalArgumentException("Message at index " + index + " has neither content nor parts");
        }
        MessageRole role = MessageRole.fromWire(message.getRole());
        return ConversationMessage.builder()
                .role(role)
                .text(resolveText(message))
                .agentTag(resolveAgentTag(message))
                .build();
    }

    private String resolveText(InboundMessage message) {
        String content = message.getContent();
        if (content != null && !content.isEmpty()) {
            return content;
        }
        if (message.getParts() == null) {
            return "";
        }
        return message.getParts().stream()
                .filter(part -> part != null && part.isText())
                .map(MessagePart::getText)
                .map(text -> text != null ? text : "")
                .collect(Collectors.joining("\n"));
    }

    private AgentIdentity resolveAgentTag(InboundMessage message) {
        InboundMessage.Metadata metadata = message.getMetadata();
        if (metadata == null || metadata.getAgentType() == null || metadata.getAgentType().isBlank()) {
            return null;
        }
        return AgentIdentity.fromWire(metadata.getAgentType());
    }
}
