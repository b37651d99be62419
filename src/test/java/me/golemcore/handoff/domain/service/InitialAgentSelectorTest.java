package me.golemcore.handoff.domain.service;

import me.golemcore.handoff.domain.model.AgentIdentity;
import me.golemcore.handoff.domain.model.ConversationMessage;
import me.golemcore.handoff.infrastructure.config.HandoffProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class InitialAgentSelectorTest {

    private HandoffProperties properties;
    private InitialAgentSelector selector;

    @BeforeEach
    void setUp() {
        properties = new HandoffProperties();
        selector = new InitialAgentSelector(properties);
    }

    @Test
    void shouldReturnDefaultAgentWhenNoAssistantIsTagged() {
        List<ConversationMessage> conversation = List.of(
                ConversationMessage.user("hello"),
                ConversationMessage.assistant("hi", null),
                ConversationMessage.user("create a roadmap"));

        assertEquals(AgentIdentity.CUSTOMER_MGMT, selector.select(conversation));
    }

    @Test
    void shouldHonorConfiguredDefaultAgent() {
        properties.getOrchestrator().setDefaultAgent(AgentIdentity.PRODUCT_MGMT);

        assertEquals(AgentIdentity.PRODUCT_MGMT, selector.select(List.of(ConversationMessage.user("hello"))));
    }

    @Test
    void shouldPickMostRecentTaggedAssistant() {
        List<ConversationMessage> conversation = List.of(
                ConversationMessage.user("one"),
                ConversationMessage.assistant("from customer", AgentIdentity.CUSTOMER_MGMT),
                ConversationMessage.user("two"),
                ConversationMessage.assistant("from product", AgentIdentity.PRODUCT_MGMT),
                ConversationMessage.assistant("untagged", null),
                ConversationMessage.user("three"));

        assertEquals(AgentIdentity.PRODUCT_MGMT, selector.select(conversation));
    }
}
