package me.golemcore.handoff.domain.session;

import lombok.Builder;
import lombok.Value;
import me.golemcore.handoff.domain.capability.CapabilitySet;
import me.golemcore.handoff.domain.model.AgentIdentity;
import me.golemcore.handoff.domain.model.ConversationMessage;

import java.util.List;

/**
 * Everything one generation session runs against. Fixed for the lifetime of
 * the session.
 */
@Value
@Builder
public class GenerationRequest {

    AgentIdentity agent;
    String systemPrompt;
    List<ConversationMessage> history;
    CapabilitySet capabilities;
    int maxSteps;
}
