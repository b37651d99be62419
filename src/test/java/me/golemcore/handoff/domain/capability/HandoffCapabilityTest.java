package me.golemcore.handoff.domain.capability;

import me.golemcore.handoff.domain.model.AgentIdentity;
import me.golemcore.handoff.domain.model.CapabilityDefinition;
import me.golemcore.handoff.domain.model.CapabilityResult;
import me.golemcore.handoff.domain.model.CapabilityResultKind;
import me.golemcore.handoff.domain.model.HandoffPayload;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HandoffCapabilityTest {

    @Test
    void shouldTargetOtherAgent() {
        assertEquals(AgentIdentity.PRODUCT_MGMT, new HandoffCapability(AgentIdentity.CUSTOMER_MGMT, null).getTarget());
        assertEquals(AgentIdentity.CUSTOMER_MGMT, new HandoffCapability(AgentIdentity.PRODUCT_MGMT, null).getTarget());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldRequireReasonSummaryAndPendingRequest() {
        CapabilityDefinition definition = new HandoffCapability(AgentIdentity.CUSTOMER_MGMT, null).getDefinition();

        assertEquals("handoff", definition.getName());
        assertEquals(List.of("reason", "summary", "pendingRequest"), definition.getInputSchema().get("required"));
        assertTrue(((Map<String, Object>) definition.getInputSchema().get("properties")).containsKey("summary"));
        assertTrue(definition.getDescription().startsWith("Transfer the conversation to the Product Management Agent."));
        assertFalse(definition.getDescription().contains("WARNING"));
    }

    @Test
    void shouldProduceTaggedHandoffResult() throws Exception {
        HandoffCapability capability = new HandoffCapability(AgentIdentity.CUSTOMER_MGMT, null);

        CapabilityResult result = capability.execute(Map.of(
                "reason", "needs artifacts",
                "summary", "talked about Q3",
                "pendingRequest", "create a roadmap")).get();

        assertEquals(CapabilityResultKind.HANDOFF, result.getKind());
        assertTrue(result.isHandoff());
        assertEquals("Transferring to Product Management Agent", result.getOutput());
        HandoffPayload payload = result.getHandoffPayload();
        assertEquals(AgentIdentity.PRODUCT_MGMT, payload.getTargetAgent());
        assertEquals(AgentIdentity.CUSTOMER_MGMT, payload.getFromAgent());
        assertEquals("needs artifacts", payload.getReason());
        assertEquals("talked about Q3", payload.getSummary());
        assertEquals("create a roadmap", payload.getPendingRequest());
    }

    @Test
    void shouldTolerateMissingArguments() throws Exception {
        CapabilityResult result = new HandoffCapability(AgentIdentity.PRODUCT_MGMT, null).execute(null).get();

        assertTrue(result.isHandoff());
        assertEquals("", result.getHandoffPayload().getReason());
    }
}
