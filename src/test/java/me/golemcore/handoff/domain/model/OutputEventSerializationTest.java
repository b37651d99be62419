package me.golemcore.handoff.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.handoff.infrastructure.config.OrchestratorConfiguration;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutputEventSerializationTest {

    private final ObjectMapper objectMapper = OrchestratorConfiguration.objectMapper();

    @Test
    void shouldWriteTextDeltaWithoutAbsentFields() {
        JsonNode json = objectMapper.valueToTree(OutputEvent.textDelta("Hello"));

        assertEquals("text-delta", json.get("type").asText());
        assertEquals("Hello", json.get("text").asText());
        assertFalse(json.has("agent"));
        assertFalse(json.has("callId"));
    }

    @Test
    void shouldWriteAgentOnStreamFinished() {
        JsonNode json = objectMapper.valueToTree(
                OutputEvent.streamFinished(OutputEvent.FINISH_MAX_STEPS, AgentIdentity.PRODUCT_MGMT));

        assertEquals("stream-finished", json.get("type").asText());
        assertEquals("max-steps", json.get("finishReason").asText());
        assertEquals("product_mgmt", json.get("agent").asText());
    }

    @Test
    void shouldWriteCapabilityResultKindInLowerCase() {
        JsonNode json = objectMapper.valueToTree(
                OutputEvent.result("call-1", "listProjects", CapabilityResult.failure("Customer not found")));

        JsonNode result = json.get("result");
        assertEquals("error", result.get("kind").asText());
        assertEquals("Customer not found", result.get("error").asText());
        assertFalse(result.get("success").asBoolean());
    }

    @Test
    void shouldNotExposeHandoffFlag() {
        HandoffPayload payload = HandoffPayload.builder()
                .targetAgent(AgentIdentity.PRODUCT_MGMT)
                .fromAgent(AgentIdentity.CUSTOMER_MGMT)
                .reason("needs a PRD")
                .summary("Customer wants a PRD")
                .build();

        JsonNode json = objectMapper.valueToTree(CapabilityResult.handoff(payload));

        assertEquals("handoff", json.get("kind").asText());
        assertFalse(json.has("handoff"));
        assertTrue(json.get("output").asText().contains("Product Management"));
    }

    @Test
    void shouldWriteInvocationArguments() {
        JsonNode json = objectMapper.valueToTree(
                OutputEvent.invocation("call-2", "createProject", Map.of("name", "Onboarding")));

        assertEquals("capability-invocation", json.get("type").asText());
        assertEquals("Onboarding", json.get("arguments").get("name").asText());
    }
}
