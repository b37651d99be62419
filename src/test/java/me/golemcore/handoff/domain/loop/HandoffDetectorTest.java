package me.golemcore.handoff.domain.loop;

import me.golemcore.handoff.domain.model.AgentIdentity;
import me.golemcore.handoff.domain.model.CapabilityResult;
import me.golemcore.handoff.domain.model.CapabilityResultKind;
import me.golemcore.handoff.domain.model.HandoffPayload;
import me.golemcore.handoff.domain.model.OutputEvent;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HandoffDetectorTest {

    private final HandoffDetector detector = new HandoffDetector();

    @Test
    void shouldDetectHandoffResult() {
        HandoffPayload payload = HandoffPayload.builder()
                .fromAgent(AgentIdentity.CUSTOMER_MGMT)
                .targetAgent(AgentIdentity.PRODUCT_MGMT)
                .build();

        HandoffDetection detection = detector.detect(
                OutputEvent.result("call-1", "handoff", CapabilityResult.handoff(payload)));

        assertTrue(detection.suppress());
        assertSame(payload, detection.payload());
    }

    @Test
    void shouldIgnoreOrdinaryEvents() {
        assertFalse(detector.detect(OutputEvent.textDelta("hello")).suppress());
        assertFalse(detector.detect(OutputEvent.invocation("call-1", "handoff", Map.of())).suppress());
        assertFalse(detector.detect(OutputEvent.result("call-2", "listProjects", CapabilityResult.success("ok")))
                .suppress());
        assertNull(detector.detect(null).payload());
    }

    @Test
    void shouldIgnoreHandoffKindWithoutPayload() {
        CapabilityResult result = CapabilityResult.builder().kind(CapabilityResultKind.HANDOFF).build();

        assertFalse(detector.detect(OutputEvent.result("call-1", "handoff", result)).suppress());
    }
}
