package me.golemcore.handoff.domain.loop;

import me.golemcore.handoff.domain.model.AgentIdentity;
import me.golemcore.handoff.domain.model.CapabilityResult;
import me.golemcore.handoff.domain.model.HandoffPayload;
import me.golemcore.handoff.domain.model.OutputEvent;
import me.golemcore.handoff.domain.model.OutputEventType;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StreamComposerTest {

    private final StreamComposer composer = new StreamComposer(new HandoffDetector());

    @Test
    void shouldForwardEverythingWithoutHandoff() {
        Flux<OutputEvent> events = Flux.just(
                OutputEvent.textDelta("hi"),
                OutputEvent.stepFinished(0, OutputEvent.FINISH_STOP),
                OutputEvent.streamFinished(OutputEvent.FINISH_STOP, AgentIdentity.CUSTOMER_MGMT));
        List<HandoffPayload> detected = new ArrayList<>();

        StepVerifier.create(composer.compose(events, detected::add))
                .expectNextCount(3)
                .verifyComplete();
        assertTrue(detected.isEmpty());
    }

    @Test
    void shouldSuppressHandoffResultAndCancelUpstreamBeforeNextEvent() {
        HandoffPayload payload = HandoffPayload.builder()
                .fromAgent(AgentIdentity.CUSTOMER_MGMT)
                .targetAgent(AgentIdentity.PRODUCT_MGMT)
                .build();
        List<String> log = new ArrayList<>();
        AtomicBoolean cancelled = new AtomicBoolean();

        Flux<OutputEvent> events = Flux.just(
                OutputEvent.invocation("c1", "handoff", Map.of()),
                OutputEvent.result("c1", "handoff", CapabilityResult.handoff(payload)),
                OutputEvent.stepFinished(0, OutputEvent.FINISH_TOOL_CALLS),
                OutputEvent.textDelta("never"))
                .doOnNext(event -> log.add("produced " + event.getType().getWireValue()))
                .doOnCancel(() -> cancelled.set(true));

        StepVerifier.create(composer.compose(events, p -> log.add("cancel " + p.getTargetAgent().getWireValue())))
                .assertNext(event -> assertEquals(OutputEventType.CAPABILITY_INVOCATION, event.getType()))
                .verifyComplete();

        assertTrue(cancelled.get());
        assertEquals(List.of(
                "produced capability-invocation",
                "produced capability-result",
                "cancel product_mgmt"), log);
    }
}
