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
package me.golemcore.handoff.domain.loop;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.handoff.domain.capability.CapabilitySet;
import me.golemcore.handoff.domain.model.AgentIdentity;
import me.golemcore.handoff.domain.model.ConversationMessage;
import me.golemcore.handoff.domain.model.HandoffPayload;
import me.golemcore.handoff.domain.model.InboundMessage;
import me.golemcore.handoff.domain.model.LoopPhase;
import me.golemcore.handoff.domain.model.LoopState;
import me.golemcore.handoff.domain.model.OutputEvent;
import me.golemcore.handoff.domain.model.OutputEventType;
import me.golemcore.handoff.domain.model.TenantContext;
import me.golemcore.handoff.domain.service.CapabilitySetBuilder;
import me.golemcore.handoff.domain.service.ConversationNormalizer;
import me.golemcore.handoff.domain.service.GapTelemetryRecorder;
import me.golemcore.handoff.domain.service.InitialAgentSelector;
import me.golemcore.handoff.domain.service.PromptComposer;
import me.golemcore.handoff.domain.session.CancellationToken;
import me.golemcore.handoff.domain.session.GenerationRequest;
import me.golemcore.handoff.domain.session.GenerationSession;
import me.golemcore.handoff.domain.session.GenerationSessionFactory;
import me.golemcore.handoff.infrastructure.config.HandoffProperties;
import me.golemcore.handoff.port.outbound.DomainContextPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;
import reactor.core.scheduler.Scheduler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one user turn across the two agents and returns a single output stream.
 *
 * <p>
 * State machine: {@code SELECTING -> GENERATING -> (COMPLETING | HANDING_OFF)},
 * where {@code HANDING_OFF} returns to {@code GENERATING} with the other agent.
 * Each iteration:
 * <ol>
 * <li>offers the handoff capability only while {@code handoffCount <
 * maxHandoffs}</li>
 * <li>builds capabilities and prompt, consuming the pending handoff
 * payload</li>
 * <li>streams the session through {@link StreamComposer}; a handoff result
 * cancels the session before anything after it is produced</li>
 * <li>after a handoff, waits for the session to be released, switches agents
 * and loops; otherwise completes</li>
 * </ol>
 * At most {@code maxHandoffs + 1} sessions run per turn, strictly one after the
 * other. Gap telemetry is evaluated once, on the scheduler, after the stream
 * has completed. Every subscription runs the turn from the initial agent.
 *
 * <p>
 * Input errors are thrown synchronously from {@link #runHandoffLoop}. Session
 * errors terminate the returned stream; there is no retry.
 */
@Service
@Slf4j
public class HandoffLoopController {

    private final ConversationNormalizer normalizer;
    private final InitialAgentSelector agentSelector;
    private final CapabilitySetBuilder capabilitySetBuilder;
    private final PromptComposer promptComposer;
    private final GenerationSessionFactory sessionFactory;
    private final StreamComposer streamComposer;
    private final DomainContextPort domainContext;
    private final GapTelemetryRecorder gapRecorder;
    private final Scheduler scheduler;
    private final int maxHandoffs;
    private final int maxStepsPerSession;

    public HandoffLoopController(ConversationNormalizer normalizer, InitialAgentSelector agentSelector,
            CapabilitySetBuilder capabilitySetBuilder, PromptComposer promptComposer,
            GenerationSessionFactory sessionFactory, StreamComposer streamComposer,
            DomainContextPort domainContext, GapTelemetryRecorder gapRecorder,
            @Qualifier("handoffScheduler") Scheduler scheduler, HandoffProperties properties) {
        HandoffProperties.OrchestratorProperties config = properties.getOrchestrator();
        if (config.getMaxHandoffs() < 0) {
            throw new IllegalArgumentException("handoff.orchestrator.max-handoffs must be >= 0, got "
                    + config.getMaxHandoffs());
        }
        if (config.getMaxStepsPerSession() <= 0) {
            throw new IllegalArgumentException("handoff.orchestrator.max-steps-per-session must be > 0, got "
                    + config.getMaxStepsPerSession());
        }
        this.normalizer = normalizer;
        this.agentSelector = agentSelector;
        this.capabilitySetBuilder = capabilitySetBuilder;
        this.promptComposer = promptComposer;
        this.sessionFactory = sessionFactory;
        this.streamComposer = streamComposer;
        this.domainContext = domainContext;
        this.gapRecorder = gapRecorder;
        this.scheduler = scheduler;
        this.maxHandoffs = config.getMaxHandoffs();
        this.maxStepsPerSession = config.getMaxStepsPerSession();
    }

    /**
     * Streams the response to one user turn.
     *
     * @throws IllegalArgumentException
     *             if the conversation or tenant is invalid; no session is started
     */
    public Flux<OutputEvent> runHandoffLoop(List<InboundMessage> messages, TenantContext tenant) {
        if (tenant == null || tenant.getCustomerId() == null || tenant.getCustomerId().isBlank()) {
            throw new IllegalArgumentException("customerId is required");
        }
        List<ConversationMessage> conversation = Collections.unmodifiableList(normalizer.normalize(messages));
        AgentIdentity initialAgent = agentSelector.select(conversation);

        return Flux.defer(() -> {
            LoopState state = LoopState.start(initialAgent);
            List<String> invoked = Collections.synchronizedList(new ArrayList<>());
            log.info("[Handoff] Starting turn for customer {} with {} (messages: {})", tenant.getCustomerId(),
                    initialAgent.getWireValue(), conversation.size());

            return Mono.fromCallable(() -> domainContext.buildContext(tenant))
                    .subscribeOn(scheduler)
                    .flatMapMany(context -> iterate(state, conversation, tenant, context, invoked))
                    .doFinally(signal -> {
                        if (signal == SignalType.ON_COMPLETE) {
                            scheduler.schedule(() -> complete(state, conversation, tenant, invoked));
                        }
                    });
        });
    }

    private Flux<OutputEvent> iterate(LoopState state, List<ConversationMessage> conversation,
            TenantContext tenant, String context, List<String> invoked) {
        return Flux.defer(() -> {
            state.setPhase(LoopPhase.GENERATING);
            AgentIdentity agent = state.getCurrentAgent();
            int iteration = state.getHandoffCount();
            boolean handoffAllowed = state.getHandoffCount() < maxHandoffs;
            HandoffPayload incoming = state.consumePendingHandoff();

            CapabilitySet capabilities = capabilitySetBuilder.build(agent, tenant, handoffAllowed,
                    state.getPreviousAgent());
            String systemPrompt = promptComposer.compose(agent, context, incoming);
            log.debug("[Handoff] Iteration {} with {}: {} capabilities, handoff allowed: {}", iteration,
                    agent.getWireValue(), capabilities.size(), handoffAllowed);
            log.debug("[Handoff] System prompt for {}:\n{}", agent.getWireValue(), systemPrompt);

            CancellationToken token = new CancellationToken();
            GenerationSession session = sessionFactory.open(GenerationRequest.builder()
                    .agent(agent)
                    .systemPrompt(systemPrompt)
                    .history(conversation)
                    .capabilities(capabilities)
                    .maxSteps(maxStepsPerSession)
                    .build(), token);

            AtomicReference<HandoffPayload> detected = new AtomicReference<>();
            Flux<OutputEvent> events = session.events()
                    .doOnNext(event -> {
                        if (event.is(OutputEventType.CAPABILITY_INVOCATION)) {
                            invoked.add(event.getCapabilityName());
                        }
                    });

            return streamComposer.compose(events, payload -> {
                session.cancel();
                detected.set(payload);
            })
                    .doOnError(error -> log.error("[Handoff] Session failed (agent: {}, iteration: {}): {}",
                            agent.getWireValue(), iteration, error.getMessage()))
                    .concatWith(Flux.defer(() -> {
                        HandoffPayload payload = detected.get();
                        if (payload == null) {
                            return Flux.empty();
                        }
                        return session.released().thenMany(Flux.defer(() -> {
                            state.recordHandoff(payload);
                            log.info("[Handoff] {} -> {} (handoff {}/{}, reason: {})",
                                    payload.getFromAgent().getWireValue(), payload.getTargetAgent().getWireValue(),
                                    state.getHandoffCount(), maxHandoffs, payload.getReason());
                            return iterate(state, conversation, tenant, context, invoked);
                        }));
                    }));
        });
    }

    private void complete(LoopState state, List<ConversationMessage> conversation, TenantContext tenant,
            List<String> invoked) {
        state.setPhase(LoopPhase.COMPLETING);
        List<String> names;
        synchronized (invoked) {
            names = new ArrayList<>(invoked);
        }
        log.info("[Handoff] Turn completed for customer {} by {} after {} handoff(s)", tenant.getCustomerId(),
                state.getCurrentAgent().getWireValue(), state.getHandoffCount());
        gapRecorder.recordIfGap(state.getCurrentAgent(), names, conversation, tenant);
    }
}
