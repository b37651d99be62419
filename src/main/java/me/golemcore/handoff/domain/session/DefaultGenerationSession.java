package me.golemcore.handoff.domain.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.handoff.domain.capability.Capability;
import me.golemcore.handoff.domain.model.CapabilityResult;
import me.golemcore.handoff.domain.model.ConversationMessage;
import me.golemcore.handoff.domain.model.LlmRequest;
import me.golemcore.handoff.domain.model.LlmResponse;
import me.golemcore.handoff.domain.model.Message;
import me.golemcore.handoff.domain.model.OutputEvent;
import me.golemcore.handoff.port.outbound.LlmPort;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.publisher.SynchronousSink;
import reactor.core.scheduler.Scheduler;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Generation session driving a model step loop over {@link LlmPort}.
 *
 * <p>
 * Each step: call the model, emit its text, then for every tool call emit the
 * invocation, execute the capability and emit the result, and finally emit
 * {@code step-finished}. A step without tool calls ends the session with
 * {@code stream-finished(stop)}; reaching the step limit ends it with
 * {@code stream-finished(max-steps)}.
 *
 * <p>
 * Built on {@link Flux#generate}: work for an event happens only when that
 * event is requested, and a capability executes only when its result is
 * requested. The cancellation token is checked before producing every event,
 * so once it is set nothing further is produced or executed. Blocking model
 * calls run on the supplied scheduler.
 */
@Slf4j
public class DefaultGenerationSession implements GenerationSession {

    private final GenerationRequest request;
    private final CancellationToken token;
    private final LlmPort llmPort;
    private final Scheduler scheduler;
    private final ObjectMapper objectMapper;

    private final Sinks.Empty<Void> releasedSink = Sinks.empty();
    private final AtomicBoolean subscribed = new AtomicBoolean();

    public DefaultGenerationSession(GenerationRequest request, CancellationToken token, LlmPort llmPort,
            Scheduler scheduler, ObjectMapper objectMapper) {
        this.request = request;
        this.token = token;
        this.llmPort = llmPort;
        this.scheduler = scheduler;
        this.objectMapper = objectMapper;
    }

    @Override
    public Flux<OutputEvent> events() {
        return Flux.defer(() -> {
            if (!subscribed.compareAndSet(false, true)) {
                return Flux.error(new IllegalStateException("Generation session can only be consumed once"));
            }
            return Flux.generate(this::initialState, this::next, this::release)
                    .subscribeOn(scheduler);
        });
    }

    @Override
    public void cancel() {
        token.cancel();
        if (subscribed.compareAndSet(false, true)) {
            releasedSink.tryEmitEmpty();
        }
    }

    @Override
    public Mono<Void> released() {
        return releasedSink.asMono();
    }

    private SessionState initialState() {
        SessionState state = new SessionState();
        for (ConversationMessage message : request.getHistory()) {
            state.messages.add(Message.from(message));
        }
        log.debug("[Session] Starting {} session with {} messages and {} capabilities",
                request.getAgent().getWireValue(), state.messages.size(), request.getCapabilities().size());
        return state;
    }

    private SessionState next(SessionState state, SynchronousSink<OutputEvent> sink) {
        if (token.isCancelled()) {
            sink.complete();
            return state;
        }
        if (!state.pending.isEmpty()) {
            sink.next(state.pending.poll().get());
            return state;
        }
        if (state.finished) {
            sink.complete();
            return state;
        }
        if (state.stepIndex >= request.getMaxSteps()) {
            log.info("[Session] {} reached max steps ({})", request.getAgent().getWireValue(),
                    request.getMaxSteps());
            state.finished = true;
            sink.next(OutputEvent.streamFinished(OutputEvent.FINISH_MAX_STEPS, request.getAgent()));
            return state;
        }

        LlmResponse response;
        try {
            response = callModel(state);
        } catch (GenerationException e) {
            sink.error(e);
            return state;
        }
        if (token.isCancelled()) {
            sink.complete();
            return state;
        }

        planStep(state, response);
        sink.next(state.pending.poll().get());
        return state;
    }

    private LlmResponse callModel(SessionState state) {
        LlmRequest llmRequest = LlmRequest.builder()
                .systemPrompt(request.getSystemPrompt())
                .messages(new ArrayList<>(state.messages))
                .tools(request.getCapabilities().definitions())
                .build();
        log.debug("[Session] {} step {}: calling model", request.getAgent().getWireValue(), state.stepIndex);
        CompletableFuture<LlmResponse> pendingCall = llmPort.chat(llmRequest);
        LlmResponse response;
        try {
            response = pendingCall.get();
        } catch (InterruptedException e) {
            // Subscription cancelled while the model call was in flight
            pendingCall.cancel(true);
            Thread.currentThread().interrupt();
            throw new GenerationException("Interrupted while waiting for model", e);
        } catch (ExecutionException | CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new GenerationException("Model call failed: " + cause.getMessage(), cause);
        } catch (RuntimeException e) {
            throw new GenerationException("Model call failed: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new GenerationException("Model returned no response", null);
        }
        return response;
    }

    /**
     * Queues the events of one model step. Capability execution is deferred into
     * the supplier of the corresponding result event.
     */
    private void planStep(SessionState state, LlmResponse response) {
        int stepIndex = state.stepIndex++;
        boolean hasToolCalls = response.hasToolCalls();

        state.messages.add(Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(response.getContent())
                .toolCalls(hasToolCalls ? response.getToolCalls() : null)
                .build());

        if (response.hasText()) {
            String text = response.getContent();
            state.pending.add(() -> OutputEvent.textDelta(text));
        }
        if (hasToolCalls) {
            for (Message.ToolCall call : response.getToolCalls()) {
                state.pending.add(() -> OutputEvent.invocation(call.getId(), call.getName(), call.getArguments()));
                state.pending.add(() -> {
                    CapabilityResult result = execute(call);
                    state.messages.add(Message.toolResult(call, toModelContent(result)));
                    return OutputEvent.result(call.getId(), call.getName(), result);
                });
            }
        }
        state.pending.add(() -> OutputEvent.stepFinished(stepIndex,
                hasToolCalls ? OutputEvent.FINISH_TOOL_CALLS : OutputEvent.FINISH_STOP));
        if (!hasToolCalls) {
            state.finished = true;
            state.pending.add(() -> OutputEvent.streamFinished(OutputEvent.FINISH_STOP, request.getAgent()));
        }
    }

    private CapabilityResult execute(Message.ToolCall call) {
        Optional<Capability> capability = request.getCapabilities().find(call.getName());
        if (capability.isEmpty()) {
            log.warn("[Session] Unknown capability requested: {}", call.getName());
            return CapabilityResult.failure("Unknown capability: " + call.getName());
        }
        try {
            CapabilityResult result = capability.get().execute(call.getArguments()).get();
            return result != null ? result : CapabilityResult.failure("Capability returned no result");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CapabilityResult.failure("Capability interrupted: " + call.getName());
        } catch (ExecutionException | RuntimeException e) {
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            log.warn("[Session] Capability {} failed: {}", call.getName(), cause.getMessage());
            return CapabilityResult.failure("Capability execution failed: " + cause.getMessage());
        }
    }

    private String toModelContent(CapabilityResult result) {
        String text = result.toModelText();
        if (result.getData() == null) {
            return text;
        }
        try {
            return text + "\n" + objectMapper.writeValueAsString(result.getData());
        } catch (JsonProcessingException e) {
            log.debug("[Session] Failed to serialize capability data: {}", e.getMessage());
            return text;
        }
    }

    private void release(SessionState state) {
        log.debug("[Session] {} session released after {} steps", request.getAgent().getWireValue(),
                state.stepIndex);
        state.pending.clear();
        releasedSink.tryEmitEmpty();
    }

    private static final class SessionState {
        private final List<Message> messages = new ArrayList<>();
        private final Deque<Supplier<OutputEvent>> pending = new ArrayDeque<>();
        private int stepIndex;
        private boolean finished;
    }
}
