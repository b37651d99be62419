package me.golemcore.handoff.domain.session;

import me.golemcore.handoff.domain.model.OutputEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * One bounded, cancellable run of model-driven generation.
 *
 * <p>
 * {@link #events()} is lazy and may be subscribed exactly once. Events are
 * produced on demand only, so a session never runs ahead of its consumer.
 * Cancelling the subscription or calling {@link #cancel()} stops generation;
 * {@link #released()} completes once the session has let go of its resources.
 * The loop cancels through {@link #cancel()} when it detects a handoff, before
 * the upstream subscription is cancelled.
 */
public interface GenerationSession {

    Flux<OutputEvent> events();

    void cancel();

    Mono<Void> released();
}
