package me.golemcore.handoff.domain.session;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot cancellation flag shared between the loop controller and one
 * generation session. Checked by the session before every event it produces.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
