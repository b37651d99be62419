package me.golemcore.handoff.domain.session;

/**
 * Terminal failure of the model backing a generation session.
 */
public class GenerationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
