package io.exprxform.core.error;

/**
 * Abstract base for all expr-xform exceptions. Never thrown directly: use the concrete subclasses
 * under {@link RewriteLoadException} or {@link RewriteEvalException}.
 *
 * <p>Every exception in this hierarchy reports a programming or configuration mistake. The engine
 * never recovers from one; callers should let it propagate.
 */
public abstract class RewriteException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        EVALUATION
    }

    private final String transformId;
    private final Phase phase;

    protected RewriteException(String message, String transformId, Phase phase) {
        super(message);
        this.transformId = transformId;
        this.phase = phase;
    }

    protected RewriteException(String message, Throwable cause, String transformId, Phase phase) {
        super(message, cause);
        this.transformId = transformId;
        this.phase = phase;
    }

    /** The transform that triggered the error, or {@code null} if none is involved. */
    public String transformId() {
        return transformId;
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
