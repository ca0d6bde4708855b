package io.exprxform.core.error;

/**
 * Abstract parent for errors raised while evaluating or rewriting a tree. These signal that the
 * engine reached a state a well-formed tree and a validated transform cannot produce.
 */
public abstract class RewriteEvalException extends RewriteException {

    private static final long serialVersionUID = 1L;

    protected RewriteEvalException(String message, String transformId) {
        super(message, transformId, Phase.EVALUATION);
    }

    protected RewriteEvalException(String message, Throwable cause, String transformId) {
        super(message, cause, transformId, Phase.EVALUATION);
    }
}
