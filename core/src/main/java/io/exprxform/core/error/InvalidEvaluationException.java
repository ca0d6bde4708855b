package io.exprxform.core.error;

/**
 * Thrown when a tree that still holds a wildcard literal is evaluated. A pattern was evaluated
 * where it should have been substituted.
 */
public final class InvalidEvaluationException extends RewriteEvalException {

    private static final long serialVersionUID = 1L;

    public InvalidEvaluationException(String message) {
        super(message, null);
    }
}
