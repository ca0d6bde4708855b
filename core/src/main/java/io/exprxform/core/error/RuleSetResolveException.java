package io.exprxform.core.error;

/** Thrown when a rule set names a transform id that the transform registry does not hold. */
public final class RuleSetResolveException extends RewriteLoadException {

    private static final long serialVersionUID = 1L;

    public RuleSetResolveException(String message, String transformId, String source) {
        super(message, transformId, source);
    }
}
