package io.exprxform.core.error;

/** Thrown when a rule-set YAML file has invalid syntax, missing required fields or unknown keys. */
public final class RuleSetParseException extends RewriteLoadException {

    private static final long serialVersionUID = 1L;

    public RuleSetParseException(String message, String source) {
        super(message, null, source);
    }

    public RuleSetParseException(String message, Throwable cause, String source) {
        super(message, cause, null, source);
    }
}
