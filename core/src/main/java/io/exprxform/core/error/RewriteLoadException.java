package io.exprxform.core.error;

/**
 * Abstract parent for configuration errors: a transform that cannot be built, or a rule set that
 * cannot be read or resolved. Carries an additional {@code source} field identifying the file,
 * resource or factory that caused the error.
 */
public abstract class RewriteLoadException extends RewriteException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected RewriteLoadException(String message, String transformId, String source) {
        super(message, transformId, Phase.LOAD);
        this.source = source;
    }

    protected RewriteLoadException(String message, Throwable cause, String transformId, String source) {
        super(message, cause, transformId, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error, or {@code null}. */
    public String source() {
        return source;
    }
}
