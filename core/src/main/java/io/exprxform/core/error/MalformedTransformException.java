package io.exprxform.core.error;

/**
 * Thrown when an output pattern references a wildcard identifier that no wildcard leaf of the
 * paired input pattern binds.
 */
public final class MalformedTransformException extends RewriteLoadException {

    private static final long serialVersionUID = 1L;

    public MalformedTransformException(String message, String transformId, String source) {
        super(message, transformId, source);
    }
}
