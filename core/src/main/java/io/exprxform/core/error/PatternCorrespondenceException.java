package io.exprxform.core.error;

/**
 * Thrown when the post-order flattening of an input pattern and of the subtree it matched differ
 * in length, so identifiers cannot be paired with nodes by position.
 */
public final class PatternCorrespondenceException extends RewriteEvalException {

    private static final long serialVersionUID = 1L;

    private final int patternSize;
    private final int matchedSize;

    public PatternCorrespondenceException(String message, String transformId, int patternSize, int matchedSize) {
        super(message, transformId);
        this.patternSize = patternSize;
        this.matchedSize = matchedSize;
    }

    /** Number of identifiers in the flattened input pattern. */
    public int patternSize() {
        return patternSize;
    }

    /** Number of nodes in the flattened matched subtree. */
    public int matchedSize() {
        return matchedSize;
    }
}
