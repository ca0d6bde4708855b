package io.exprxform.core.spi;

/**
 * SPI for observing rewrites as the optimizer performs them.
 *
 * <p>Implementations receive immutable event records. Exceptions thrown by a listener are caught
 * by the optimizer and logged; they do not affect the rewrite.
 */
public interface RewriteListener {

    /**
     * Called each time a transform replaces a subtree.
     *
     * @param event contains transformId, path, matched, replacement
     */
    void onTransformApplied(TransformAppliedEvent event);

    /**
     * Called when a transform has finished its single pass over the tree.
     *
     * @param event contains transformId, rewriteCount
     */
    void onPassCompleted(PassCompletedEvent event);

    // --- Event records ---

    /**
     * Event emitted when a transform rewrites a subtree.
     *
     * @param transformId the transform that fired
     * @param path        location of the rewritten subtree, e.g. {@code root.left.right}
     * @param matched     infix rendering of the matched subtree
     * @param replacement infix rendering of the replacement
     */
    record TransformAppliedEvent(String transformId, String path, String matched, String replacement) {}

    /** Event emitted when a transform's pass completes. */
    record PassCompletedEvent(String transformId, int rewriteCount) {}
}
