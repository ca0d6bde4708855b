package io.exprxform.core.engine;

import io.exprxform.core.model.BinaryAddition;
import io.exprxform.core.model.Expression;
import io.exprxform.core.model.RuleSet;
import io.exprxform.core.model.Transform;
import io.exprxform.core.spi.RewriteListener;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrite driver. Applies an ordered list of transforms to an expression tree, one single pass per
 * transform; the output of pass {@code k} is the input of pass {@code k + 1}.
 *
 * <p>A pass walks the tree top-down. At the first node on a root-to-leaf path whose subtree
 * matches the transform's input pattern, the subtree is replaced by the substituted output
 * pattern and the pass does not descend into it. Sibling subtrees are rewritten independently.
 * There is no fixed-point iteration: a transform never revisits the tree it produced.
 *
 * <p>Every call returns a newly allocated tree. Input trees are never mutated, so an instance may
 * be shared freely.
 */
public final class Optimizer {

    private static final Logger LOG = LoggerFactory.getLogger(Optimizer.class);

    private final List<Transform> transforms;
    private final RewriteListener listener;

    /**
     * Creates an optimizer over the given transforms, without a listener.
     *
     * @param transforms transforms in application order
     */
    public Optimizer(List<Transform> transforms) {
        this(transforms, null);
    }

    /**
     * Creates an optimizer over the given transforms.
     *
     * @param transforms transforms in application order
     * @param listener   optional listener for rewrite events, may be null
     */
    public Optimizer(List<Transform> transforms, RewriteListener listener) {
        this.transforms = List.copyOf(Objects.requireNonNull(transforms, "transforms must not be null"));
        this.listener = listener; // nullable
    }

    /** Creates an optimizer over {@link BuiltinTransforms#defaults()}. */
    public static Optimizer withDefaults() {
        return new Optimizer(BuiltinTransforms.defaults());
    }

    /** Creates an optimizer applying the transforms of {@code ruleSet} in order. */
    public static Optimizer fromRuleSet(RuleSet ruleSet) {
        return fromRuleSet(ruleSet, null);
    }

    /** Creates an optimizer applying the transforms of {@code ruleSet} in order. */
    public static Optimizer fromRuleSet(RuleSet ruleSet, RewriteListener listener) {
        Objects.requireNonNull(ruleSet, "ruleSet must not be null");
        return new Optimizer(ruleSet.transforms(), listener);
    }

    /** The configured transforms, in application order. */
    public List<Transform> transforms() {
        return transforms;
    }

    /**
     * Optimizes the tree rooted at {@code root}.
     *
     * @param root the tree to optimize, not modified
     * @return a new tree, equal in value to {@code root}
     */
    public Expression optimize(Expression root) {
        Objects.requireNonNull(root, "root must not be null");
        Expression current = root;
        for (Transform transform : transforms) {
            current = applyTransform(transform, current);
        }
        if (current == root) {
            // no transforms configured
            current = root.deepCopy();
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug(
                    "Optimized tree: transforms={}, input={}, output={}",
                    transforms.size(),
                    ExpressionJson.render(root),
                    ExpressionJson.render(current));
        }
        return current;
    }

    /**
     * Runs one pass of {@code transform} over the tree rooted at {@code root}.
     *
     * @param transform the transform to apply
     * @param root      the tree to rewrite, not modified
     * @return a new tree with every top-most match replaced
     */
    public Expression applyTransform(Transform transform, Expression root) {
        Objects.requireNonNull(transform, "transform must not be null");
        Objects.requireNonNull(root, "root must not be null");
        Pass pass = new Pass(transform);
        Expression result = apply(pass, root, "root");
        LOG.debug("Transform pass completed: transform_id={}, rewrites={}", transform.id(), pass.rewrites);
        notifyPassCompleted(transform, pass.rewrites);
        return result;
    }

    /**
     * Tests whether {@code pattern} matches {@code query} without rewriting anything.
     *
     * @see PatternMatcher#matches(Expression, Expression)
     */
    public static boolean match(Expression pattern, Expression query) {
        return PatternMatcher.matches(pattern, query);
    }

    private Expression apply(Pass pass, Expression node, String path) {
        return switch (node.type()) {
            case BINARY_ADDITION -> {
                if (PatternMatcher.matches(pass.transform.inputPattern(), node)) {
                    Expression replacement = Substitution.apply(pass.transform, node);
                    pass.rewrites++;
                    LOG.debug(
                            "Applied transform: transform_id={}, path={}, matched={}, replacement={}",
                            pass.transform.id(),
                            path,
                            node,
                            replacement);
                    notifyTransformApplied(pass.transform, path, node, replacement);
                    yield replacement;
                }
                BinaryAddition addition = (BinaryAddition) node;
                yield BinaryAddition.of(
                        apply(pass, addition.left(), path + ".left"),
                        apply(pass, addition.right(), path + ".right"),
                        addition.id());
            }
            // a binary pattern cannot match a leaf
            case NUMERIC_LITERAL -> node.deepCopy();
        };
    }

    private void notifyTransformApplied(Transform transform, String path, Expression matched, Expression replacement) {
        if (listener == null) return;
        try {
            listener.onTransformApplied(new RewriteListener.TransformAppliedEvent(
                    transform.id(), path, matched.toString(), replacement.toString()));
        } catch (Exception e) {
            LOG.warn("RewriteListener.onTransformApplied failed", e);
        }
    }

    private void notifyPassCompleted(Transform transform, int rewrites) {
        if (listener == null) return;
        try {
            listener.onPassCompleted(new RewriteListener.PassCompletedEvent(transform.id(), rewrites));
        } catch (Exception e) {
            LOG.warn("RewriteListener.onPassCompleted failed", e);
        }
    }

    /** Per-pass state. */
    private static final class Pass {
        private final Transform transform;
        private int rewrites;

        Pass(Transform transform) {
            this.transform = transform;
        }
    }
}
