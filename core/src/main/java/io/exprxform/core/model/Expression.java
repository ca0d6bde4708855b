package io.exprxform.core.model;

import java.util.Objects;

/**
 * Base class for all expression tree nodes.
 *
 * <p>Every node carries an identifier. Concrete nodes carry the empty identifier; pattern nodes
 * carry a non-empty binding name that substitution uses to carry matched values from an input
 * pattern over to an output pattern.
 *
 * <p>Nodes are immutable and exclusively own their children, so a tree never shares a subtree
 * with another tree. {@link #deepCopy()} still produces a fully independent copy for callers that
 * need distinct node identities.
 */
public abstract sealed class Expression permits NumericLiteral, BinaryAddition {

    /** The identifier carried by concrete (non-pattern) nodes. */
    public static final String NO_ID = "";

    private final ExpressionType type;
    private final String id;

    protected Expression(ExpressionType type, String id) {
        this.type = type;
        this.id = Objects.requireNonNull(id, "id must not be null");
    }

    /**
     * Reduces this subtree to a concrete value.
     *
     * @return the value, as an unsigned 64-bit integer stored in a {@code long}
     * @throws io.exprxform.core.error.InvalidEvaluationException if the subtree holds a wildcard
     */
    public abstract long evaluate();

    /** Returns an independent deep copy of this subtree, identifiers included. */
    public abstract Expression deepCopy();

    /** The discriminant used for safe downcasting. */
    public final ExpressionType type() {
        return type;
    }

    /** The binding identifier, empty on concrete nodes. */
    public final String id() {
        return id;
    }

    /** Returns {@code true} if this node carries a binding identifier. */
    public final boolean hasId() {
        return !id.isEmpty();
    }
}
