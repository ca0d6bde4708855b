package io.exprxform.core.model;

import java.util.Objects;

/** Binary addition of two owned subexpressions, e.g. {@code (1 + 2)}. */
public final class BinaryAddition extends Expression {

    private final Expression left;
    private final Expression right;

    private BinaryAddition(Expression left, Expression right, String id) {
        super(ExpressionType.BINARY_ADDITION, id);
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    /** Creates an addition with the empty identifier. */
    public static BinaryAddition of(Expression left, Expression right) {
        return new BinaryAddition(left, right, NO_ID);
    }

    /** Creates an addition carrying the given identifier. */
    public static BinaryAddition of(Expression left, Expression right, String id) {
        return new BinaryAddition(left, right, id);
    }

    /**
     * The left operand.
     *
     * @return the left subtree, owned by this node
     */
    public Expression left() {
        return left;
    }

    /**
     * The right operand.
     *
     * @return the right subtree, owned by this node
     */
    public Expression right() {
        return right;
    }

    /** Sums both subtrees with wraparound unsigned 64-bit arithmetic. */
    @Override
    public long evaluate() {
        return left.evaluate() + right.evaluate();
    }

    @Override
    public BinaryAddition deepCopy() {
        return new BinaryAddition(left.deepCopy(), right.deepCopy(), id());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BinaryAddition other)) return false;
        return left.equals(other.left) && right.equals(other.right) && id().equals(other.id());
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, right, id());
    }

    @Override
    public String toString() {
        return "(" + left + " + " + right + ")";
    }
}
