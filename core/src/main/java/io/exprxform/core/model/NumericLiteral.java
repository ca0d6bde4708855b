package io.exprxform.core.model;

import io.exprxform.core.error.InvalidEvaluationException;
import java.util.Objects;

/** A numeric leaf holding either a concrete value or a wildcard. */
public final class NumericLiteral extends Expression {

    private final NumericValue value;

    private NumericLiteral(NumericValue value, String id) {
        super(ExpressionType.NUMERIC_LITERAL, id);
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    /** Creates a concrete literal with the empty identifier. */
    public static NumericLiteral of(long value) {
        return new NumericLiteral(NumericValue.of(value), NO_ID);
    }

    /** Creates a literal with the given value and the empty identifier. */
    public static NumericLiteral of(NumericValue value) {
        return new NumericLiteral(value, NO_ID);
    }

    /** Creates a literal with the given value and identifier. */
    public static NumericLiteral of(NumericValue value, String id) {
        return new NumericLiteral(value, id);
    }

    /** Creates a wildcard literal bound to {@code id}. */
    public static NumericLiteral wildcard(String id) {
        return new NumericLiteral(NumericValue.wildcard(), id);
    }

    /**
     * The value held by this leaf.
     *
     * @return a {@link NumericValue.Concrete} or the wildcard placeholder
     */
    public NumericValue value() {
        return value;
    }

    /** Returns {@code true} if this literal holds the wildcard placeholder. */
    public boolean isWildcard() {
        return value.isWildcard();
    }

    @Override
    public long evaluate() {
        if (value instanceof NumericValue.Concrete concrete) {
            return concrete.value();
        }
        throw new InvalidEvaluationException("Cannot evaluate wildcard literal '" + this + "'");
    }

    @Override
    public NumericLiteral deepCopy() {
        return new NumericLiteral(value, id());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NumericLiteral other)) return false;
        return value.equals(other.value) && id().equals(other.id());
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, id());
    }

    @Override
    public String toString() {
        return isWildcard() ? "?" + id() : value.toString();
    }
}
