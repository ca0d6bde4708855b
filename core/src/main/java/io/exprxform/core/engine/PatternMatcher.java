package io.exprxform.core.engine;

import io.exprxform.core.model.BinaryAddition;
import io.exprxform.core.model.Expression;
import io.exprxform.core.model.NumericLiteral;
import io.exprxform.core.model.NumericValue;

/**
 * Structural matching of a pattern tree against a query tree.
 *
 * <p>Shapes must agree node for node. Additions match child by child, left with left and right
 * with right; {@code (0 + x)} and {@code (x + 0)} are distinct patterns. Two concrete literals
 * match when their values are equal, and a wildcard on either side matches any literal.
 *
 * <p>Each wildcard binds by position only. Two wildcards sharing an identifier within one
 * pattern are not required to match equal values.
 */
public final class PatternMatcher {

    private PatternMatcher() {}

    /**
     * Tests whether {@code pattern} structurally matches {@code query}.
     *
     * @param pattern the template tree, may contain wildcards
     * @param query   the tree tested against the template
     * @return {@code true} on a structural match
     */
    public static boolean matches(Expression pattern, Expression query) {
        if (pattern.type() != query.type()) {
            return false;
        }
        return switch (pattern.type()) {
            case BINARY_ADDITION -> {
                BinaryAddition p = (BinaryAddition) pattern;
                BinaryAddition q = (BinaryAddition) query;
                yield matches(p.left(), q.left()) && matches(p.right(), q.right());
            }
            case NUMERIC_LITERAL -> {
                NumericValue v0 = ((NumericLiteral) pattern).value();
                NumericValue v1 = ((NumericLiteral) query).value();
                if (v0 instanceof NumericValue.Concrete c0 && v1 instanceof NumericValue.Concrete c1) {
                    yield c0.value() == c1.value();
                }
                // at least one side is a wildcard
                yield true;
            }
        };
    }
}
