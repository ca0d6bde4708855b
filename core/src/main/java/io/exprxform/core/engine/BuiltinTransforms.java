package io.exprxform.core.engine;

import io.exprxform.core.model.BinaryAddition;
import io.exprxform.core.model.NumericLiteral;
import io.exprxform.core.model.Transform;
import java.util.List;

/** The transforms shipped with the engine: both operand orders of the additive identity law. */
public final class BuiltinTransforms {

    public static final String ZERO_LEFT = "zero-left";
    public static final String ZERO_RIGHT = "zero-right";

    private BuiltinTransforms() {}

    /**
     * Left-wise addition with zero, e.g. {@code 0 + 1 -> 1}. The surviving operand is bound by the
     * wildcard {@code right}.
     */
    public static Transform zeroOnLeft() {
        return new Transform(
                ZERO_LEFT,
                "Left-wise Binary Addition with Zero",
                BinaryAddition.of(NumericLiteral.of(0L), NumericLiteral.wildcard("right")),
                NumericLiteral.wildcard("right"));
    }

    /**
     * Right-wise addition with zero, e.g. {@code 1 + 0 -> 1}. The surviving operand is bound by the
     * wildcard {@code left}.
     */
    public static Transform zeroOnRight() {
        return new Transform(
                ZERO_RIGHT,
                "Right-wise Binary Addition with Zero",
                BinaryAddition.of(NumericLiteral.wildcard("left"), NumericLiteral.of(0L)),
                NumericLiteral.wildcard("left"));
    }

    /** Returns the shipped transforms in their default application order. */
    public static List<Transform> defaults() {
        return List.of(zeroOnLeft(), zeroOnRight());
    }
}
