package io.exprxform.core.engine;

import io.exprxform.core.model.Expression;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Evaluates expression trees to their unsigned 64-bit value. */
public final class ExpressionEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionEvaluator.class);

    private ExpressionEvaluator() {}

    /**
     * Evaluates {@code root}.
     *
     * @param root the tree to reduce, must not contain wildcards
     * @return the value, as an unsigned 64-bit integer stored in a {@code long}
     * @throws io.exprxform.core.error.InvalidEvaluationException if the tree holds a wildcard
     */
    public static long eval(Expression root) {
        Objects.requireNonNull(root, "root must not be null");
        long value = root.evaluate();
        LOG.trace("Evaluated {} = {}", root, Long.toUnsignedString(value));
        return value;
    }
}
