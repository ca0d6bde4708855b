package io.exprxform.core.engine;

import io.exprxform.core.model.BinaryAddition;
import io.exprxform.core.model.Expression;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Post-order linearization of expression trees (left subtree, right subtree, node).
 *
 * <p>Substitution pairs the i-th identifier of a flattened input pattern with the i-th node of the
 * flattened subtree it matched. Both flattenings must therefore walk children in the same order;
 * {@link #identifiers} is derived from {@link #expressions} to keep that true.
 */
public final class Flattening {

    private Flattening() {}

    /** Returns the nodes of the tree rooted at {@code root} in post-order. */
    public static List<Expression> expressions(Expression root) {
        Deque<Expression> stack = new ArrayDeque<>();
        Deque<Expression> reverse = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Expression current = stack.pop();
            reverse.push(current);
            switch (current.type()) {
                case BINARY_ADDITION -> {
                    BinaryAddition addition = (BinaryAddition) current;
                    stack.push(addition.left());
                    stack.push(addition.right());
                }
                case NUMERIC_LITERAL -> {
                    // leaf
                }
            }
        }
        List<Expression> result = new ArrayList<>(reverse.size());
        while (!reverse.isEmpty()) {
            result.add(reverse.pop());
        }
        return result;
    }

    /** Returns the identifiers of the tree rooted at {@code root} in post-order. */
    public static List<String> identifiers(Expression root) {
        return expressions(root).stream().map(Expression::id).toList();
    }
}
