package io.exprxform.core.model;

import io.exprxform.core.error.MalformedTransformException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A named rewrite rule: any subtree matching {@code inputPattern} is replaced by an instance of
 * {@code outputPattern} whose wildcard leaves take the values bound by the same-named wildcards
 * of the input pattern.
 *
 * <p>Immutable. The canonical constructor checks every output wildcard the way substitution
 * resolves it: the first node of the input pattern, in post-order, carrying the wildcard's
 * identifier must be a wildcard leaf. An instance is therefore always safe to substitute.
 *
 * @param id            registry key, e.g. {@code zero-left}
 * @param name          human-readable name
 * @param inputPattern  the pattern matched against the tree
 * @param outputPattern the pattern the match is rewritten to
 */
public record Transform(String id, String name, Expression inputPattern, Expression outputPattern) {

    /**
     * Canonical constructor, validates the wildcard bindings.
     *
     * @throws NullPointerException         if any component is null
     * @throws MalformedTransformException if an output wildcard is unbound, shadowed by a
     *                                     non-wildcard node or has no identifier
     */
    public Transform {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(inputPattern, "inputPattern must not be null");
        Objects.requireNonNull(outputPattern, "outputPattern must not be null");

        List<Expression> inputNodes = new ArrayList<>();
        postOrder(inputPattern, inputNodes);
        Set<String> bound = new LinkedHashSet<>();
        collectWildcardIds(inputPattern, bound);
        Set<String> referenced = new LinkedHashSet<>();
        collectWildcardIds(outputPattern, referenced);
        for (String ref : referenced) {
            if (ref.isEmpty()) {
                throw new MalformedTransformException(
                        "Output pattern " + outputPattern + " contains a wildcard without an identifier", id, name);
            }
            Expression binding = firstCarrying(inputNodes, ref);
            if (binding == null) {
                throw new MalformedTransformException(
                        "Output wildcard '" + ref + "' is not bound by input pattern " + inputPattern
                                + " (bound identifiers: " + bound + ")",
                        id,
                        name);
            }
            // substitution binds an identifier to its first post-order occurrence
            if (!(binding instanceof NumericLiteral literal) || !literal.isWildcard()) {
                throw new MalformedTransformException(
                        "Output wildcard '" + ref + "' resolves to non-wildcard node " + binding
                                + " in input pattern " + inputPattern,
                        id,
                        name);
            }
        }
    }

    private static Expression firstCarrying(List<Expression> nodes, String id) {
        for (Expression node : nodes) {
            if (node.id().equals(id)) {
                return node;
            }
        }
        return null;
    }

    private static void postOrder(Expression node, List<Expression> out) {
        if (node instanceof BinaryAddition addition) {
            postOrder(addition.left(), out);
            postOrder(addition.right(), out);
        }
        out.add(node);
    }

    private static void collectWildcardIds(Expression node, Set<String> ids) {
        switch (node.type()) {
            case BINARY_ADDITION -> {
                BinaryAddition addition = (BinaryAddition) node;
                collectWildcardIds(addition.left(), ids);
                collectWildcardIds(addition.right(), ids);
            }
            case NUMERIC_LITERAL -> {
                if (((NumericLiteral) node).isWildcard()) {
                    ids.add(node.id());
                }
            }
        }
    }

    @Override
    public String toString() {
        return id + ": " + inputPattern + " -> " + outputPattern;
    }
}
