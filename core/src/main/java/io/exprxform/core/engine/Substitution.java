package io.exprxform.core.engine;

import io.exprxform.core.error.MalformedTransformException;
import io.exprxform.core.error.PatternCorrespondenceException;
import io.exprxform.core.model.BinaryAddition;
import io.exprxform.core.model.Expression;
import io.exprxform.core.model.NumericLiteral;
import io.exprxform.core.model.Transform;
import java.util.List;

/**
 * Builds the replacement for a subtree that matched a transform's input pattern.
 *
 * <p>The matched subtree and the input pattern are flattened in post-order. Because the match
 * already established that both trees have the same shape, position {@code i} of the identifier
 * list names the node at position {@code i} of the node list. The output pattern is then rebuilt
 * node by node; each wildcard leaf takes the value found at the first position carrying its
 * identifier.
 * The value is copied as found, so a query that itself holds a wildcard passes it through with its
 * identifier; concrete values are copied with the empty identifier.
 *
 * <p>Never mutates the matched subtree or the transform; the result is a freshly allocated tree.
 */
public final class Substitution {

    private Substitution() {}

    /**
     * Produces the replacement for {@code position}, which must already match
     * {@code transform.inputPattern()}.
     *
     * @param transform the transform being applied
     * @param position  the matched subtree
     * @return a new tree instantiated from the output pattern
     * @throws PatternCorrespondenceException if the flattenings differ in length
     * @throws MalformedTransformException    if an output wildcard cannot be resolved
     */
    public static Expression apply(Transform transform, Expression position) {
        List<Expression> expressions = Flattening.expressions(position);
        List<String> identifiers = Flattening.identifiers(transform.inputPattern());
        if (expressions.size() != identifiers.size()) {
            throw new PatternCorrespondenceException(
                    "Input pattern " + transform.inputPattern() + " flattens to " + identifiers.size()
                            + " nodes but matched subtree " + position + " flattens to " + expressions.size(),
                    transform.id(),
                    identifiers.size(),
                    expressions.size());
        }
        return rebuild(transform.outputPattern(), expressions, identifiers, transform.id());
    }

    static Expression rebuild(
            Expression pattern, List<Expression> expressions, List<String> identifiers, String transformId) {
        return switch (pattern.type()) {
            case BINARY_ADDITION -> {
                BinaryAddition addition = (BinaryAddition) pattern;
                yield BinaryAddition.of(
                        rebuild(addition.left(), expressions, identifiers, transformId),
                        rebuild(addition.right(), expressions, identifiers, transformId));
            }
            case NUMERIC_LITERAL -> {
                NumericLiteral literal = (NumericLiteral) pattern;
                if (!literal.isWildcard()) {
                    yield NumericLiteral.of(literal.value());
                }
                NumericLiteral bound = resolve(literal.id(), expressions, identifiers, transformId);
                // a wildcard passed through keeps its name
                yield bound.isWildcard()
                        ? NumericLiteral.wildcard(bound.id())
                        : NumericLiteral.of(bound.value());
            }
        };
    }

    private static NumericLiteral resolve(
            String id, List<Expression> expressions, List<String> identifiers, String transformId) {
        int index = identifiers.indexOf(id);
        if (index < 0) {
            throw new MalformedTransformException(
                    "Output wildcard '" + id + "' has no binding in input identifiers " + identifiers,
                    transformId,
                    null);
        }
        Expression bound = expressions.get(index);
        if (!(bound instanceof NumericLiteral boundLiteral)) {
            throw new MalformedTransformException(
                    "Output wildcard '" + id + "' resolves to " + bound + ", not a literal",
                    transformId,
                    null);
        }
        return boundLiteral;
    }
}
