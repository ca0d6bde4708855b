package io.exprxform.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.exprxform.core.model.BinaryAddition;
import io.exprxform.core.model.Expression;
import io.exprxform.core.model.NumericLiteral;

/**
 * JSON rendering of expression trees for diagnostics and log output.
 *
 * <pre>
 * {"add": {"left": {"literal": "0"}, "right": {"wildcard": "right"}}}
 * </pre>
 *
 * Literal values are rendered as unsigned decimal strings so values above {@code Long.MAX_VALUE}
 * survive the trip through JSON tooling.
 */
public final class ExpressionJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ExpressionJson() {}

    /** Converts {@code root} into a JSON tree. */
    public static JsonNode toJson(Expression root) {
        return switch (root.type()) {
            case BINARY_ADDITION -> {
                BinaryAddition addition = (BinaryAddition) root;
                ObjectNode node = MAPPER.createObjectNode();
                ObjectNode add = node.putObject("add");
                add.set("left", toJson(addition.left()));
                add.set("right", toJson(addition.right()));
                if (addition.hasId()) {
                    node.put("id", addition.id());
                }
                yield node;
            }
            case NUMERIC_LITERAL -> {
                NumericLiteral literal = (NumericLiteral) root;
                ObjectNode node = MAPPER.createObjectNode();
                if (literal.isWildcard()) {
                    node.put("wildcard", literal.id());
                } else {
                    node.put("literal", literal.value().toString());
                    if (literal.hasId()) {
                        node.put("id", literal.id());
                    }
                }
                yield node;
            }
        };
    }

    /** Renders {@code root} as compact JSON text. */
    public static String render(Expression root) {
        try {
            return MAPPER.writeValueAsString(toJson(root));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize expression tree", e);
        }
    }
}
