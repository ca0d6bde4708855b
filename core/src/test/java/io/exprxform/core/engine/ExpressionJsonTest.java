package io.exprxform.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import io.exprxform.core.model.BinaryAddition;
import io.exprxform.core.model.NumericLiteral;
import org.junit.jupiter.api.Test;

class ExpressionJsonTest {

    @Test
    void rendersPatternTree() {
        BinaryAddition pattern = BinaryAddition.of(NumericLiteral.of(0L), NumericLiteral.wildcard("right"));

        JsonNode json = ExpressionJson.toJson(pattern);

        assertThat(json.path("add").path("left").path("literal").asText()).isEqualTo("0");
        assertThat(json.path("add").path("right").path("wildcard").asText()).isEqualTo("right");
        assertThat(json.has("id")).isFalse();
    }

    @Test
    void rendersLiteralsUnsigned() {
        assertThat(ExpressionJson.render(NumericLiteral.of(-1L))).isEqualTo("{\"literal\":\"18446744073709551615\"}");
    }

    @Test
    void rendersIdentifierOnAddition() {
        BinaryAddition tree = BinaryAddition.of(NumericLiteral.of(1L), NumericLiteral.of(2L), "sum");

        assertThat(ExpressionJson.render(tree))
                .isEqualTo("{\"add\":{\"left\":{\"literal\":\"1\"},\"right\":{\"literal\":\"2\"}},\"id\":\"sum\"}");
    }
}
