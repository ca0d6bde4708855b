package io.exprxform.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.exprxform.core.error.MalformedTransformException;
import io.exprxform.core.error.RewriteException;
import org.junit.jupiter.api.Test;

/** Construction-time validation of {@link Transform} wildcard bindings. */
class TransformTest {

    @Test
    void acceptsOutputWildcardBoundByInput() {
        Transform transform = new Transform(
                "swap",
                "Swap operands",
                BinaryAddition.of(NumericLiteral.wildcard("a"), NumericLiteral.wildcard("b")),
                BinaryAddition.of(NumericLiteral.wildcard("b"), NumericLiteral.wildcard("a")));

        assertThat(transform.id()).isEqualTo("swap");
        assertThat(transform).hasToString("swap: (?a + ?b) -> (?b + ?a)");
    }

    @Test
    void acceptsConcreteOutputWithoutWildcards() {
        Transform transform = new Transform(
                "fold-zero",
                "Fold 0 + 0",
                BinaryAddition.of(NumericLiteral.of(0L), NumericLiteral.of(0L)),
                NumericLiteral.of(0L));

        assertThat(transform.outputPattern()).isEqualTo(NumericLiteral.of(0L));
    }

    @Test
    void rejectsUnboundOutputWildcard() {
        assertThatThrownBy(() -> new Transform(
                        "broken",
                        "Broken",
                        BinaryAddition.of(NumericLiteral.of(0L), NumericLiteral.wildcard("right")),
                        NumericLiteral.wildcard("left")))
                .isInstanceOf(MalformedTransformException.class)
                .hasMessageContaining("'left'")
                .satisfies(e -> {
                    MalformedTransformException ex = (MalformedTransformException) e;
                    assertThat(ex.transformId()).isEqualTo("broken");
                    assertThat(ex.phase()).isEqualTo(RewriteException.Phase.LOAD);
                });
    }

    @Test
    void rejectsIdentifierBoundOnlyByAnAddition() {
        // the identifier exists in the input, but not on a wildcard leaf
        assertThatThrownBy(() -> new Transform(
                        "addition-id",
                        "Addition id",
                        BinaryAddition.of(NumericLiteral.of(0L), NumericLiteral.of(1L), "sum"),
                        NumericLiteral.wildcard("sum")))
                .isInstanceOf(MalformedTransformException.class);
    }

    @Test
    void rejectsWildcardShadowedByEarlierAddition() {
        // ((1 + 2)#x + ?x): the addition comes first in post-order and would be bound instead
        assertThatThrownBy(() -> new Transform(
                        "shadowed-addition",
                        "Shadowed by addition",
                        BinaryAddition.of(
                                BinaryAddition.of(NumericLiteral.of(1L), NumericLiteral.of(2L), "x"),
                                NumericLiteral.wildcard("x")),
                        NumericLiteral.wildcard("x")))
                .isInstanceOf(MalformedTransformException.class)
                .hasMessageContaining("non-wildcard node (1 + 2)")
                .satisfies(e -> assertThat(((MalformedTransformException) e).phase())
                        .isEqualTo(RewriteException.Phase.LOAD));
    }

    @Test
    void rejectsWildcardShadowedByEarlierConcreteLiteral() {
        // (5#x + ?x) -> ?x would rewrite (5 + 9) to 5 instead of 9
        assertThatThrownBy(() -> new Transform(
                        "shadowed-literal",
                        "Shadowed by literal",
                        BinaryAddition.of(
                                NumericLiteral.of(NumericValue.of(5L), "x"), NumericLiteral.wildcard("x")),
                        NumericLiteral.wildcard("x")))
                .isInstanceOf(MalformedTransformException.class)
                .hasMessageContaining("'x'")
                .hasMessageContaining("non-wildcard node 5");
    }

    @Test
    void acceptsIdentifierReusedOnLaterEnclosingAddition() {
        // post-order visits ?x before the addition that repeats its identifier
        Transform transform = new Transform(
                "enclosing",
                "Enclosing addition",
                BinaryAddition.of(
                        BinaryAddition.of(NumericLiteral.wildcard("x"), NumericLiteral.of(0L), "x"),
                        NumericLiteral.of(1L)),
                NumericLiteral.wildcard("x"));

        assertThat(transform.id()).isEqualTo("enclosing");
    }

    @Test
    void rejectsAnonymousOutputWildcard() {
        assertThatThrownBy(() -> new Transform(
                        "anonymous",
                        "Anonymous",
                        BinaryAddition.of(NumericLiteral.of(0L), NumericLiteral.wildcard("")),
                        NumericLiteral.wildcard("")))
                .isInstanceOf(MalformedTransformException.class)
                .hasMessageContaining("without an identifier");
    }

    @Test
    void rejectsNullComponents() {
        assertThatThrownBy(() -> new Transform("x", "x", null, NumericLiteral.of(1L)))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("inputPattern");
    }
}
