package io.exprxform.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import io.exprxform.core.model.BinaryAddition;
import io.exprxform.core.model.Expression;
import io.exprxform.core.model.NumericLiteral;
import io.exprxform.core.spi.RewriteListener;
import io.exprxform.core.spi.RewriteListener.PassCompletedEvent;
import io.exprxform.core.spi.RewriteListener.TransformAppliedEvent;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

/** Tests for the {@link RewriteListener} SPI as driven by {@link Optimizer}. */
@DisplayName("RewriteListenerTest")
class RewriteListenerTest {

    private RewriteListener listener;
    private Optimizer optimizer;

    @BeforeEach
    void setUp() {
        listener = mock(RewriteListener.class);
        optimizer = new Optimizer(BuiltinTransforms.defaults(), listener);
    }

    @Test
    @DisplayName("rewrites and passes are reported in order")
    void eventsInOrder() {
        Expression input = BinaryAddition.of(
                BinaryAddition.of(NumericLiteral.of(0L), NumericLiteral.of(1L)),
                BinaryAddition.of(NumericLiteral.of(1L), NumericLiteral.of(0L)));

        optimizer.optimize(input);

        InOrder order = inOrder(listener);
        order.verify(listener).onTransformApplied(new TransformAppliedEvent("zero-left", "root.left", "(0 + 1)", "1"));
        order.verify(listener).onPassCompleted(new PassCompletedEvent("zero-left", 1));
        order.verify(listener).onTransformApplied(new TransformAppliedEvent("zero-right", "root.right", "(1 + 0)", "1"));
        order.verify(listener).onPassCompleted(new PassCompletedEvent("zero-right", 1));
        order.verifyNoMoreInteractions();
    }

    @Test
    @DisplayName("a pass without matches reports only completion")
    void emptyPass() {
        optimizer.applyTransform(
                BuiltinTransforms.zeroOnLeft(), BinaryAddition.of(NumericLiteral.of(2L), NumericLiteral.of(3L)));

        verify(listener, never()).onTransformApplied(any());
        verify(listener).onPassCompleted(new PassCompletedEvent("zero-left", 0));
    }

    @Test
    @DisplayName("a failing listener does not affect the rewrite")
    void failingListenerIgnored() {
        doThrow(new IllegalStateException("boom")).when(listener).onTransformApplied(any());
        doThrow(new IllegalStateException("boom")).when(listener).onPassCompleted(any());

        Expression output = optimizer.optimize(BinaryAddition.of(NumericLiteral.of(0L), NumericLiteral.of(9L)));

        assertThat(output).isEqualTo(NumericLiteral.of(9L));
    }

    @Test
    @DisplayName("no listener is fine")
    void nullListener() {
        Optimizer quiet = new Optimizer(List.of(BuiltinTransforms.zeroOnRight()), null);

        assertThat(quiet.optimize(BinaryAddition.of(NumericLiteral.of(9L), NumericLiteral.of(0L))))
                .isEqualTo(NumericLiteral.of(9L));
    }
}
