package io.exprxform.core.model;

/** Closed set of node kinds an {@link Expression} tree is built from. */
public enum ExpressionType {
    NUMERIC_LITERAL,
    BINARY_ADDITION
}
