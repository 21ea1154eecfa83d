package io.flowmodel.ast;

/**
 * Syntactic kind of an {@link Expr}, one constant per permitted implementation.
 */
public enum ExprKind {
    VARIABLE_ACCESS,
    FIELD_ACCESS,
    ARRAY_ACCESS,
    CALL,
    ASSIGNMENT,
    ARRAY_CREATION,
    LITERAL,
    OPAQUE
}
