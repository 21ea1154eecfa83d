package io.flowmodel.node;

/**
 * The closed set of node kinds, one per {@link Node} implementation.
 */
public enum NodeKind {
    /** Any other expression */
    EXPR,
    /** Positional argument, explicit receiver, or an object creation as its own instance argument */
    ARGUMENT,
    /** Operand of a return statement */
    RETURN,
    /** A call viewed as the place its result is consumed */
    OUT
}
