package io.flowmodel.node;

import io.flowmodel.ast.Expr;

import java.util.Objects;

/**
 * An expression passed into a call: at a position, as the receiver, or an object creation
 * standing for the object it constructs. The (call, position) pairs are derived by
 * {@code CallDispatch#argumentOf}.
 */
public record ArgumentNode(Expr expr) implements Node {

    public ArgumentNode {
        Objects.requireNonNull(expr, "expr");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ARGUMENT;
    }

    @Override
    public Expr asExpr() {
        return expr;
    }
}
