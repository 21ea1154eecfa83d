package io.flowmodel.node;

import io.flowmodel.ast.Expr;

import java.util.Objects;

public record ExprNode(Expr expr) implements Node {

    public ExprNode {
        Objects.requireNonNull(expr, "expr");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EXPR;
    }

    @Override
    public Expr asExpr() {
        return expr;
    }
}
