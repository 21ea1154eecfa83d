package io.flowmodel.node;

import io.flowmodel.ast.Expr;

import java.util.Objects;

public record ReturnNode(Expr expr, ReturnKind returnKind) implements Node {

    public ReturnNode {
        Objects.requireNonNull(expr, "expr");
        Objects.requireNonNull(returnKind, "returnKind");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.RETURN;
    }

    @Override
    public Expr asExpr() {
        return expr;
    }
}
