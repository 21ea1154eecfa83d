package io.flowmodel.node;

import io.flowmodel.ast.Call;
import io.flowmodel.ast.Expr;

import java.util.Objects;

public record OutNode(Call call) implements Node {

    public OutNode {
        Objects.requireNonNull(call, "call");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.OUT;
    }

    @Override
    public Expr asExpr() {
        return call;
    }
}
