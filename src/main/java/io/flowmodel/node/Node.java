package io.flowmodel.node;

import io.flowmodel.ast.Expr;
import io.flowmodel.ast.TypeRef;

/**
 * A flow-relevant syntactic position. Each node wraps exactly one expression; identity is
 * (kind, expression). Obtain nodes through {@link NodeFactory#node(Expr)}, which picks the
 * single canonical kind of an expression.
 */
public sealed interface Node permits ExprNode, ArgumentNode, ReturnNode, OutNode {

    NodeKind kind();

    Expr asExpr();

    default TypeRef type() {
        return asExpr().type();
    }
}
