package io.flowmodel.ast;

import java.util.List;

/**
 * Any operation the model does not interpret (arithmetic, casts, instanceof, lambdas...).
 * Operands stay reachable as children but the expression contributes no store or read facts.
 */
public final class OpaqueExpr extends BaseExpr implements Expr {

    private final String operation;
    private final List<Expr> operands;

    OpaqueExpr(String operation, TypeRef type, List<Expr> operands, SourceLocation location) {
        super(type, location);
        this.operation = operation;
        this.operands = List.copyOf(operands);
    }

    public String operation() {
        return operation;
    }

    public List<Expr> operands() {
        return operands;
    }

    @Override
    public ExprKind kind() {
        return ExprKind.OPAQUE;
    }

    @Override
    public List<Expr> children() {
        return operands;
    }

    @Override
    String describe() {
        return operation + operands.stream().map(o -> ((BaseExpr) o).describe()).toList();
    }
}
