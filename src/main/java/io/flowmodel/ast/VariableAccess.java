package io.flowmodel.ast;

import java.util.List;

/**
 * A read or write of a local variable, parameter or {@code this}.
 */
public final class VariableAccess extends BaseExpr implements Expr {

    private final Variable variable;

    VariableAccess(Variable variable, SourceLocation location) {
        super(variable.type(), location);
        this.variable = variable;
    }

    public Variable variable() {
        return variable;
    }

    @Override
    public ExprKind kind() {
        return ExprKind.VARIABLE_ACCESS;
    }

    @Override
    public List<Expr> children() {
        return List.of();
    }

    @Override
    String describe() {
        return variable.name();
    }
}
