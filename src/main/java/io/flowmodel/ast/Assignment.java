package io.flowmodel.ast;

import java.util.List;

/**
 * Assignment {@code lhs = rhs}. The assignment is itself an expression whose value is the
 * assigned value, so it may be nested as an operand.
 */
public final class Assignment extends BaseExpr implements Expr {

    private final Expr lhs;
    private final Expr rhs;

    Assignment(Expr lhs, Expr rhs, SourceLocation location) {
        super(lhs.type(), location);
        if (!(lhs instanceof VariableAccess || lhs instanceof FieldAccess || lhs instanceof ArrayAccess)) {
            throw new IllegalArgumentException("Not an assignable expression: " + lhs);
        }
        this.lhs = lhs;
        this.rhs = rhs;
    }

    public Expr lhs() {
        return lhs;
    }

    public Expr rhs() {
        return rhs;
    }

    @Override
    public ExprKind kind() {
        return ExprKind.ASSIGNMENT;
    }

    @Override
    public List<Expr> children() {
        return List.of(lhs, rhs);
    }

    @Override
    String describe() {
        return ((BaseExpr) lhs).describe() + " = " + ((BaseExpr) rhs).describe();
    }
}
