package io.flowmodel.ast;

import java.util.List;

/**
 * A constant: number, string, class literal or {@code null}.
 */
public final class Literal extends BaseExpr implements Expr {

    private final Object value;

    Literal(Object value, TypeRef type, SourceLocation location) {
        super(type, location);
        this.value = value;
    }

    public Object value() {
        return value;
    }

    @Override
    public ExprKind kind() {
        return ExprKind.LITERAL;
    }

    @Override
    public List<Expr> children() {
        return List.of();
    }

    @Override
    String describe() {
        return value instanceof String s ? "\"" + s + "\"" : String.valueOf(value);
    }
}
