package io.flowmodel.ast;

import java.util.List;
import java.util.Optional;

/**
 * Access {@code qualifier.field}; static fields have no qualifier.
 * Whether the access is a write target is a property of its position,
 * see {@link Program#isAssignmentTarget(Expr)}.
 */
public final class FieldAccess extends BaseExpr implements Expr {

    private final Expr qualifier;
    private final Field field;

    FieldAccess(Expr qualifier, Field field, SourceLocation location) {
        super(field.type(), location);
        if (qualifier == null && !field.isStatic()) {
            throw new IllegalArgumentException("Instance field " + field.key() + " needs a qualifier");
        }
        this.qualifier = qualifier;
        this.field = field;
    }

    public Optional<Expr> qualifier() {
        return Optional.ofNullable(qualifier);
    }

    public Field field() {
        return field;
    }

    public boolean isStatic() {
        return field.isStatic();
    }

    @Override
    public ExprKind kind() {
        return ExprKind.FIELD_ACCESS;
    }

    @Override
    public List<Expr> children() {
        return qualifier != null ? List.of(qualifier) : List.of();
    }

    @Override
    String describe() {
        return (qualifier != null ? ((BaseExpr) qualifier).describe() : field.declaringType()) + "." + field.name();
    }
}
