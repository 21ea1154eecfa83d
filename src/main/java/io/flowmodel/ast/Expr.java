package io.flowmodel.ast;

import java.util.List;

/**
 * An expression occurrence in a callable body.
 * <p>
 * Identity is the occurrence: two textually equal expressions at different sites are
 * different elements. Expressions are created through {@link BodyBuilder} and are immutable.
 */
public sealed interface Expr
        permits VariableAccess, FieldAccess, ArrayAccess, Call, Assignment, ArrayCreation, Literal, OpaqueExpr {

    ExprKind kind();

    /**
     * Static type of the value this expression produces.
     */
    TypeRef type();

    SourceLocation location();

    /**
     * Direct sub-expressions in evaluation order.
     */
    List<Expr> children();
}
