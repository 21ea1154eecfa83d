package io.flowmodel.ast;

import java.util.List;

/**
 * Element access {@code array[index]}.
 */
public final class ArrayAccess extends BaseExpr implements Expr {

    private final Expr array;
    private final Expr index;

    ArrayAccess(Expr array, Expr index, SourceLocation location) {
        super(elementType(array.type()), location);
        this.array = array;
        this.index = index;
    }

    private static TypeRef elementType(TypeRef arrayType) {
        return arrayType instanceof TypeRef.ArrayType a ? a.component() : TypeRef.OBJECT;
    }

    public Expr array() {
        return array;
    }

    public Expr index() {
        return index;
    }

    @Override
    public ExprKind kind() {
        return ExprKind.ARRAY_ACCESS;
    }

    @Override
    public List<Expr> children() {
        return List.of(array, index);
    }

    @Override
    String describe() {
        return ((BaseExpr) array).describe() + "[" + ((BaseExpr) index).describe() + "]";
    }
}
