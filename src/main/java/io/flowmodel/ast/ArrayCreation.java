package io.flowmodel.ast;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Array creation, either with dimension expressions ({@code new T[n]}) or with an
 * initializer list ({@code new T[]{a, b}}).
 * <p>
 * An implicit array is synthesized at a call site to pack trailing variadic arguments; its
 * elements are the packed argument expressions.
 */
public final class ArrayCreation extends BaseExpr implements Expr {

    private final List<Expr> dimensions;
    private final List<Expr> elements;
    private final boolean implicit;

    ArrayCreation(TypeRef.ArrayType type, List<Expr> dimensions, List<Expr> elements,
                  boolean implicit, SourceLocation location) {
        super(type, location);
        this.dimensions = List.copyOf(dimensions);
        this.elements = List.copyOf(elements);
        this.implicit = implicit;
    }

    public List<Expr> dimensions() {
        return dimensions;
    }

    public List<Expr> elements() {
        return elements;
    }

    /**
     * Whether the array was synthesized to carry packed variadic arguments.
     */
    public boolean isImplicit() {
        return implicit;
    }

    @Override
    public ExprKind kind() {
        return ExprKind.ARRAY_CREATION;
    }

    @Override
    public List<Expr> children() {
        return Stream.concat(dimensions.stream(), elements.stream()).toList();
    }

    @Override
    String describe() {
        String body = elements.stream()
                .map(e -> ((BaseExpr) e).describe())
                .collect(Collectors.joining(", ", "{", "}"));
        return (implicit ? "varargs" : "new " + type().displayName()) + body;
    }
}
