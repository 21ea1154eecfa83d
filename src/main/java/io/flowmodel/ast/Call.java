package io.flowmodel.ast;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A call of a {@link Callable}.
 * <p>
 * Object creation ({@code new C(a, b)}) is a constructor call with no qualifier: the call
 * expression itself stands for the object being constructed. A delegating constructor call
 * ({@code super(...)}, {@code this(...)}) targets a constructor but has {@code this} as qualifier
 * and is not an object creation.
 */
public final class Call extends BaseExpr implements Expr {

    private final Callable target;
    private final List<Expr> arguments;
    private final Expr qualifier;
    private final boolean constructorCall;

    Call(Callable target, Expr qualifier, List<Expr> arguments, boolean constructorCall, SourceLocation location) {
        super(constructorCall ? new TypeRef.ClassType(target.declaringType()) : target.returnType(), location);
        if (constructorCall && qualifier != null) {
            throw new IllegalArgumentException("Object creation " + target.key() + " cannot have a qualifier");
        }
        if (constructorCall && !target.isConstructor()) {
            throw new IllegalArgumentException("Object creation must target a constructor: " + target.key());
        }
        this.target = target;
        this.qualifier = qualifier;
        this.arguments = List.copyOf(arguments);
        this.constructorCall = constructorCall;
    }

    public Callable target() {
        return target;
    }

    /**
     * Explicit arguments in position order. A synthesized varargs array counts as one argument.
     */
    public List<Expr> arguments() {
        return arguments;
    }

    public int argumentCount() {
        return arguments.size();
    }

    /**
     * The explicit receiver expression, if the call syntax has one.
     */
    public Optional<Expr> qualifier() {
        return Optional.ofNullable(qualifier);
    }

    /**
     * Whether this call creates a new object.
     */
    public boolean isConstructorCall() {
        return constructorCall;
    }

    @Override
    public ExprKind kind() {
        return ExprKind.CALL;
    }

    @Override
    public List<Expr> children() {
        if (qualifier == null) {
            return arguments;
        }
        return Stream.concat(Stream.of(qualifier), arguments.stream()).toList();
    }

    @Override
    String describe() {
        String args = arguments.stream()
                .map(a -> ((BaseExpr) a).describe())
                .collect(Collectors.joining(", ", "(", ")"));
        if (constructorCall) {
            return "new " + target.declaringType() + args;
        }
        String prefix = qualifier != null ? ((BaseExpr) qualifier).describe() + "." : "";
        return prefix + target.name() + args;
    }
}
