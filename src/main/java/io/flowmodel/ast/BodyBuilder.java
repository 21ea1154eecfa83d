package io.flowmodel.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Creates the expressions and statements of one callable body.
 * Obtained from {@link Program.Builder#body(Callable)}; every created element receives the
 * next {@link SourceLocation} of that body.
 */
public final class BodyBuilder {

    private final Callable callable;
    private final List<Statement> statements = new ArrayList<>();
    private int nextIndex = 0;

    BodyBuilder(Callable callable) {
        this.callable = callable;
    }

    public Callable callable() {
        return callable;
    }

    List<Statement> statements() {
        return List.copyOf(statements);
    }

    private SourceLocation nextLocation() {
        return new SourceLocation(callable.key(), nextIndex++);
    }

    // --- variables ---

    public VariableAccess access(Variable variable) {
        return new VariableAccess(Objects.requireNonNull(variable, "variable"), nextLocation());
    }

    /**
     * Access of the receiver {@code this}.
     */
    public VariableAccess self() {
        return access(Variable.self(new TypeRef.ClassType(callable.declaringType())));
    }

    /**
     * Access of the parameter at {@code index}, named {@code param<index>}.
     */
    public VariableAccess parameter(int index) {
        if (index < 0 || index >= callable.parameterCount()) {
            throw new IllegalArgumentException("No parameter " + index + " in " + callable.key());
        }
        return access(Variable.parameter("param" + index, callable.parameterTypes().get(index)));
    }

    // --- storage access ---

    public FieldAccess field(Expr qualifier, Field field) {
        Objects.requireNonNull(qualifier, "qualifier");
        if (field.isStatic()) {
            throw new IllegalArgumentException("Static field " + field.key() + " is accessed without qualifier");
        }
        return new FieldAccess(qualifier, field, nextLocation());
    }

    public FieldAccess staticField(Field field) {
        if (!field.isStatic()) {
            throw new IllegalArgumentException("Instance field " + field.key() + " needs a qualifier");
        }
        return new FieldAccess(null, field, nextLocation());
    }

    public ArrayAccess arrayElement(Expr array, Expr index) {
        return new ArrayAccess(Objects.requireNonNull(array, "array"), Objects.requireNonNull(index, "index"),
                nextLocation());
    }

    public Assignment assign(Expr lhs, Expr rhs) {
        return new Assignment(Objects.requireNonNull(lhs, "lhs"), Objects.requireNonNull(rhs, "rhs"), nextLocation());
    }

    // --- calls ---

    /**
     * Call with an explicit receiver; {@code qualifier} may be null for calls without one.
     */
    public Call call(Callable target, Expr qualifier, List<Expr> arguments) {
        Objects.requireNonNull(target, "target");
        return new Call(target, qualifier, arguments, false, nextLocation());
    }

    public Call call(Callable target, Expr qualifier, Expr... arguments) {
        return call(target, qualifier, Arrays.asList(arguments));
    }

    /**
     * Call without receiver syntax: a static method, a free function or an implicit destructor call.
     */
    public Call invoke(Callable target, Expr... arguments) {
        return call(target, null, Arrays.asList(arguments));
    }

    /**
     * Object creation {@code new C(arguments)}.
     */
    public Call construct(Callable constructor, List<Expr> arguments) {
        Objects.requireNonNull(constructor, "constructor");
        return new Call(constructor, null, arguments, true, nextLocation());
    }

    public Call construct(Callable constructor, Expr... arguments) {
        return construct(constructor, Arrays.asList(arguments));
    }

    /**
     * Call of a varargs callable whose trailing arguments {@code packed} are packed into a
     * synthesized array passed at the last position.
     */
    public Call varargsCall(Callable target, Expr qualifier, List<Expr> fixed, List<Expr> packed) {
        List<Expr> arguments = packArguments(target, fixed, packed);
        return call(target, qualifier, arguments);
    }

    /**
     * Object creation through a varargs constructor, packing {@code packed} like
     * {@link #varargsCall}.
     */
    public Call varargsConstruct(Callable constructor, List<Expr> fixed, List<Expr> packed) {
        List<Expr> arguments = packArguments(constructor, fixed, packed);
        return construct(constructor, arguments);
    }

    private List<Expr> packArguments(Callable target, List<Expr> fixed, List<Expr> packed) {
        if (!target.isVarargs()) {
            throw new IllegalArgumentException("Not a varargs callable: " + target.key());
        }
        if (fixed.size() != target.parameterCount() - 1) {
            throw new IllegalArgumentException("Expected " + (target.parameterCount() - 1)
                    + " fixed arguments for " + target.key() + " but got " + fixed.size());
        }
        TypeRef.ArrayType arrayType = (TypeRef.ArrayType) target.parameterTypes().get(target.parameterCount() - 1);
        List<Expr> arguments = new ArrayList<>(fixed);
        arguments.add(creation(arrayType, List.of(), packed, true));
        return arguments;
    }

    // --- arrays and constants ---

    /**
     * {@code new elementType[dimension]...}
     */
    public ArrayCreation newArray(TypeRef elementType, Expr... dimensions) {
        return new ArrayCreation(new TypeRef.ArrayType(elementType), Arrays.asList(dimensions), List.of(),
                false, nextLocation());
    }

    /**
     * {@code new elementType[]{elements}}
     */
    public ArrayCreation arrayOf(TypeRef elementType, List<Expr> elements) {
        return new ArrayCreation(new TypeRef.ArrayType(elementType), List.of(), elements, false, nextLocation());
    }

    private ArrayCreation creation(TypeRef.ArrayType type, List<Expr> dimensions, List<Expr> elements, boolean implicit) {
        return new ArrayCreation(type, dimensions, elements, implicit, nextLocation());
    }

    public Literal literal(Object value, TypeRef type) {
        return new Literal(value, type, nextLocation());
    }

    public Literal nullLiteral() {
        return literal(null, TypeRef.OBJECT);
    }

    public OpaqueExpr opaque(String operation, TypeRef type, List<Expr> operands) {
        return new OpaqueExpr(operation, type, operands, nextLocation());
    }

    public OpaqueExpr opaque(String operation, TypeRef type, Expr... operands) {
        return opaque(operation, type, Arrays.asList(operands));
    }

    // --- statements ---

    /**
     * Adds {@code expr;} as a statement and returns the expression.
     */
    public <E extends Expr> E statement(E expr) {
        statements.add(new ExpressionStatement(expr, nextLocation()));
        return expr;
    }

    public ReturnStatement returns(Expr operand) {
        ReturnStatement statement = new ReturnStatement(Objects.requireNonNull(operand, "operand"), nextLocation());
        statements.add(statement);
        return statement;
    }

    public ReturnStatement returnsVoid() {
        ReturnStatement statement = new ReturnStatement(null, nextLocation());
        statements.add(statement);
        return statement;
    }
}
