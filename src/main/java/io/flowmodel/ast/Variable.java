package io.flowmodel.ast;

import java.util.Objects;

/**
 * A local variable, parameter or the receiver {@code this} of a callable.
 */
public record Variable(String name, TypeRef type, VariableKind kind) {

    public Variable {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Variable name cannot be null or blank");
        }
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(kind, "kind");
    }

    public static Variable local(String name, TypeRef type) {
        return new Variable(name, type, VariableKind.LOCAL);
    }

    public static Variable parameter(String name, TypeRef type) {
        return new Variable(name, type, VariableKind.PARAMETER);
    }

    public static Variable self(TypeRef type) {
        return new Variable("this", type, VariableKind.THIS);
    }
}
