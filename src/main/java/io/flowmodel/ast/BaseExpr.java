package io.flowmodel.ast;

import java.util.Objects;

/**
 * Shared state of the expression implementations. Equality is identity.
 */
abstract class BaseExpr {

    private final TypeRef type;
    private final SourceLocation location;

    BaseExpr(TypeRef type, SourceLocation location) {
        this.type = Objects.requireNonNull(type, "type");
        this.location = Objects.requireNonNull(location, "location");
    }

    public TypeRef type() {
        return type;
    }

    public SourceLocation location() {
        return location;
    }

    abstract String describe();

    @Override
    public String toString() {
        return describe() + " @" + location;
    }
}
