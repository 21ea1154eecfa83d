package io.flowmodel.ast;

import java.util.Objects;
import java.util.Set;

/**
 * Static type of an expression, field or callable signature.
 * Names use Java source spelling: {@code int}, {@code java.lang.String}, {@code java.lang.Object[]}.
 */
public sealed interface TypeRef {

    ClassType OBJECT = new ClassType("java.lang.Object");
    PrimitiveType VOID = new PrimitiveType("void");

    /**
     * A primitive type, including {@code void}.
     */
    record PrimitiveType(String name) implements TypeRef {
        private static final Set<String> NAMES = Set.of(
                "boolean", "byte", "char", "short", "int", "long", "float", "double", "void");

        public PrimitiveType {
            if (!NAMES.contains(name)) {
                throw new IllegalArgumentException("Not a primitive type: " + name);
            }
        }

        @Override
        public String displayName() {
            return name;
        }
    }

    /**
     * A class, interface, enum or record type, by fully qualified name.
     */
    record ClassType(String fqn) implements TypeRef {
        public ClassType {
            if (fqn == null || fqn.isBlank()) {
                throw new IllegalArgumentException("Class type name cannot be null or blank");
            }
        }

        @Override
        public String displayName() {
            return fqn;
        }
    }

    record ArrayType(TypeRef component) implements TypeRef {
        public ArrayType {
            Objects.requireNonNull(component, "component");
        }

        @Override
        public String displayName() {
            return component.displayName() + "[]";
        }
    }

    /**
     * A generic type parameter. A null bound means {@code java.lang.Object}.
     */
    record TypeVariable(String name, TypeRef bound) implements TypeRef {
        public TypeVariable {
            Objects.requireNonNull(name, "name");
            if (bound == null) {
                bound = OBJECT;
            }
        }

        @Override
        public String displayName() {
            return name;
        }
    }

    String displayName();

    default boolean isPrimitive() {
        return this instanceof PrimitiveType;
    }

    default boolean isArray() {
        return this instanceof ArrayType;
    }

    /**
     * Parses a source-style type name. Trailing {@code []} pairs produce array types.
     */
    static TypeRef of(String name) {
        Objects.requireNonNull(name, "name");
        String trimmed = name.trim();
        if (trimmed.endsWith("[]")) {
            return new ArrayType(of(trimmed.substring(0, trimmed.length() - 2)));
        }
        if (PrimitiveType.NAMES.contains(trimmed)) {
            return new PrimitiveType(trimmed);
        }
        return new ClassType(trimmed);
    }

    static ClassType classType(String fqn) {
        return new ClassType(fqn);
    }

    static ArrayType arrayOf(TypeRef component) {
        return new ArrayType(component);
    }
}
