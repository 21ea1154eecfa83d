package io.flowmodel.ast;

import java.util.Set;

/**
 * A type declared in the analyzed program.
 *
 * @param fqn        Fully qualified type name
 * @param kind       Class, interface, enum, record or annotation
 * @param superclass FQN of the direct superclass (null for java.lang.Object and interfaces)
 * @param interfaces FQNs of directly implemented (or, for interfaces, extended) interfaces
 * @param isFinal    Whether the type cannot be subclassed
 */
public record TypeDecl(
        String fqn,
        TypeKind kind,
        String superclass,
        Set<String> interfaces,
        boolean isFinal
) {
    public TypeDecl {
        if (fqn == null || fqn.isBlank()) {
            throw new IllegalArgumentException("Type name cannot be null or blank");
        }
        if (kind == null) {
            kind = TypeKind.CLASS;
        }
        interfaces = interfaces != null ? Set.copyOf(interfaces) : Set.of();
    }

    public boolean isInterface() {
        return kind.isInterface();
    }

    public TypeRef.ClassType asType() {
        return new TypeRef.ClassType(fqn);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String fqn;
        private TypeKind kind = TypeKind.CLASS;
        private String superclass;
        private Set<String> interfaces = Set.of();
        private boolean isFinal;

        public Builder fqn(String fqn) {
            this.fqn = fqn;
            return this;
        }

        public Builder kind(TypeKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder superclass(String superclass) {
            this.superclass = superclass;
            return this;
        }

        public Builder interfaces(Set<String> interfaces) {
            this.interfaces = interfaces;
            return this;
        }

        public Builder isFinal(boolean isFinal) {
            this.isFinal = isFinal;
            return this;
        }

        public TypeDecl build() {
            return new TypeDecl(fqn, kind, superclass, interfaces, isFinal);
        }
    }
}
