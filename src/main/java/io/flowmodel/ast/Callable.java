package io.flowmodel.ast;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A function, method, constructor or destructor that calls can target and that may own a body.
 *
 * @param declaringType  FQN of the declaring type (the unit name for free functions)
 * @param name           Callable name ({@code <init>} for JVM constructors)
 * @param parameterTypes Declared parameter types in order; a varargs callable declares an array last
 * @param returnType     Declared return type ({@link TypeRef#VOID} for none)
 * @param kind           Method, constructor, destructor, function or initializer
 * @param isStatic       Whether the callable has no instance receiver
 * @param isVarargs      Whether trailing arguments are packed into the last (array) parameter
 */
public record Callable(
        String declaringType,
        String name,
        List<TypeRef> parameterTypes,
        TypeRef returnType,
        CallableKind kind,
        boolean isStatic,
        boolean isVarargs
) {
    public Callable {
        if (declaringType == null || declaringType.isBlank()) {
            throw new IllegalArgumentException("Declaring type cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Callable name cannot be null or blank");
        }
        parameterTypes = parameterTypes != null ? List.copyOf(parameterTypes) : List.of();
        if (returnType == null) {
            returnType = TypeRef.VOID;
        }
        if (kind == null) {
            kind = CallableKind.METHOD;
        }
        if (isVarargs && (parameterTypes.isEmpty() || !parameterTypes.get(parameterTypes.size() - 1).isArray())) {
            throw new IllegalArgumentException("Varargs callable " + name + " must declare an array as last parameter");
        }
    }

    /**
     * Returns a unique key: {@code declaringType#name(paramType,...)}.
     */
    public String key() {
        return declaringType + "#" + name + parameterTypes.stream()
                .map(TypeRef::displayName)
                .collect(Collectors.joining(",", "(", ")"));
    }

    public int parameterCount() {
        return parameterTypes.size();
    }

    public boolean isConstructor() {
        return kind == CallableKind.CONSTRUCTOR;
    }

    public boolean isDestructor() {
        return kind == CallableKind.DESTRUCTOR;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String declaringType;
        private String name;
        private List<TypeRef> parameterTypes = List.of();
        private TypeRef returnType = TypeRef.VOID;
        private CallableKind kind = CallableKind.METHOD;
        private boolean isStatic;
        private boolean isVarargs;

        public Builder declaringType(String declaringType) {
            this.declaringType = declaringType;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder parameterTypes(List<TypeRef> parameterTypes) {
            this.parameterTypes = parameterTypes;
            return this;
        }

        public Builder parameterTypes(TypeRef... parameterTypes) {
            this.parameterTypes = List.of(parameterTypes);
            return this;
        }

        public Builder returnType(TypeRef returnType) {
            this.returnType = returnType;
            return this;
        }

        public Builder kind(CallableKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder isStatic(boolean isStatic) {
            this.isStatic = isStatic;
            return this;
        }

        public Builder isVarargs(boolean isVarargs) {
            this.isVarargs = isVarargs;
            return this;
        }

        public Callable build() {
            return new Callable(declaringType, name, parameterTypes, returnType, kind, isStatic, isVarargs);
        }
    }
}
