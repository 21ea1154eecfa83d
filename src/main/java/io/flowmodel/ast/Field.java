package io.flowmodel.ast;

import java.util.Objects;

/**
 * A declared field. Two accesses to the same declaration anywhere in the program
 * refer to an equal {@code Field}.
 *
 * @param declaringType FQN of the declaring type
 * @param name          Field name
 * @param type          Declared type
 * @param isStatic      Whether the field is static
 */
public record Field(
        String declaringType,
        String name,
        TypeRef type,
        boolean isStatic
) {
    public Field {
        if (declaringType == null || declaringType.isBlank()) {
            throw new IllegalArgumentException("Declaring type cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Field name cannot be null or blank");
        }
        Objects.requireNonNull(type, "type");
    }

    public static Field instanceField(String declaringType, String name, TypeRef type) {
        return new Field(declaringType, name, type, false);
    }

    public static Field staticField(String declaringType, String name, TypeRef type) {
        return new Field(declaringType, name, type, true);
    }

    /**
     * Returns a unique key for this field: {@code declaringType.name}.
     */
    public String key() {
        return declaringType + "." + name;
    }
}
