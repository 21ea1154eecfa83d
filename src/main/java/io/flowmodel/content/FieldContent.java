package io.flowmodel.content;

import io.flowmodel.ast.Field;
import io.flowmodel.ast.TypeRef;

import java.util.Objects;
import java.util.Optional;

/**
 * Content of one declared field. Equal for every access to the same declaration, whichever
 * object owns it (field-sensitive, object-insensitive).
 */
public record FieldContent(Field field) implements Content {

    public FieldContent {
        Objects.requireNonNull(field, "field");
    }

    @Override
    public ContentKind kind() {
        return ContentKind.FIELD;
    }

    public String declaringType() {
        return field.declaringType();
    }

    @Override
    public Optional<TypeRef> declaredType() {
        return Optional.of(field.type());
    }

    @Override
    public String toString() {
        return "FieldContent[" + field.key() + "]";
    }
}
