package io.flowmodel.content;

import io.flowmodel.ast.TypeRef;

import java.util.Optional;

/**
 * Any element of any array, as a single bucket.
 */
public enum ArrayContent implements Content {
    INSTANCE;

    @Override
    public ContentKind kind() {
        return ContentKind.ARRAY;
    }

    @Override
    public Optional<TypeRef> declaredType() {
        return Optional.empty();
    }
}
