package io.flowmodel.content;

import io.flowmodel.ast.TypeRef;

import java.util.Optional;

/**
 * Any element of any collection. A single bucket: every element write to any collection is
 * visible to every element read from any collection.
 */
public enum CollectionContent implements Content {
    INSTANCE;

    @Override
    public ContentKind kind() {
        return ContentKind.COLLECTION;
    }

    @Override
    public Optional<TypeRef> declaredType() {
        return Optional.empty();
    }
}
