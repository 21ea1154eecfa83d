package io.flowmodel.content;

import io.flowmodel.ast.TypeRef;

import java.util.Optional;

/**
 * A storage location inside an object: a declared field, or one of the two system-wide
 * buckets for collection and array elements.
 */
public sealed interface Content permits FieldContent, CollectionContent, ArrayContent {

    ContentKind kind();

    /**
     * Declared type of the stored values. The element buckets expose none and are
     * compatible with every type.
     */
    Optional<TypeRef> declaredType();
}
