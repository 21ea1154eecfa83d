package io.flowmodel.content;

public enum ContentKind {
    FIELD,
    COLLECTION,
    ARRAY
}
