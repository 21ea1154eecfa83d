package io.flowmodel.ast;

/**
 * Kind of a declared type.
 */
public enum TypeKind {
    CLASS,
    INTERFACE,
    ENUM,
    RECORD,
    ANNOTATION;

    public boolean isInterface() {
        return this == INTERFACE || this == ANNOTATION;
    }
}
