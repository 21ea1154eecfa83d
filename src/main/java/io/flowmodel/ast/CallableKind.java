package io.flowmodel.ast;

/**
 * Kind of a callable body.
 */
public enum CallableKind {
    /** Instance or static method */
    METHOD,
    /** Object constructor ({@code <init>}) */
    CONSTRUCTOR,
    /** Destructor; usually invoked implicitly without a receiver expression */
    DESTRUCTOR,
    /** Free function outside any type */
    FUNCTION,
    /** Static or instance initializer block ({@code <clinit>}) */
    INITIALIZER
}
