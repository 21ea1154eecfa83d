package io.flowmodel.node;

/**
 * How a value leaves a callable. Consumers switch over it exhaustively, so a new kind
 * (e.g. exceptional return) is a compile-checked change.
 */
public enum ReturnKind {
    NORMAL
}
