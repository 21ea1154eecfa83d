package io.flowmodel.ast;

public enum VariableKind {
    THIS,
    PARAMETER,
    LOCAL
}
