package io.flowmodel.ast;

/**
 * Position of an expression or statement inside a callable body.
 *
 * @param callableKey Key of the enclosing callable
 * @param index       Creation order of the element within that body
 */
public record SourceLocation(String callableKey, int index) {

    @Override
    public String toString() {
        return callableKey + "@" + index;
    }
}
