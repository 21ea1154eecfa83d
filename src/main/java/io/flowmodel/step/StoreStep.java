package io.flowmodel.step;

import io.flowmodel.content.Content;
import io.flowmodel.node.Node;

import java.util.Objects;

/**
 * The value at {@code source} is written into {@code content} of the object denoted by
 * {@code target}.
 */
public record StoreStep(Node source, Content content, Node target) {

    public StoreStep {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(target, "target");
    }
}
