package io.flowmodel.step;

import io.flowmodel.content.Content;
import io.flowmodel.node.Node;

import java.util.Objects;

/**
 * {@code content} of the object denoted by {@code source} is read into {@code target}.
 */
public record ReadStep(Node source, Content content, Node target) {

    public ReadStep {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(target, "target");
    }
}
