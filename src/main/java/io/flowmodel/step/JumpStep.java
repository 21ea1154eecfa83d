package io.flowmodel.step;

import io.flowmodel.node.Node;

import java.util.Objects;

/**
 * Flow from {@code source} to {@code target} that bypasses the call structure.
 */
public record JumpStep(Node source, Node target) {

    public JumpStep {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
    }
}
