package io.flowmodel.step;

import io.flowmodel.node.Node;
import io.flowmodel.node.NodeFactory;

import java.util.List;
import java.util.stream.Stream;

/**
 * Source of jump steps. The default strategy {@link #NONE} produces none.
 */
@FunctionalInterface
public interface JumpStepStrategy {

    JumpStepStrategy NONE = nodes -> Stream.empty();

    /**
     * Every jump step of the program behind {@code nodes}.
     */
    Stream<JumpStep> jumpSteps(NodeFactory nodes);

    default List<JumpStep> jumpStepsFrom(NodeFactory nodes, Node source) {
        return jumpSteps(nodes)
                .filter(step -> step.source().equals(source))
                .toList();
    }
}
