package io.flowmodel.step;

import io.flowmodel.ast.ArrayAccess;
import io.flowmodel.ast.ArrayCreation;
import io.flowmodel.ast.Assignment;
import io.flowmodel.ast.Call;
import io.flowmodel.ast.Expr;
import io.flowmodel.ast.FieldAccess;
import io.flowmodel.ast.Program;
import io.flowmodel.content.ArrayContent;
import io.flowmodel.content.CollectionContent;
import io.flowmodel.content.Content;
import io.flowmodel.content.ContainerModel;
import io.flowmodel.content.FieldContent;
import io.flowmodel.node.Node;
import io.flowmodel.node.NodeFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Store, read and jump steps of a program.
 * <p>
 * Stores and reads are derived per site from the syntax around it:
 * <ul>
 *   <li>{@code obj.f = v} stores {@code v} into field {@code f} of the write-site {@code obj};
 *       static fields are never stored to.</li>
 *   <li>{@code arr[i] = v} and every element of an array creation with elements (including
 *       a synthesized varargs array) store into the array bucket.</li>
 *   <li>a container write call stores its last argument into the collection bucket of its
 *       receiver.</li>
 *   <li>a non-static field read, an array element read and a container read call read
 *       from their qualifier into the access expression itself. Assignment targets are
 *       never reads.</li>
 * </ul>
 * Nothing is cached; every query recomputes from the immutable program.
 */
public class StepRelations {

    private final NodeFactory nodes;
    private final ContainerModel containers;
    private final JumpStepStrategy jumpSteps;

    public StepRelations(NodeFactory nodes, ContainerModel containers, JumpStepStrategy jumpSteps) {
        this.nodes = Objects.requireNonNull(nodes, "nodes");
        this.containers = Objects.requireNonNull(containers, "containers");
        this.jumpSteps = Objects.requireNonNull(jumpSteps, "jumpSteps");
    }

    private Program program() {
        return nodes.program();
    }

    // --- store ---

    public boolean storeStep(Node source, Content content, Node target) {
        return storeStepsFrom(source).contains(new StoreStep(source, content, target));
    }

    /**
     * Store steps whose stored value is {@code source}.
     */
    public List<StoreStep> storeStepsFrom(Node source) {
        return program().parentOf(source.asExpr())
                .map(parent -> storesAt(parent).stream()
                        .filter(step -> step.source().equals(source))
                        .toList())
                .orElse(List.of());
    }

    public Stream<StoreStep> storeSteps() {
        return program().expressions().stream()
                .flatMap(expr -> storesAt(expr).stream());
    }

    /**
     * Stores performed by one write site: an assignment, an array creation or a call.
     */
    private List<StoreStep> storesAt(Expr site) {
        if (site instanceof Assignment assignment) {
            return storeOfAssignment(assignment).map(List::of).orElse(List.of());
        }
        if (site instanceof ArrayCreation creation) {
            Node array = nodes.node(creation);
            return creation.elements().stream()
                    .map(element -> new StoreStep(nodes.node(element), ArrayContent.INSTANCE, array))
                    .toList();
        }
        if (site instanceof Call call) {
            return containers.storedValue(call)
                    .map(value -> List.of(new StoreStep(nodes.node(value), CollectionContent.INSTANCE,
                            nodes.node(call.qualifier().orElseThrow()))))
                    .orElse(List.of());
        }
        return List.of();
    }

    private Optional<StoreStep> storeOfAssignment(Assignment assignment) {
        Node value = nodes.node(assignment.rhs());
        if (assignment.lhs() instanceof FieldAccess access && !access.isStatic()) {
            return access.qualifier()
                    .map(qualifier -> new StoreStep(value, new FieldContent(access.field()), nodes.node(qualifier)));
        }
        if (assignment.lhs() instanceof ArrayAccess access) {
            return Optional.of(new StoreStep(value, ArrayContent.INSTANCE, nodes.node(access.array())));
        }
        return Optional.empty();
    }

    // --- read ---

    public boolean readStep(Node source, Content content, Node target) {
        return readStepsInto(target).contains(new ReadStep(source, content, target));
    }

    /**
     * Read steps whose destination is {@code target}.
     */
    public List<ReadStep> readStepsInto(Node target) {
        return readAt(target.asExpr())
                .filter(step -> step.target().equals(target))
                .map(List::of)
                .orElse(List.of());
    }

    public Stream<ReadStep> readSteps() {
        return program().expressions().stream()
                .flatMap(expr -> readAt(expr).stream());
    }

    private Optional<ReadStep> readAt(Expr site) {
        if (!program().contains(site) || program().isAssignmentTarget(site)) {
            return Optional.empty();
        }
        if (site instanceof FieldAccess access && !access.isStatic()) {
            return access.qualifier()
                    .map(qualifier -> new ReadStep(nodes.node(qualifier), new FieldContent(access.field()),
                            nodes.node(access)));
        }
        if (site instanceof ArrayAccess access) {
            return Optional.of(new ReadStep(nodes.node(access.array()), ArrayContent.INSTANCE, nodes.node(access)));
        }
        if (site instanceof Call call && containers.isRead(call)) {
            return Optional.of(new ReadStep(nodes.node(call.qualifier().orElseThrow()), CollectionContent.INSTANCE,
                    nodes.node(call)));
        }
        return Optional.empty();
    }

    // --- jump ---

    public boolean jumpStep(Node source, Node target) {
        return jumpStepsFrom(source).contains(new JumpStep(source, target));
    }

    public List<JumpStep> jumpStepsFrom(Node source) {
        return jumpSteps.jumpStepsFrom(nodes, source);
    }

    public Stream<JumpStep> jumpSteps() {
        return jumpSteps.jumpSteps(nodes);
    }
}
