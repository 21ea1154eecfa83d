package io.flowmodel;

import io.flowmodel.ast.Call;
import io.flowmodel.ast.Callable;
import io.flowmodel.ast.Expr;
import io.flowmodel.ast.Program;
import io.flowmodel.ast.TypeRef;
import io.flowmodel.content.Content;
import io.flowmodel.content.ContainerModel;
import io.flowmodel.content.ContentModel;
import io.flowmodel.dispatch.ArgumentPosition;
import io.flowmodel.dispatch.CallDispatch;
import io.flowmodel.node.Node;
import io.flowmodel.node.NodeFactory;
import io.flowmodel.node.ReturnKind;
import io.flowmodel.step.JumpStep;
import io.flowmodel.step.JumpStepStrategy;
import io.flowmodel.step.ReadStep;
import io.flowmodel.step.StaticFieldJumpSteps;
import io.flowmodel.step.StepRelations;
import io.flowmodel.step.StoreStep;
import io.flowmodel.types.TypeCompatibility;
import io.flowmodel.types.TypeHierarchy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * The data-flow modeling layer of one program: nodes, contents, store/read/jump steps, call
 * dispatch helpers and the type-compatibility oracle, as consumed by an external solver.
 * <p>
 * Every query is a pure function of the immutable {@link Program}; instances can be shared
 * between threads.
 */
public class FlowModel {

    private final Logger logger = LoggerFactory.getLogger(getClass());

    private final Program program;
    private final FlowModelConfig config;
    private final NodeFactory nodes;
    private final ContentModel contents;
    private final StepRelations steps;
    private final CallDispatch dispatch;
    private final TypeCompatibility types;

    public FlowModel(Program program) {
        this(program, FlowModelConfig.loadDefault());
    }

    /**
     * Model using the configured jump steps: static-field jumps when enabled, none otherwise.
     */
    public FlowModel(Program program, FlowModelConfig config) {
        this(program, config, config.staticFieldJumpSteps() ? new StaticFieldJumpSteps() : JumpStepStrategy.NONE);
    }

    public FlowModel(Program program, FlowModelConfig config, JumpStepStrategy jumpSteps) {
        this.program = Objects.requireNonNull(program, "program");
        this.config = Objects.requireNonNull(config, "config");
        Objects.requireNonNull(jumpSteps, "jumpSteps");

        TypeHierarchy hierarchy = new TypeHierarchy(program);
        ContainerModel containers = ContainerModel.fromConfig(config, hierarchy);
        this.nodes = new NodeFactory(program);
        this.contents = new ContentModel(containers);
        this.steps = new StepRelations(nodes, containers, jumpSteps);
        this.dispatch = new CallDispatch(nodes);
        this.types = new TypeCompatibility(hierarchy, config.hierarchyPruning());

        logger.debug("Flow model over {} types, {} callables, {} expressions (hierarchy pruning: {})",
                program.typeCount(), program.callableCount(), program.expressionCount(), config.hierarchyPruning());
    }

    public Program program() {
        return program;
    }

    public FlowModelConfig config() {
        return config;
    }

    // --- nodes ---

    public Node node(Expr expr) {
        return nodes.node(expr);
    }

    public Stream<Node> nodes() {
        return nodes.nodes();
    }

    public Optional<ReturnKind> returnKindOf(Node node) {
        return nodes.returnKindOf(node);
    }

    public List<Node> returnNodes(Callable callable, ReturnKind kind) {
        return nodes.returnNodes(callable, kind);
    }

    public Optional<Content> contentOf(Expr accessSite) {
        return contents.contentOf(accessSite);
    }

    // --- steps ---

    public boolean storeStep(Node source, Content content, Node target) {
        return steps.storeStep(source, content, target);
    }

    public boolean readStep(Node source, Content content, Node target) {
        return steps.readStep(source, content, target);
    }

    public boolean jumpStep(Node source, Node target) {
        return steps.jumpStep(source, target);
    }

    public Stream<StoreStep> storeSteps() {
        return steps.storeSteps();
    }

    public Stream<ReadStep> readSteps() {
        return steps.readSteps();
    }

    public Stream<JumpStep> jumpSteps() {
        return steps.jumpSteps();
    }

    public List<StoreStep> storeStepsFrom(Node source) {
        return steps.storeStepsFrom(source);
    }

    public List<ReadStep> readStepsInto(Node target) {
        return steps.readStepsInto(target);
    }

    public List<JumpStep> jumpStepsFrom(Node source) {
        return steps.jumpStepsFrom(source);
    }

    // --- calls ---

    public Set<ArgumentPosition> argumentOf(Node node) {
        return dispatch.argumentOf(node);
    }

    public Optional<Node> getArgument(Call call, int n) {
        return dispatch.getArgument(call, n);
    }

    public Optional<Node> getInstanceArgument(Call call) {
        return dispatch.getInstanceArgument(call);
    }

    public boolean callHasQualifier(Call call) {
        return dispatch.callHasQualifier(call);
    }

    public Optional<Callable> getEnclosingCallable(Call call) {
        return dispatch.getEnclosingCallable(call);
    }

    public Node getOutputNode(Call call, ReturnKind kind) {
        return dispatch.getOutputNode(call, kind);
    }

    // --- types ---

    public boolean compatibleTypes(TypeRef t1, TypeRef t2) {
        return types.compatibleTypes(t1, t2);
    }
}
