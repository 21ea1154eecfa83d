package io.flowmodel.dispatch;

import io.flowmodel.ast.Call;
import io.flowmodel.ast.Callable;
import io.flowmodel.ast.Expr;
import io.flowmodel.node.Node;
import io.flowmodel.node.NodeFactory;
import io.flowmodel.node.ReturnKind;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * How values enter and leave calls.
 */
public class CallDispatch {

    private final NodeFactory nodes;

    public CallDispatch(NodeFactory nodes) {
        this.nodes = Objects.requireNonNull(nodes, "nodes");
    }

    /**
     * Node of the {@code n}-th explicit argument, or empty when {@code n} is out of range.
     * A synthesized varargs array is the argument at the last position; the values packed into
     * it are not arguments.
     */
    public Optional<Node> getArgument(Call call, int n) {
        if (n < 0 || n >= call.argumentCount()) {
            return Optional.empty();
        }
        return Optional.of(nodes.node(call.arguments().get(n)));
    }

    /**
     * The receiver node: the explicit qualifier, or the call itself for an object creation.
     * Empty for static calls and for destructor calls without receiver syntax.
     */
    public Optional<Node> getInstanceArgument(Call call) {
        if (call.isConstructorCall()) {
            return Optional.of(nodes.node(call));
        }
        return call.qualifier().map(nodes::node);
    }

    /**
     * Whether the call has a receiver, syntactically or implicitly (destructors).
     */
    public boolean callHasQualifier(Call call) {
        return call.qualifier().isPresent() || call.target().isDestructor();
    }

    public Optional<Callable> getEnclosingCallable(Call call) {
        return nodes.program().enclosingCallable(call);
    }

    /**
     * Every call position the node's expression occupies, whatever the node's kind.
     */
    public Set<ArgumentPosition> argumentOf(Node node) {
        Expr expr = node.asExpr();
        Set<ArgumentPosition> positions = new LinkedHashSet<>();
        if (expr instanceof Call call && call.isConstructorCall()) {
            positions.add(ArgumentPosition.instance(call));
        }
        nodes.program().parentOf(expr).ifPresent(parent -> {
            if (parent instanceof Call call) {
                if (call.qualifier().orElse(null) == expr) {
                    positions.add(ArgumentPosition.instance(call));
                }
                List<Expr> arguments = call.arguments();
                for (int i = 0; i < arguments.size(); i++) {
                    if (arguments.get(i) == expr) {
                        positions.add(new ArgumentPosition(call, i));
                    }
                }
            }
        });
        return Set.copyOf(positions);
    }

    /**
     * Node where the result of the call is consumed.
     */
    public Node getOutputNode(Call call, ReturnKind kind) {
        return switch (kind) {
            case NORMAL -> nodes.node(call);
        };
    }
}
