package io.flowmodel.node;

import io.flowmodel.ast.Call;
import io.flowmodel.ast.Callable;
import io.flowmodel.ast.Expr;
import io.flowmodel.ast.Program;
import io.flowmodel.ast.ReturnStatement;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Classifies expressions into their canonical {@link Node}.
 * <p>
 * An expression may play several roles (a constructor call returned from a method is an
 * instance argument, a return operand and a call result at once). The canonical kind is picked
 * with the precedence ARGUMENT, RETURN, OUT, EXPR; the other roles stay available through
 * {@link #returnKindOf(Node)} and {@code CallDispatch#argumentOf}.
 */
public class NodeFactory {

    private final Program program;

    public NodeFactory(Program program) {
        this.program = Objects.requireNonNull(program, "program");
    }

    public Program program() {
        return program;
    }

    public Node node(Expr expr) {
        Objects.requireNonNull(expr, "expr");
        if (isArgument(expr)) {
            return new ArgumentNode(expr);
        }
        if (program.isReturnOperand(expr)) {
            return new ReturnNode(expr, ReturnKind.NORMAL);
        }
        if (expr instanceof Call call) {
            return new OutNode(call);
        }
        return new ExprNode(expr);
    }

    /**
     * Whether the expression enters a call: at an argument position, as the explicit receiver,
     * or as an object creation that is its own instance argument.
     * Expressions packed into a synthesized varargs array are not arguments; the array is.
     */
    public boolean isArgument(Expr expr) {
        if (expr instanceof Call call && call.isConstructorCall()) {
            return true;
        }
        Optional<Expr> parent = program.parentOf(expr);
        if (parent.isEmpty() || !(parent.get() instanceof Call call)) {
            return false;
        }
        return call.qualifier().orElse(null) == expr || call.arguments().contains(expr);
    }

    public Optional<ReturnKind> returnKindOf(Node node) {
        return program.isReturnOperand(node.asExpr()) ? Optional.of(ReturnKind.NORMAL) : Optional.empty();
    }

    /**
     * Nodes of the return operands of the callable, whatever their canonical kind.
     */
    public List<Node> returnNodes(Callable callable, ReturnKind kind) {
        return switch (kind) {
            case NORMAL -> program.returnStatements(callable).stream()
                    .map(ReturnStatement::operand)
                    .filter(Objects::nonNull)
                    .map(this::node)
                    .toList();
        };
    }

    /**
     * Every node of the program, one per expression.
     */
    public Stream<Node> nodes() {
        return program.expressions().stream().map(this::node);
    }
}
