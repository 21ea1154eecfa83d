package io.flowmodel.step;

import io.flowmodel.ast.Assignment;
import io.flowmodel.ast.Expr;
import io.flowmodel.ast.Field;
import io.flowmodel.ast.FieldAccess;
import io.flowmodel.ast.Program;
import io.flowmodel.node.Node;
import io.flowmodel.node.NodeFactory;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Links the value assigned to a static field with every read of that field, anywhere in the
 * program. Static fields carry no content, so this is how values cross them.
 */
public class StaticFieldJumpSteps implements JumpStepStrategy {

    @Override
    public Stream<JumpStep> jumpSteps(NodeFactory nodes) {
        Program program = nodes.program();
        return program.expressions().stream()
                .flatMap(expr -> staticWrite(expr).stream()
                        .flatMap(write -> stepsFromWrite(nodes, write)));
    }

    @Override
    public List<JumpStep> jumpStepsFrom(NodeFactory nodes, Node source) {
        Program program = nodes.program();
        return program.parentOf(source.asExpr())
                .flatMap(StaticFieldJumpSteps::staticWrite)
                .filter(write -> write.rhs() == source.asExpr())
                .filter(write -> nodes.node(write.rhs()).equals(source))
                .map(write -> stepsFromWrite(nodes, write).toList())
                .orElse(List.of());
    }

    private static Stream<JumpStep> stepsFromWrite(NodeFactory nodes, Assignment write) {
        Field field = ((FieldAccess) write.lhs()).field();
        Node source = nodes.node(write.rhs());
        return staticReads(nodes.program(), field)
                .map(read -> new JumpStep(source, nodes.node(read)));
    }

    private static Optional<Assignment> staticWrite(Expr expr) {
        if (expr instanceof Assignment assignment
                && assignment.lhs() instanceof FieldAccess access
                && access.isStatic()) {
            return Optional.of(assignment);
        }
        return Optional.empty();
    }

    private static Stream<FieldAccess> staticReads(Program program, Field field) {
        return program.expressions().stream()
                .filter(FieldAccess.class::isInstance)
                .map(FieldAccess.class::cast)
                .filter(access -> access.isStatic() && access.field().equals(field))
                .filter(access -> !program.isAssignmentTarget(access));
    }
}
