package io.flowmodel.step;

import io.flowmodel.ast.BodyBuilder;
import io.flowmodel.ast.Callable;
import io.flowmodel.ast.Field;
import io.flowmodel.ast.FieldAccess;
import io.flowmodel.ast.Program;
import io.flowmodel.ast.TypeRef;
import io.flowmodel.ast.VariableAccess;
import io.flowmodel.node.NodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StaticFieldJumpStepsTest {

    private static final String CONFIG = "com.example.Config";

    private Field current;
    private Field other;
    private Callable publish;
    private Callable consume;
    private Program.Builder builder;

    @BeforeEach
    void setUp() {
        current = Field.staticField(CONFIG, "current", TypeRef.OBJECT);
        other = Field.staticField(CONFIG, "other", TypeRef.OBJECT);
        publish = Callable.builder()
                .declaringType(CONFIG)
                .name("publish")
                .parameterTypes(TypeRef.OBJECT)
                .isStatic(true)
                .build();
        consume = Callable.builder()
                .declaringType(CONFIG)
                .name("consume")
                .returnType(TypeRef.OBJECT)
                .isStatic(true)
                .build();
        builder = Program.builder().addField(current).addField(other);
    }

    @Test
    void jumpSteps_linkStaticWriteToReadsInOtherCallables() {
        BodyBuilder write = builder.body(publish);
        VariableAccess value = write.parameter(0);
        write.statement(write.assign(write.staticField(current), value));
        write.returnsVoid();

        BodyBuilder read = builder.body(consume);
        FieldAccess currentRead = read.staticField(current);
        read.statement(read.staticField(other));
        read.returns(currentRead);

        NodeFactory nodes = new NodeFactory(builder.build());
        StaticFieldJumpSteps strategy = new StaticFieldJumpSteps();

        JumpStep expected = new JumpStep(nodes.node(value), nodes.node(currentRead));
        assertThat(strategy.jumpSteps(nodes)).containsExactly(expected);
        assertThat(strategy.jumpStepsFrom(nodes, nodes.node(value))).containsExactly(expected);
    }

    @Test
    void jumpStepsFrom_isEmptyForValuesNotWrittenToStaticFields() {
        BodyBuilder read = builder.body(consume);
        FieldAccess currentRead = read.staticField(current);
        read.returns(currentRead);

        NodeFactory nodes = new NodeFactory(builder.build());

        assertThat(new StaticFieldJumpSteps().jumpStepsFrom(nodes, nodes.node(currentRead))).isEmpty();
    }

    @Test
    void none_producesNoSteps() {
        BodyBuilder write = builder.body(publish);
        write.statement(write.assign(write.staticField(current), write.parameter(0)));
        NodeFactory nodes = new NodeFactory(builder.build());

        assertThat(JumpStepStrategy.NONE.jumpSteps(nodes)).isEmpty();
    }
}
