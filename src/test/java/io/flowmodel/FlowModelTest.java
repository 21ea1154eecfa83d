package io.flowmodel;

import io.flowmodel.ast.BodyBuilder;
import io.flowmodel.ast.Call;
import io.flowmodel.ast.Callable;
import io.flowmodel.ast.Field;
import io.flowmodel.ast.FieldAccess;
import io.flowmodel.ast.Program;
import io.flowmodel.ast.TypeDecl;
import io.flowmodel.ast.TypeRef;
import io.flowmodel.ast.VariableAccess;
import io.flowmodel.content.FieldContent;
import io.flowmodel.dispatch.ArgumentPosition;
import io.flowmodel.node.ReturnKind;
import io.flowmodel.step.JumpStep;
import io.flowmodel.step.ReadStep;
import io.flowmodel.step.StoreStep;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlowModelTest {

    private static final String HOLDER = "com.example.Holder";
    private static final String REGISTRY = "com.example.Registry";

    private Field value;
    private Field shared;
    private Callable transfer;
    private Callable publish;
    private Callable lookup;

    private VariableAccess storedValue;
    private VariableAccess storeHolder;
    private VariableAccess readHolder;
    private FieldAccess valueRead;
    private VariableAccess publishedValue;
    private VariableAccess written;
    private FieldAccess sharedRead;
    private Call publishCall;

    private Program program;

    @BeforeEach
    void setUp() {
        value = Field.instanceField(HOLDER, "value", TypeRef.OBJECT);
        shared = Field.staticField(REGISTRY, "shared", TypeRef.OBJECT);
        transfer = Callable.builder()
                .declaringType(HOLDER)
                .name("transfer")
                .parameterTypes(TypeRef.classType(HOLDER), TypeRef.OBJECT)
                .returnType(TypeRef.OBJECT)
                .isStatic(true)
                .build();
        publish = Callable.builder()
                .declaringType(REGISTRY)
                .name("publish")
                .parameterTypes(TypeRef.OBJECT)
                .isStatic(true)
                .build();
        lookup = Callable.builder()
                .declaringType(REGISTRY)
                .name("lookup")
                .returnType(TypeRef.OBJECT)
                .isStatic(true)
                .build();

        Program.Builder builder = Program.builder()
                .addType(TypeDecl.builder().fqn(HOLDER).superclass("java.lang.Object").build())
                .addType(TypeDecl.builder().fqn(REGISTRY).superclass("java.lang.Object").build())
                .addField(value)
                .addField(shared)
                .addCallable(transfer)
                .addCallable(publish)
                .addCallable(lookup);

        // static Object transfer(Holder h, Object v) { h.value = v; Registry.publish(v); return h.value; }
        BodyBuilder body = builder.body(transfer);
        storedValue = body.parameter(1);
        storeHolder = body.parameter(0);
        body.statement(body.assign(body.field(storeHolder, value), storedValue));
        publishedValue = body.parameter(1);
        publishCall = body.statement(body.invoke(publish, publishedValue));
        readHolder = body.parameter(0);
        valueRead = body.field(readHolder, value);
        body.returns(valueRead);

        // static void publish(Object o) { shared = o; }
        BodyBuilder publishBody = builder.body(publish);
        written = publishBody.parameter(0);
        publishBody.statement(publishBody.assign(publishBody.staticField(shared), written));
        publishBody.returnsVoid();

        // static Object lookup() { return shared; }
        BodyBuilder lookupBody = builder.body(lookup);
        sharedRead = lookupBody.staticField(shared);
        lookupBody.returns(sharedRead);

        program = builder.build();
    }

    @Test
    void storeAndReadSteps_areExposedThroughFacade() {
        FlowModel model = new FlowModel(program);
        FieldContent content = new FieldContent(value);

        StoreStep store = new StoreStep(model.node(storedValue), content, model.node(storeHolder));
        ReadStep read = new ReadStep(model.node(readHolder), content, model.node(valueRead));

        assertThat(model.storeSteps()).containsExactly(store);
        assertThat(model.readSteps()).containsExactly(read);
        assertThat(model.storeStep(store.source(), content, store.target())).isTrue();
        assertThat(model.readStep(read.source(), content, read.target())).isTrue();
        assertThat(model.storeStepsFrom(model.node(storedValue))).containsExactly(store);
        assertThat(model.readStepsInto(model.node(valueRead))).containsExactly(read);
        assertThat(model.contentOf(valueRead)).contains(content);
    }

    @Test
    void returnNodes_andCallHelpers() {
        FlowModel model = new FlowModel(program);

        assertThat(model.returnNodes(transfer, ReturnKind.NORMAL)).containsExactly(model.node(valueRead));
        assertThat(model.returnKindOf(model.node(valueRead))).contains(ReturnKind.NORMAL);
        assertThat(model.getArgument(publishCall, 0)).contains(model.node(publishedValue));
        assertThat(model.argumentOf(model.node(publishedValue)))
                .containsExactly(new ArgumentPosition(publishCall, 0));
        assertThat(model.callHasQualifier(publishCall)).isFalse();
        assertThat(model.getInstanceArgument(publishCall)).isEmpty();
        assertThat(model.getEnclosingCallable(publishCall)).contains(transfer);
        assertThat(model.getOutputNode(publishCall, ReturnKind.NORMAL)).isEqualTo(model.node(publishCall));
    }

    @Test
    void jumpSteps_areOffByDefault() {
        FlowModel model = new FlowModel(program);

        assertThat(model.jumpSteps()).isEmpty();
        assertThat(model.config().staticFieldJumpSteps()).isFalse();
    }

    @Test
    void jumpSteps_followStaticFieldsWhenConfigured() {
        FlowModel model = new FlowModel(program, FlowModelConfig.loadDefault().withStaticFieldJumpSteps(true));

        JumpStep expected = new JumpStep(model.node(written), model.node(sharedRead));
        assertThat(model.jumpSteps()).containsExactly(expected);
        assertThat(model.jumpStep(expected.source(), expected.target())).isTrue();
        assertThat(model.jumpStepsFrom(model.node(written))).containsExactly(expected);
    }

    @Test
    void compatibleTypes_followsConfiguredPruning() {
        TypeRef holder = TypeRef.classType(HOLDER);
        TypeRef registry = TypeRef.classType(REGISTRY);

        assertThat(new FlowModel(program).compatibleTypes(holder, registry)).isFalse();
        assertThat(new FlowModel(program, FlowModelConfig.loadDefault().withHierarchyPruning(false))
                .compatibleTypes(holder, registry)).isTrue();
    }

    @Test
    void constructor_rejectsNullProgram() {
        assertThatThrownBy(() -> new FlowModel(null, FlowModelConfig.loadDefault()))
                .isInstanceOf(NullPointerException.class);
    }
}
