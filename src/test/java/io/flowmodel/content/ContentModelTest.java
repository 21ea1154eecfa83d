package io.flowmodel.content;

import io.flowmodel.FlowModelConfig;
import io.flowmodel.ast.ArrayAccess;
import io.flowmodel.ast.BodyBuilder;
import io.flowmodel.ast.Call;
import io.flowmodel.ast.Callable;
import io.flowmodel.ast.Field;
import io.flowmodel.ast.FieldAccess;
import io.flowmodel.ast.Program;
import io.flowmodel.ast.TypeDecl;
import io.flowmodel.ast.TypeRef;
import io.flowmodel.ast.Variable;
import io.flowmodel.ast.VariableAccess;
import io.flowmodel.types.TypeHierarchy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ContentModelTest {

    private static final String HOLDER = "com.example.Holder";
    private static final TypeRef LIST = TypeRef.classType("java.util.List");

    private Field f;
    private Field g;
    private Callable method;
    private Callable add;
    private Callable get;
    private Program.Builder builder;
    private BodyBuilder body;

    @BeforeEach
    void setUp() {
        f = Field.instanceField(HOLDER, "f", TypeRef.OBJECT);
        g = Field.staticField(HOLDER, "g", TypeRef.classType("java.lang.String"));
        method = Callable.builder()
                .declaringType(HOLDER)
                .name("run")
                .parameterTypes(TypeRef.classType(HOLDER), LIST, TypeRef.OBJECT)
                .isStatic(true)
                .build();
        add = collectionMethod("java.util.List", "add", TypeRef.of("boolean"), TypeRef.OBJECT);
        get = collectionMethod("java.util.List", "get", TypeRef.OBJECT, TypeRef.of("int"));
        builder = Program.builder().addField(f).addField(g);
        body = builder.body(method);
    }

    private static Callable collectionMethod(String owner, String name, TypeRef returnType, TypeRef... params) {
        return Callable.builder()
                .declaringType(owner)
                .name(name)
                .parameterTypes(params)
                .returnType(returnType)
                .build();
    }

    private ContentModel contentModel(Program program) {
        return new ContentModel(ContainerModel.fromConfig(FlowModelConfig.loadDefault(), new TypeHierarchy(program)));
    }

    @Test
    void contentOf_fieldAccessIsFieldContent() {
        FieldAccess instance = body.statement(body.field(body.parameter(0), f));
        FieldAccess statik = body.statement(body.staticField(g));
        ContentModel contents = contentModel(builder.build());

        assertThat(contents.contentOf(instance)).contains(new FieldContent(f));
        assertThat(contents.contentOf(statik)).contains(new FieldContent(g));
        assertThat(contents.contentOf(statik).orElseThrow().declaredType())
                .contains(TypeRef.classType("java.lang.String"));
    }

    @Test
    void fieldContent_isEqualForEveryAccessOfTheField() {
        FieldAccess first = body.statement(body.field(body.parameter(0), f));
        FieldAccess second = body.statement(body.field(body.parameter(0), f));
        ContentModel contents = contentModel(builder.build());

        assertThat(contents.contentOf(first)).isEqualTo(contents.contentOf(second));
    }

    @Test
    void contentOf_arrayAccessIsArrayContent() {
        ArrayAccess access = body.statement(body.arrayElement(
                body.access(Variable.local("arr", TypeRef.of("java.lang.Object[]"))),
                body.literal(0, TypeRef.of("int"))));
        ContentModel contents = contentModel(builder.build());

        assertThat(contents.contentOf(access)).contains(ArrayContent.INSTANCE);
        assertThat(ArrayContent.INSTANCE.declaredType()).isEmpty();
    }

    @Test
    void contentOf_collectionWriteAndReadAreCollectionContent() {
        Call write = body.statement(body.call(add, body.parameter(1), body.parameter(2)));
        Call read = body.statement(body.call(get, body.parameter(1), body.literal(0, TypeRef.of("int"))));
        ContentModel contents = contentModel(builder.build());

        assertThat(contents.contentOf(write)).contains(CollectionContent.INSTANCE);
        assertThat(contents.contentOf(read)).contains(CollectionContent.INSTANCE);
    }

    @Test
    void contentOf_collectionMethodOnProgramSubtype() {
        TypeDecl bag = TypeDecl.builder()
                .fqn("com.example.Bag")
                .superclass("java.util.ArrayList")
                .build();
        Callable bagAdd = collectionMethod("com.example.Bag", "add", TypeRef.of("boolean"), TypeRef.OBJECT);
        VariableAccess receiver = body.access(Variable.local("bag", bag.asType()));
        Call write = body.statement(body.call(bagAdd, receiver, body.parameter(2)));
        ContentModel contents = contentModel(builder.addType(bag).build());

        assertThat(contents.contentOf(write)).contains(CollectionContent.INSTANCE);
        assertThat(contents.containers().isContainerType("com.example.Bag")).isTrue();
        assertThat(contents.containers().isContainerType(HOLDER)).isFalse();
    }

    @Test
    void contentOf_isEmptyForOtherExpressions() {
        Callable other = collectionMethod(HOLDER, "add", TypeRef.of("boolean"), TypeRef.OBJECT);
        Call unrelated = body.statement(body.call(other, body.parameter(0), body.parameter(2)));
        VariableAccess variable = body.statement(body.parameter(2));
        ContentModel contents = contentModel(builder.build());

        assertThat(contents.contentOf(unrelated)).isEmpty();
        assertThat(contents.contentOf(variable)).isEmpty();
    }

    @Test
    void containerModel_storedValueIsLastArgument() {
        Callable put = collectionMethod("java.util.Map", "put", TypeRef.OBJECT, TypeRef.OBJECT, TypeRef.OBJECT);
        VariableAccess map = body.access(Variable.local("map", TypeRef.classType("java.util.Map")));
        VariableAccess key = body.parameter(0);
        VariableAccess value = body.parameter(2);
        Call call = body.statement(body.call(put, map, key, value));
        Program program = builder.build();
        ContainerModel containers = new ContainerModel(Set.of("java.util.Map"), Set.of("put"), Set.of("get"),
                new TypeHierarchy(program));

        assertThat(containers.isWrite(call)).isTrue();
        assertThat(containers.isRead(call)).isFalse();
        assertThat(containers.storedValue(call)).contains(value);
    }
}
