package io.flowmodel.types;

import io.flowmodel.ast.Program;
import io.flowmodel.ast.TypeDecl;
import io.flowmodel.ast.TypeKind;
import io.flowmodel.ast.TypeRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TypeCompatibilityTest {

    private static final TypeRef ANIMAL = TypeRef.classType("com.example.Animal");
    private static final TypeRef DOG = TypeRef.classType("com.example.Dog");
    private static final TypeRef CAR = TypeRef.classType("com.example.Car");
    private static final TypeRef PET = TypeRef.classType("com.example.Pet");
    private static final TypeRef EXTERNAL = TypeRef.classType("org.lib.Widget");

    private TypeHierarchy hierarchy;
    private TypeCompatibility types;

    @BeforeEach
    void setUp() {
        Program program = Program.builder()
                .addType(TypeDecl.builder().fqn("com.example.Animal").superclass("java.lang.Object").build())
                .addType(TypeDecl.builder().fqn("com.example.Dog").superclass("com.example.Animal")
                        .interfaces(Set.of("com.example.Pet")).build())
                .addType(TypeDecl.builder().fqn("com.example.Car").superclass("java.lang.Object").build())
                .addType(TypeDecl.builder().fqn("com.example.Pet").kind(TypeKind.INTERFACE).build())
                .addType(TypeDecl.builder().fqn("com.example.Gadget").superclass("org.lib.Widget").build())
                .build();
        hierarchy = new TypeHierarchy(program);
        types = new TypeCompatibility(hierarchy, true);
    }

    @Test
    void compatibleTypes_isReflexive() {
        for (TypeRef t : List.of(ANIMAL, DOG, PET, EXTERNAL, TypeRef.of("int"), TypeRef.of("boolean"),
                TypeRef.of("java.lang.String[]"), new TypeRef.TypeVariable("T", null))) {
            assertThat(types.compatibleTypes(t, t)).as("%s", t).isTrue();
        }
    }

    @Test
    void compatibleTypes_foldsNumericPrimitivesAndBoxes() {
        assertThat(types.compatibleTypes(TypeRef.of("int"), TypeRef.of("long"))).isTrue();
        assertThat(types.compatibleTypes(TypeRef.of("java.lang.Integer"), TypeRef.of("double"))).isTrue();
        assertThat(types.compatibleTypes(TypeRef.of("char"), TypeRef.of("java.lang.Long"))).isTrue();
    }

    @Test
    void compatibleTypes_foldsBooleanWithIntegralValues() {
        // class files store boolean locals and constants as int
        assertThat(types.compatibleTypes(TypeRef.of("int"), TypeRef.of("boolean"))).isTrue();
        assertThat(types.compatibleTypes(TypeRef.of("java.lang.Boolean"), TypeRef.of("java.lang.Double"))).isTrue();
        assertThat(types.compatibleTypes(TypeRef.of("boolean"), TypeRef.of("java.lang.Boolean"))).isTrue();
        assertThat(types.compatibleTypes(TypeRef.of("boolean"), DOG)).isTrue();
        assertThat(types.compatibleTypes(TypeRef.of("boolean"), TypeRef.of("java.lang.String[]"))).isTrue();
    }

    @Test
    void compatibleTypes_erasesTypeVariablesToBound() {
        TypeRef unbounded = new TypeRef.TypeVariable("T", null);
        TypeRef boundedByCar = new TypeRef.TypeVariable("C", CAR);

        assertThat(types.compatibleTypes(unbounded, DOG)).isTrue();
        assertThat(types.compatibleTypes(boundedByCar, CAR)).isTrue();
        assertThat(types.compatibleTypes(boundedByCar, DOG)).isFalse();
    }

    @Test
    void compatibleTypes_prunesUnrelatedProgramClasses() {
        assertThat(types.compatibleTypes(DOG, ANIMAL)).isTrue();
        assertThat(types.compatibleTypes(ANIMAL, DOG)).isTrue();
        assertThat(types.compatibleTypes(DOG, CAR)).isFalse();
        assertThat(types.compatibleTypes(CAR, DOG)).isFalse();
    }

    @Test
    void compatibleTypes_keepsInterfacesAndUnknownTypes() {
        // Some subclass of Car may implement Pet
        assertThat(types.compatibleTypes(CAR, PET)).isTrue();
        assertThat(types.compatibleTypes(DOG, EXTERNAL)).isTrue();
        // Gadget extends an undeclared class, so its hierarchy is not fully known
        assertThat(types.compatibleTypes(TypeRef.classType("com.example.Gadget"), CAR)).isTrue();
    }

    @Test
    void compatibleTypes_prunesArraysVersusOtherClasses() {
        TypeRef strings = TypeRef.of("java.lang.String[]");

        assertThat(types.compatibleTypes(strings, TypeRef.OBJECT)).isTrue();
        assertThat(types.compatibleTypes(strings, TypeRef.classType("java.io.Serializable"))).isTrue();
        assertThat(types.compatibleTypes(strings, TypeRef.classType("java.lang.Cloneable"))).isTrue();
        assertThat(types.compatibleTypes(strings, DOG)).isFalse();
        assertThat(types.compatibleTypes(DOG, strings)).isFalse();
    }

    @Test
    void compatibleTypes_isSymmetric() {
        List<TypeRef> samples = List.of(ANIMAL, DOG, CAR, PET, EXTERNAL, TypeRef.OBJECT, TypeRef.of("int"),
                TypeRef.of("boolean"), TypeRef.of("java.lang.Object[]"), new TypeRef.TypeVariable("T", DOG));
        for (TypeRef a : samples) {
            for (TypeRef b : samples) {
                assertThat(types.compatibleTypes(a, b)).as("%s vs %s", a, b)
                        .isEqualTo(types.compatibleTypes(b, a));
            }
        }
    }

    @Test
    void compatibleTypes_withoutPruningAcceptsEverything() {
        TypeCompatibility lenient = new TypeCompatibility(hierarchy, false);

        assertThat(lenient.compatibleTypes(DOG, CAR)).isTrue();
        assertThat(lenient.compatibleTypes(TypeRef.of("java.lang.String[]"), DOG)).isTrue();
        assertThat(lenient.compatibleTypes(TypeRef.of("boolean"), TypeRef.of("int"))).isTrue();
    }

    @Test
    void hierarchy_collectsTransitiveSupertypes() {
        assertThat(hierarchy.allSupertypes("com.example.Dog"))
                .containsExactlyInAnyOrder("com.example.Animal", "com.example.Pet", "java.lang.Object");
        assertThat(hierarchy.isSubtypeOf("com.example.Dog", "com.example.Pet")).isTrue();
        assertThat(hierarchy.allSupertypes("org.lib.Widget")).isEmpty();
        assertThat(hierarchy.hasCompleteSuperclassChain("com.example.Gadget")).isFalse();
        assertThat(hierarchy.isKnown("org.lib.Widget")).isFalse();
        assertThat(hierarchy.declaration("com.example.Pet"))
                .hasValueSatisfying(decl -> assertThat(decl.isInterface()).isTrue());
    }
}
