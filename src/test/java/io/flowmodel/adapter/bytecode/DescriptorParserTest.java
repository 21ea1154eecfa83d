package io.flowmodel.adapter.bytecode;

import io.flowmodel.ast.TypeRef;
import org.junit.jupiter.api.Test;
import org.objectweb.asm.Opcodes;

import static org.assertj.core.api.Assertions.assertThat;

class DescriptorParserTest {

    @Test
    void parseParameterTypes_handlesPrimitivesObjectsAndArrays() {
        assertThat(DescriptorParser.parseParameterTypes("(ILjava/lang/String;[JZ)V")).containsExactly(
                TypeRef.of("int"),
                TypeRef.classType("java.lang.String"),
                TypeRef.arrayOf(TypeRef.of("long")),
                TypeRef.of("boolean"));
    }

    @Test
    void parseParameterTypes_emptyForNoParameters() {
        assertThat(DescriptorParser.parseParameterTypes("()V")).isEmpty();
        assertThat(DescriptorParser.parseParameterTypes("garbage")).isEmpty();
    }

    @Test
    void parseReturnType_readsTypeAfterParameters() {
        assertThat(DescriptorParser.parseReturnType("(I)[[Ljava/lang/Object;"))
                .isEqualTo(TypeRef.arrayOf(TypeRef.arrayOf(TypeRef.OBJECT)));
        assertThat(DescriptorParser.parseReturnType("()V")).isEqualTo(TypeRef.VOID);
    }

    @Test
    void malformedDescriptors_fallBackToObject() {
        assertThat(DescriptorParser.parseReturnType("(I")).isEqualTo(TypeRef.OBJECT);
        assertThat(DescriptorParser.parseFieldType("Ljava/lang/String")).isEqualTo(TypeRef.OBJECT);
        assertThat(DescriptorParser.parseFieldType(null)).isEqualTo(TypeRef.OBJECT);
    }

    @Test
    void toFqn_keepsNestedClassSeparator() {
        assertThat(DescriptorParser.toFqn("java/util/Map$Entry")).isEqualTo("java.util.Map$Entry");
    }

    @Test
    void parseTypeOperand_acceptsInternalNamesAndArrayDescriptors() {
        assertThat(DescriptorParser.parseTypeOperand("java/util/ArrayList"))
                .isEqualTo(TypeRef.classType("java.util.ArrayList"));
        assertThat(DescriptorParser.parseTypeOperand("[I")).isEqualTo(TypeRef.arrayOf(TypeRef.of("int")));
    }

    @Test
    void primitiveArrayElement_mapsNewArrayOperands() {
        assertThat(DescriptorParser.primitiveArrayElement(Opcodes.T_INT)).isEqualTo(TypeRef.of("int"));
        assertThat(DescriptorParser.primitiveArrayElement(Opcodes.T_BOOLEAN)).isEqualTo(TypeRef.of("boolean"));
        assertThat(DescriptorParser.primitiveArrayElement(Opcodes.T_DOUBLE)).isEqualTo(TypeRef.of("double"));
    }

    @Test
    void isWide_onlyForLongAndDouble() {
        assertThat(DescriptorParser.isWide(TypeRef.of("long"))).isTrue();
        assertThat(DescriptorParser.isWide(TypeRef.of("double"))).isTrue();
        assertThat(DescriptorParser.isWide(TypeRef.of("int"))).isFalse();
        assertThat(DescriptorParser.isWide(TypeRef.OBJECT)).isFalse();
    }
}
