package io.flowmodel.adapter.bytecode;

import io.flowmodel.ast.TypeRef;
import org.objectweb.asm.Opcodes;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses JVM type and method descriptors into {@link TypeRef}s.
 * <p>
 * Method descriptors follow the format: (ParameterTypes)ReturnType
 * <p>
 * Type encodings:
 * <ul>
 *   <li>B, C, D, F, I, J, S, Z - primitives</li>
 *   <li>V - void (return type only)</li>
 *   <li>L&lt;classname&gt;; - object type</li>
 *   <li>[ - array (prefix)</li>
 * </ul>
 * Malformed descriptors yield {@code java.lang.Object} rather than failing.
 */
public final class DescriptorParser {

    private DescriptorParser() {
        // Utility class
    }

    /**
     * Converts an internal name ({@code java/util/List}) to a dotted name ({@code java.util.List}).
     * Nested classes keep their {@code $} separator.
     */
    public static String toFqn(String internalName) {
        return internalName.replace('/', '.');
    }

    /**
     * Parses a field (single type) descriptor, e.g. {@code [Ljava/lang/String;}.
     */
    public static TypeRef parseFieldType(String descriptor) {
        if (descriptor == null) {
            return TypeRef.OBJECT;
        }
        ParseResult result = parseType(descriptor, 0);
        return result != null ? result.type : TypeRef.OBJECT;
    }

    /**
     * Parameter types of a method descriptor, in order.
     *
     * @param descriptor The method descriptor (e.g., "(Ljava/lang/String;I)V")
     */
    public static List<TypeRef> parseParameterTypes(String descriptor) {
        List<TypeRef> types = new ArrayList<>();
        if (descriptor == null || !descriptor.startsWith("(")) {
            return types;
        }
        int endParams = descriptor.indexOf(')');
        int pos = 1;
        while (pos < endParams) {
            ParseResult result = parseType(descriptor, pos);
            if (result == null) {
                break; // Parse error
            }
            types.add(result.type);
            pos = result.endPos;
        }
        return types;
    }

    public static TypeRef parseReturnType(String descriptor) {
        if (descriptor == null) {
            return TypeRef.OBJECT;
        }
        int returnStart = descriptor.indexOf(')');
        if (returnStart < 0 || returnStart + 1 >= descriptor.length()) {
            return TypeRef.OBJECT;
        }
        ParseResult result = parseType(descriptor, returnStart + 1);
        return result != null ? result.type : TypeRef.OBJECT;
    }

    /**
     * Type of a {@code NEWARRAY} operand code ({@link Opcodes#T_INT} etc.).
     */
    public static TypeRef primitiveArrayElement(int operand) {
        return switch (operand) {
            case Opcodes.T_BOOLEAN -> TypeRef.of("boolean");
            case Opcodes.T_CHAR -> TypeRef.of("char");
            case Opcodes.T_FLOAT -> TypeRef.of("float");
            case Opcodes.T_DOUBLE -> TypeRef.of("double");
            case Opcodes.T_BYTE -> TypeRef.of("byte");
            case Opcodes.T_SHORT -> TypeRef.of("short");
            case Opcodes.T_INT -> TypeRef.of("int");
            case Opcodes.T_LONG -> TypeRef.of("long");
            default -> TypeRef.OBJECT;
        };
    }

    /**
     * Type named by a {@code NEW}, {@code ANEWARRAY} or {@code CHECKCAST} operand: an internal
     * class name, or an array descriptor.
     */
    public static TypeRef parseTypeOperand(String operand) {
        if (operand.startsWith("[")) {
            return parseFieldType(operand);
        }
        return new TypeRef.ClassType(toFqn(operand));
    }

    /**
     * Whether values of the type take two stack slots (long and double).
     */
    public static boolean isWide(TypeRef type) {
        return type instanceof TypeRef.PrimitiveType p
                && ("long".equals(p.name()) || "double".equals(p.name()));
    }

    private static ParseResult parseType(String descriptor, int pos) {
        if (pos >= descriptor.length()) {
            return null;
        }
        char c = descriptor.charAt(pos);
        String primitive = switch (c) {
            case 'B' -> "byte";
            case 'C' -> "char";
            case 'D' -> "double";
            case 'F' -> "float";
            case 'I' -> "int";
            case 'J' -> "long";
            case 'S' -> "short";
            case 'Z' -> "boolean";
            case 'V' -> "void";
            default -> null;
        };
        if (primitive != null) {
            return new ParseResult(new TypeRef.PrimitiveType(primitive), pos + 1);
        }
        if (c == '[') {
            ParseResult elementType = parseType(descriptor, pos + 1);
            if (elementType == null) {
                return null;
            }
            return new ParseResult(new TypeRef.ArrayType(elementType.type), elementType.endPos);
        }
        if (c == 'L') {
            int semicolon = descriptor.indexOf(';', pos);
            if (semicolon < 0) {
                return null;
            }
            return new ParseResult(new TypeRef.ClassType(toFqn(descriptor.substring(pos + 1, semicolon))),
                    semicolon + 1);
        }
        return null; // Unknown type
    }

    private record ParseResult(TypeRef type, int endPos) {
    }
}
