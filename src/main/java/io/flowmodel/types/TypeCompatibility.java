package io.flowmodel.types;

import io.flowmodel.ast.TypeRef;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Decides whether a value of one static type may flow into a location of another.
 * <p>
 * The oracle only prunes: it answers {@code false} only when the two types certainly have no
 * common value, and {@code true} otherwise. Type variables are erased to their bound, and all
 * primitives and their boxes count as one type: the JVM stores {@code boolean},
 * {@code byte}, {@code char} and {@code short} values as {@code int}, so a value read from
 * class files may carry any of these types. Narrowings applied, both depending on hierarchy
 * pruning being enabled:
 * <ol>
 *   <li>two classes declared in the program that are unrelated in its class hierarchy
 *       (both superclass chains must be fully known);</li>
 *   <li>an array versus a class other than {@code Object}, {@code Cloneable} or
 *       {@code Serializable}.</li>
 * </ol>
 */
public class TypeCompatibility {

    private static final TypeRef PRIMITIVE = new TypeRef.PrimitiveType("int");

    private static final Map<String, TypeRef> BOXES = Map.of(
            "java.lang.Byte", PRIMITIVE,
            "java.lang.Short", PRIMITIVE,
            "java.lang.Character", PRIMITIVE,
            "java.lang.Integer", PRIMITIVE,
            "java.lang.Long", PRIMITIVE,
            "java.lang.Float", PRIMITIVE,
            "java.lang.Double", PRIMITIVE,
            "java.lang.Boolean", PRIMITIVE
    );

    private static final Set<String> ARRAY_SUPERTYPES = Set.of(
            "java.lang.Object", "java.lang.Cloneable", "java.io.Serializable");

    private final TypeHierarchy hierarchy;
    private final boolean hierarchyPruning;

    public TypeCompatibility(TypeHierarchy hierarchy, boolean hierarchyPruning) {
        this.hierarchy = Objects.requireNonNull(hierarchy, "hierarchy");
        this.hierarchyPruning = hierarchyPruning;
    }

    public boolean compatibleTypes(TypeRef t1, TypeRef t2) {
        TypeRef a = normalize(Objects.requireNonNull(t1, "t1"));
        TypeRef b = normalize(Objects.requireNonNull(t2, "t2"));
        if (a.equals(b) || a.equals(TypeRef.OBJECT) || b.equals(TypeRef.OBJECT)) {
            return true;
        }
        if (!hierarchyPruning) {
            return true;
        }
        if (a instanceof TypeRef.ClassType ca && b instanceof TypeRef.ClassType cb) {
            return !unrelatedDeclaredClasses(ca.fqn(), cb.fqn());
        }
        if (isArrayVersusClass(a, b) || isArrayVersusClass(b, a)) {
            return false;
        }
        return true;
    }

    /**
     * Erases type variables and folds primitives and boxes, except {@code void}.
     */
    static TypeRef normalize(TypeRef type) {
        if (type instanceof TypeRef.TypeVariable variable) {
            return normalize(variable.bound());
        }
        if (type instanceof TypeRef.PrimitiveType primitive) {
            return TypeRef.VOID.equals(primitive) ? primitive : PRIMITIVE;
        }
        if (type instanceof TypeRef.ClassType classType) {
            return BOXES.getOrDefault(classType.fqn(), classType);
        }
        return type;
    }

    private static boolean isArrayVersusClass(TypeRef a, TypeRef b) {
        return a instanceof TypeRef.ArrayType
                && b instanceof TypeRef.ClassType classType
                && !ARRAY_SUPERTYPES.contains(classType.fqn());
    }

    private boolean unrelatedDeclaredClasses(String a, String b) {
        return hierarchy.isDeclaredClass(a)
                && hierarchy.isDeclaredClass(b)
                && hierarchy.hasCompleteSuperclassChain(a)
                && hierarchy.hasCompleteSuperclassChain(b)
                && !hierarchy.isRelated(a, b);
    }
}
