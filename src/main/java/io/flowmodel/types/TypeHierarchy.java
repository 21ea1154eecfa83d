package io.flowmodel.types;

import io.flowmodel.ast.Program;
import io.flowmodel.ast.TypeDecl;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Supertype relation over the types declared in a {@link Program}.
 * Types the program does not declare are unknown: they have no recorded supertypes.
 */
public class TypeHierarchy {

    private final Map<String, TypeDecl> declarations;
    // child -> all ancestors (transitive)
    private final Map<String, Set<String>> supertypes;

    public TypeHierarchy(Program program) {
        Map<String, TypeDecl> decls = new HashMap<>();
        for (TypeDecl decl : program.typeDecls()) {
            decls.put(decl.fqn(), decl);
        }
        this.declarations = Collections.unmodifiableMap(decls);

        Map<String, Set<String>> ancestors = new HashMap<>();
        for (String fqn : decls.keySet()) {
            ancestors.put(fqn, Collections.unmodifiableSet(collectSupertypes(fqn)));
        }
        this.supertypes = Collections.unmodifiableMap(ancestors);
    }

    private Set<String> collectSupertypes(String fqn) {
        Set<String> result = new LinkedHashSet<>();
        Deque<String> work = new ArrayDeque<>();
        work.push(fqn);
        while (!work.isEmpty()) {
            TypeDecl decl = declarations.get(work.pop());
            if (decl == null) {
                continue;
            }
            if (decl.superclass() != null && result.add(decl.superclass())) {
                work.push(decl.superclass());
            }
            for (String iface : decl.interfaces()) {
                if (result.add(iface)) {
                    work.push(iface);
                }
            }
        }
        // A cyclic declaration would list the type as its own ancestor
        result.remove(fqn);
        return result;
    }

    public boolean isKnown(String fqn) {
        return declarations.containsKey(fqn);
    }

    public Optional<TypeDecl> declaration(String fqn) {
        return Optional.ofNullable(declarations.get(fqn));
    }

    /**
     * All transitive supertypes of a declared type; empty for unknown types.
     */
    public Set<String> allSupertypes(String fqn) {
        return supertypes.getOrDefault(fqn, Set.of());
    }

    /**
     * Whether {@code child} is {@code parent} or one of its declared subtypes.
     */
    public boolean isSubtypeOf(String child, String parent) {
        return child.equals(parent) || allSupertypes(child).contains(parent);
    }

    public boolean isRelated(String a, String b) {
        return isSubtypeOf(a, b) || isSubtypeOf(b, a);
    }

    /**
     * Whether the type is declared as a class (not an interface or annotation), including
     * enums and records.
     */
    public boolean isDeclaredClass(String fqn) {
        TypeDecl decl = declarations.get(fqn);
        return decl != null && !decl.isInterface();
    }

    /**
     * Whether every supertype of the declared class is known, i.e. its superclass chain
     * ends at {@code java.lang.Object} without passing through an undeclared class.
     */
    public boolean hasCompleteSuperclassChain(String fqn) {
        String current = fqn;
        Set<String> seen = new LinkedHashSet<>();
        while (current != null && seen.add(current)) {
            if ("java.lang.Object".equals(current)) {
                return true;
            }
            TypeDecl decl = declarations.get(current);
            if (decl == null) {
                return false;
            }
            current = decl.superclass();
        }
        return current == null;
    }
}
