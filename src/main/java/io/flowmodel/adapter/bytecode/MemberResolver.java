package io.flowmodel.adapter.bytecode;

import io.flowmodel.ast.Callable;
import io.flowmodel.ast.CallableKind;
import io.flowmodel.ast.Field;
import io.flowmodel.ast.Program;
import io.flowmodel.ast.TypeDecl;
import io.flowmodel.ast.TypeRef;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves field and method references of instructions against the declarations collected
 * so far. Bytecode names the static type of the receiver as owner, so inherited members are
 * looked up through the declared supertypes. Members of undeclared (library) types are
 * synthesized from the descriptor.
 */
class MemberResolver {

    private final Program.Builder program;

    MemberResolver(Program.Builder program) {
        this.program = program;
    }

    Field resolveField(String owner, String name, String descriptor, boolean isStatic) {
        for (String type : supertypeWalk(owner)) {
            Optional<Field> declared = program.field(type, name);
            if (declared.isPresent() && declared.get().isStatic() == isStatic) {
                return declared.get();
            }
        }
        return new Field(owner, name, DescriptorParser.parseFieldType(descriptor), isStatic);
    }

    Callable resolveCallable(String owner, String name, String descriptor, boolean isStatic) {
        Callable fromDescriptor = callable(owner, name, descriptor, isStatic, false);
        if (fromDescriptor.isConstructor()) {
            // Constructors are not inherited
            return program.callable(fromDescriptor.key()).orElse(fromDescriptor);
        }
        for (String type : supertypeWalk(owner)) {
            Callable candidate = callable(type, name, descriptor, isStatic, false);
            Optional<Callable> declared = program.callable(candidate.key());
            if (declared.isPresent()) {
                return declared.get();
            }
        }
        return fromDescriptor;
    }

    /**
     * Builds the callable a method declaration or reference describes.
     */
    static Callable callable(String owner, String name, String descriptor, boolean isStatic, boolean isVarargs) {
        List<TypeRef> parameterTypes = DescriptorParser.parseParameterTypes(descriptor);
        return Callable.builder()
                .declaringType(owner)
                .name(name)
                .parameterTypes(parameterTypes)
                .returnType(DescriptorParser.parseReturnType(descriptor))
                .kind(kindOf(name))
                .isStatic(isStatic)
                .isVarargs(isVarargs && !parameterTypes.isEmpty()
                        && parameterTypes.get(parameterTypes.size() - 1).isArray())
                .build();
    }

    static CallableKind kindOf(String methodName) {
        return switch (methodName) {
            case "<init>" -> CallableKind.CONSTRUCTOR;
            case "<clinit>" -> CallableKind.INITIALIZER;
            default -> CallableKind.METHOD;
        };
    }

    /**
     * The type itself, then its declared supertypes breadth-first.
     */
    private List<String> supertypeWalk(String owner) {
        List<String> order = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Deque<String> work = new ArrayDeque<>();
        work.add(owner);
        while (!work.isEmpty()) {
            String current = work.poll();
            if (!seen.add(current)) {
                continue;
            }
            order.add(current);
            Optional<TypeDecl> decl = program.typeDecl(current);
            if (decl.isPresent()) {
                if (decl.get().superclass() != null) {
                    work.add(decl.get().superclass());
                }
                work.addAll(decl.get().interfaces());
            }
        }
        return order;
    }
}
