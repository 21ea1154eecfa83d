package io.flowmodel.content;

import io.flowmodel.FlowModelConfig;
import io.flowmodel.ast.Call;
import io.flowmodel.ast.Expr;
import io.flowmodel.ast.TypeRef;
import io.flowmodel.types.TypeHierarchy;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Recognizes element writes and reads on collection-like containers.
 * <p>
 * A call is a container access when it has a receiver, its name is one of the configured
 * write or read methods, and either its declaring type or the receiver's static type is a
 * configured container type or a program-declared subtype of one.
 */
public class ContainerModel {

    private final Set<String> containerTypes;
    private final Set<String> writeMethods;
    private final Set<String> readMethods;
    private final TypeHierarchy hierarchy;

    public ContainerModel(Set<String> containerTypes, Set<String> writeMethods, Set<String> readMethods,
                          TypeHierarchy hierarchy) {
        this.containerTypes = Set.copyOf(containerTypes);
        this.writeMethods = Set.copyOf(writeMethods);
        this.readMethods = Set.copyOf(readMethods);
        this.hierarchy = Objects.requireNonNull(hierarchy, "hierarchy");
    }

    public static ContainerModel fromConfig(FlowModelConfig config, TypeHierarchy hierarchy) {
        return new ContainerModel(config.collectionTypes(), config.collectionWriteMethods(),
                config.collectionReadMethods(), hierarchy);
    }

    public boolean isContainerType(String fqn) {
        if (containerTypes.contains(fqn)) {
            return true;
        }
        for (String supertype : hierarchy.allSupertypes(fqn)) {
            if (containerTypes.contains(supertype)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether the call stores its last argument into the receiver container.
     */
    public boolean isWrite(Call call) {
        return call.argumentCount() > 0
                && writeMethods.contains(call.target().name())
                && onContainer(call);
    }

    /**
     * Whether the call's result is an element read from the receiver container.
     */
    public boolean isRead(Call call) {
        return !TypeRef.VOID.equals(call.target().returnType())
                && readMethods.contains(call.target().name())
                && onContainer(call);
    }

    /**
     * The value a container write stores: its last argument.
     */
    public Optional<Expr> storedValue(Call call) {
        if (!isWrite(call)) {
            return Optional.empty();
        }
        return Optional.of(call.arguments().get(call.argumentCount() - 1));
    }

    private boolean onContainer(Call call) {
        if (call.isConstructorCall() || call.target().isStatic()) {
            return false;
        }
        Optional<Expr> qualifier = call.qualifier();
        if (qualifier.isEmpty()) {
            return false;
        }
        if (isContainerType(call.target().declaringType())) {
            return true;
        }
        return qualifier.get().type() instanceof TypeRef.ClassType receiverType
                && isContainerType(receiverType.fqn());
    }
}
