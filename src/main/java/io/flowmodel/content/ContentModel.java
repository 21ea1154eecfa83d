package io.flowmodel.content;

import io.flowmodel.ast.ArrayCreation;
import io.flowmodel.ast.Call;
import io.flowmodel.ast.Expr;
import io.flowmodel.ast.FieldAccess;

import java.util.Objects;
import java.util.Optional;

/**
 * Maps access sites to the content they touch.
 */
public class ContentModel {

    private final ContainerModel containers;

    public ContentModel(ContainerModel containers) {
        this.containers = Objects.requireNonNull(containers, "containers");
    }

    public ContainerModel containers() {
        return containers;
    }

    /**
     * Content accessed by an expression, or empty if the expression touches no storage.
     * Field accesses map to their field whether static or not; array accesses and array
     * creations with initializers to the array bucket; container element calls to the
     * collection bucket.
     */
    public Optional<Content> contentOf(Expr accessSite) {
        return switch (accessSite.kind()) {
            case FIELD_ACCESS -> Optional.of(new FieldContent(((FieldAccess) accessSite).field()));
            case ARRAY_ACCESS -> Optional.of(ArrayContent.INSTANCE);
            case ARRAY_CREATION -> ((ArrayCreation) accessSite).elements().isEmpty()
                    ? Optional.empty()
                    : Optional.of(ArrayContent.INSTANCE);
            case CALL -> {
                Call call = (Call) accessSite;
                yield containers.isWrite(call) || containers.isRead(call)
                        ? Optional.of(CollectionContent.INSTANCE)
                        : Optional.empty();
            }
            default -> Optional.empty();
        };
    }
}
