package io.flowmodel.ast;

import java.util.Objects;
import java.util.Optional;

/**
 * {@code return operand;} or a bare {@code return;} (null operand).
 */
public record ReturnStatement(Expr operand, SourceLocation location) implements Statement {

    public ReturnStatement {
        Objects.requireNonNull(location, "location");
    }

    @Override
    public Optional<Expr> expression() {
        return Optional.ofNullable(operand);
    }
}
