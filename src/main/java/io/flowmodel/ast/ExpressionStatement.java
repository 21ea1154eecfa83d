package io.flowmodel.ast;

import java.util.Objects;
import java.util.Optional;

/**
 * An expression evaluated for its effect: {@code x.f = y;}, {@code list.add(v);}.
 */
public record ExpressionStatement(Expr expr, SourceLocation location) implements Statement {

    public ExpressionStatement {
        Objects.requireNonNull(expr, "expr");
        Objects.requireNonNull(location, "location");
    }

    @Override
    public Optional<Expr> expression() {
        return Optional.of(expr);
    }
}
