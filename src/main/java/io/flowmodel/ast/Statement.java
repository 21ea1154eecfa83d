package io.flowmodel.ast;

import java.util.Optional;

/**
 * A top-level statement of a callable body.
 */
public sealed interface Statement permits ExpressionStatement, ReturnStatement {

    SourceLocation location();

    /**
     * The root expression of this statement, if any.
     */
    Optional<Expr> expression();
}
