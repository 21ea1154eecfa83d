package io.flowmodel.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Immutable structural facts about an analyzed program: declared types, fields and
 * callables, and the expression trees of callable bodies.
 * <p>
 * This is the input contract of the modeling layer. A language front end fills it through
 * {@link #builder()}; every relation the layer derives is a pure function of it.
 */
public final class Program {

    private final Map<String, TypeDecl> types;
    private final Map<String, Field> fields;
    private final Map<String, Callable> callables;
    private final Map<Callable, List<Statement>> bodies;

    // Derived indexes
    private final Map<Expr, Expr> parents;
    private final Map<Expr, Statement> rootStatements;
    private final Map<Expr, Callable> enclosing;
    private final List<Expr> expressions;

    private Program(Map<String, TypeDecl> types,
                    Map<String, Field> fields,
                    Map<String, Callable> callables,
                    Map<Callable, List<Statement>> bodies) {
        this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.callables = Collections.unmodifiableMap(new LinkedHashMap<>(callables));
        this.bodies = Collections.unmodifiableMap(new LinkedHashMap<>(bodies));

        Map<Expr, Expr> parentIndex = new HashMap<>();
        Map<Expr, Statement> statementIndex = new HashMap<>();
        Map<Expr, Callable> enclosingIndex = new HashMap<>();
        List<Expr> all = new ArrayList<>();

        for (Map.Entry<Callable, List<Statement>> body : this.bodies.entrySet()) {
            for (Statement statement : body.getValue()) {
                Optional<Expr> root = statement.expression();
                if (root.isEmpty()) {
                    continue;
                }
                Deque<Expr> work = new ArrayDeque<>();
                register(root.get(), null, statement, body.getKey(), statementIndex, enclosingIndex, all);
                work.push(root.get());
                while (!work.isEmpty()) {
                    Expr current = work.pop();
                    for (Expr child : current.children()) {
                        register(child, current, statement, body.getKey(), statementIndex, enclosingIndex, all);
                        parentIndex.put(child, current);
                        work.push(child);
                    }
                }
            }
        }

        this.parents = Collections.unmodifiableMap(parentIndex);
        this.rootStatements = Collections.unmodifiableMap(statementIndex);
        this.enclosing = Collections.unmodifiableMap(enclosingIndex);
        this.expressions = List.copyOf(all);
    }

    private static void register(Expr expr, Expr parent, Statement statement, Callable callable,
                                 Map<Expr, Statement> statementIndex,
                                 Map<Expr, Callable> enclosingIndex,
                                 List<Expr> all) {
        if (statementIndex.containsKey(expr)) {
            throw new IllegalArgumentException("Expression " + expr + " occurs more than once"
                    + (parent != null ? " (again under " + parent + ")" : ""));
        }
        statementIndex.put(expr, statement);
        enclosingIndex.put(expr, callable);
        all.add(expr);
    }

    public static Builder builder() {
        return new Builder();
    }

    // --- declarations ---

    public Optional<TypeDecl> typeDecl(String fqn) {
        return Optional.ofNullable(types.get(fqn));
    }

    public Collection<TypeDecl> typeDecls() {
        return types.values();
    }

    public Optional<Field> field(String declaringType, String name) {
        return Optional.ofNullable(fields.get(declaringType + "." + name));
    }

    public Collection<Field> fields() {
        return fields.values();
    }

    public Optional<Callable> callable(String key) {
        return Optional.ofNullable(callables.get(key));
    }

    public Collection<Callable> callables() {
        return callables.values();
    }

    // --- bodies ---

    /**
     * Statements of the callable's body; empty for callables without a body.
     */
    public List<Statement> body(Callable callable) {
        return bodies.getOrDefault(callable, List.of());
    }

    public List<ReturnStatement> returnStatements(Callable callable) {
        return body(callable).stream()
                .filter(ReturnStatement.class::isInstance)
                .map(ReturnStatement.class::cast)
                .toList();
    }

    /**
     * All expressions of all bodies, each exactly once.
     */
    public List<Expr> expressions() {
        return expressions;
    }

    public Stream<Call> calls() {
        return expressions.stream()
                .filter(Call.class::isInstance)
                .map(Call.class::cast);
    }

    public boolean contains(Expr expr) {
        return rootStatements.containsKey(expr);
    }

    /**
     * The directly enclosing expression; empty for the root expression of a statement.
     */
    public Optional<Expr> parentOf(Expr expr) {
        return Optional.ofNullable(parents.get(expr));
    }

    /**
     * The top-level statement the expression belongs to.
     */
    public Optional<Statement> statementOf(Expr expr) {
        return Optional.ofNullable(rootStatements.get(expr));
    }

    /**
     * The callable whose body textually contains the expression.
     */
    public Optional<Callable> enclosingCallable(Expr expr) {
        return Optional.ofNullable(enclosing.get(expr));
    }

    /**
     * Whether the expression is the left-hand side of an assignment.
     */
    public boolean isAssignmentTarget(Expr expr) {
        return parentOf(expr)
                .filter(p -> p instanceof Assignment a && a.lhs() == expr)
                .isPresent();
    }

    /**
     * Whether the expression is the operand of a return statement.
     */
    public boolean isReturnOperand(Expr expr) {
        if (parents.containsKey(expr)) {
            return false;
        }
        return statementOf(expr)
                .filter(s -> s instanceof ReturnStatement r && r.operand() == expr)
                .isPresent();
    }

    public int typeCount() {
        return types.size();
    }

    public int callableCount() {
        return callables.size();
    }

    public int expressionCount() {
        return expressions.size();
    }

    /**
     * Collects declarations and bodies, then freezes them into a {@link Program}.
     */
    public static class Builder {
        private final Map<String, TypeDecl> types = new LinkedHashMap<>();
        private final Map<String, Field> fields = new LinkedHashMap<>();
        private final Map<String, Callable> callables = new LinkedHashMap<>();
        private final Map<Callable, BodyBuilder> bodies = new LinkedHashMap<>();

        public Builder addType(TypeDecl type) {
            types.put(type.fqn(), type);
            return this;
        }

        public Builder addField(Field field) {
            fields.put(field.key(), field);
            return this;
        }

        public Builder addCallable(Callable callable) {
            callables.put(callable.key(), callable);
            return this;
        }

        public Optional<Callable> callable(String key) {
            return Optional.ofNullable(callables.get(key));
        }

        public Optional<TypeDecl> typeDecl(String fqn) {
            return Optional.ofNullable(types.get(fqn));
        }

        public Optional<Field> field(String declaringType, String name) {
            return Optional.ofNullable(fields.get(declaringType + "." + name));
        }

        /**
         * Returns the body builder of the callable, declaring the callable if needed.
         */
        public BodyBuilder body(Callable callable) {
            addCallable(callable);
            return bodies.computeIfAbsent(callable, BodyBuilder::new);
        }

        /**
         * Drops the bodies built so far for callables of the type, keeping its declarations.
         *
         * @return the number of bodies dropped
         */
        public int removeBodies(String declaringType) {
            int before = bodies.size();
            bodies.keySet().removeIf(callable -> callable.declaringType().equals(declaringType));
            return before - bodies.size();
        }

        public Program build() {
            Map<Callable, List<Statement>> frozen = new LinkedHashMap<>();
            for (Map.Entry<Callable, BodyBuilder> entry : bodies.entrySet()) {
                frozen.put(entry.getKey(), entry.getValue().statements());
            }
            return new Program(types, fields, callables, frozen);
        }
    }
}
