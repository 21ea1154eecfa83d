package io.flowmodel.adapter.bytecode;

import io.flowmodel.ast.Assignment;
import io.flowmodel.ast.BodyBuilder;
import io.flowmodel.ast.Call;
import io.flowmodel.ast.Callable;
import io.flowmodel.ast.Expr;
import io.flowmodel.ast.Field;
import io.flowmodel.ast.FieldAccess;
import io.flowmodel.ast.Literal;
import io.flowmodel.ast.TypeRef;
import io.flowmodel.ast.Variable;
import io.flowmodel.ast.VariableAccess;
import org.objectweb.asm.ConstantDynamic;
import org.objectweb.asm.Handle;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * MethodVisitor that rebuilds the expression trees of a method body.
 * <p>
 * Performs a lightweight, linear operand-stack simulation. Each stack slot holds a
 * {@link Cell}; {@code DUP} pushes the same cell again, and long/double values occupy two
 * slots holding the same cell. Values are turned into expressions when an instruction
 * consumes them:
 * <ul>
 *   <li>{@code NEW}/{@code DUP}/{@code <init>} becomes one object-creation call.</li>
 *   <li>A fresh array whose elements are stored right away becomes an array creation with
 *       elements; passed as last argument to a varargs callee it becomes the synthesized
 *       varargs array of that call.</li>
 *   <li>A store whose value is still on the stack (a {@code DUP} before the store) turns that
 *       value into the assignment expression, so {@code a = b = c} nests.</li>
 *   <li>A value consumed a second time is re-read from its variable, or stands as an opaque
 *       copy.</li>
 * </ul>
 * Branch merges are not modeled: values left on the stack at an exception handler and at the
 * end of the method are kept as expression statements, and stack underflow produces opaque
 * placeholders.
 */
public class ExpressionTreeBuilder extends MethodVisitor {

    private static final TypeRef INT = TypeRef.of("int");
    private static final TypeRef LONG = TypeRef.of("long");
    private static final TypeRef FLOAT = TypeRef.of("float");
    private static final TypeRef DOUBLE = TypeRef.of("double");
    private static final TypeRef BOOLEAN = TypeRef.of("boolean");
    private static final TypeRef STRING = TypeRef.classType("java.lang.String");
    private static final TypeRef CLASS = TypeRef.classType("java.lang.Class");

    /**
     * A value on the simulated stack.
     */
    private static final class Cell {
        Expr expr;
        boolean consumed;
        final boolean wide;
        // Allocated by NEW, waiting for its constructor call
        TypeRef.ClassType pendingNew;
        // Created by NEWARRAY/ANEWARRAY, collecting element stores
        TypeRef.ArrayType pendingArray;
        Expr dimension;
        final List<Expr> elements = new ArrayList<>();

        Cell(Expr expr) {
            this.expr = expr;
            this.wide = DescriptorParser.isWide(expr.type());
        }

        Cell(TypeRef.ClassType pendingNew) {
            this.pendingNew = pendingNew;
            this.wide = false;
        }

        Cell(TypeRef.ArrayType pendingArray, Expr dimension) {
            this.pendingArray = pendingArray;
            this.dimension = dimension;
            this.wide = false;
        }
    }

    private final BodyBuilder body;
    private final MemberResolver resolver;
    private final Callable callable;

    private final Deque<Cell> stack = new ArrayDeque<>();
    private final Map<Integer, Integer> parameterSlots = new HashMap<>(); // slot -> parameter index
    private final Map<String, Variable> locals = new HashMap<>();        // slot:sort -> variable
    private final Map<Label, String> handlers = new HashMap<>();         // handler -> caught type

    ExpressionTreeBuilder(BodyBuilder body, MemberResolver resolver) {
        super(Opcodes.ASM9);
        this.body = body;
        this.resolver = resolver;
        this.callable = body.callable();

        int slot = callable.isStatic() ? 0 : 1; // slot 0 is 'this' for instance methods
        for (int i = 0; i < callable.parameterCount(); i++) {
            parameterSlots.put(slot, i);
            slot += DescriptorParser.isWide(callable.parameterTypes().get(i)) ? 2 : 1;
        }
    }

    // --- stack ---

    private void push(Cell cell) {
        stack.push(cell);
        if (cell.wide) {
            stack.push(cell);
        }
    }

    private void push(Expr expr) {
        push(new Cell(expr));
    }

    /**
     * Pops one slot; an empty stack yields a placeholder.
     */
    private Cell popSlot() {
        Cell cell = stack.pollFirst();
        return cell != null ? cell : new Cell(body.opaque("underflow", TypeRef.OBJECT));
    }

    /**
     * Pops one value, both slots of a long or double.
     */
    private Cell popValue() {
        Cell cell = popSlot();
        if (cell.wide && stack.peekFirst() == cell) {
            stack.pollFirst();
        }
        return cell;
    }

    private List<Cell> popValues(int count) {
        Cell[] cells = new Cell[count];
        for (int i = count - 1; i >= 0; i--) {
            cells[i] = popValue();
        }
        return List.of(cells);
    }

    /**
     * Turns the cell into the expression that consumes it.
     */
    private Expr take(Cell cell) {
        if (cell.pendingNew != null) {
            // Uninitialized object used before its constructor ran
            cell.expr = body.opaque("new", cell.pendingNew);
            cell.pendingNew = null;
        } else if (cell.pendingArray != null) {
            cell.expr = materializeArray(cell);
        } else if (cell.consumed) {
            return copyOf(cell.expr);
        }
        cell.consumed = true;
        return cell.expr;
    }

    private List<Expr> takeAll(List<Cell> cells) {
        List<Expr> exprs = new ArrayList<>(cells.size());
        for (Cell cell : cells) {
            exprs.add(take(cell));
        }
        return exprs;
    }

    private Expr materializeArray(Cell cell) {
        TypeRef.ArrayType type = cell.pendingArray;
        cell.pendingArray = null;
        if (!cell.elements.isEmpty()) {
            return body.arrayOf(type.component(), List.copyOf(cell.elements));
        }
        return body.newArray(type.component(), cell.dimension);
    }

    private Expr copyOf(Expr expr) {
        if (expr instanceof VariableAccess access) {
            return body.access(access.variable());
        }
        if (expr instanceof Literal literal) {
            return body.literal(literal.value(), literal.type());
        }
        if (expr instanceof FieldAccess access && access.isStatic()) {
            return body.staticField(access.field());
        }
        return body.opaque("dup", expr.type());
    }

    private boolean onStack(Cell cell) {
        return stack.contains(cell);
    }

    /**
     * Keeps an expression nobody consumes as a statement of its own.
     */
    private void discard(Cell cell) {
        if (cell.consumed || onStack(cell) || cell.pendingNew != null) {
            return;
        }
        Expr expr = take(cell);
        if (!(expr instanceof VariableAccess) && !(expr instanceof Literal)) {
            body.statement(expr);
        }
    }

    private void flushStack() {
        Set<Cell> cells = new LinkedHashSet<>();
        stack.descendingIterator().forEachRemaining(cells::add);
        stack.clear();
        cells.forEach(this::discard);
    }

    /**
     * A DUP'd value turns into the assignment; otherwise the assignment is a statement.
     */
    private void finishStore(Cell value, Assignment assignment) {
        if (onStack(value)) {
            value.expr = assignment;
            value.consumed = false;
        } else {
            body.statement(assignment);
        }
    }

    // --- variables ---

    private Expr load(int slot, char sort) {
        if (slot == 0 && !callable.isStatic()) {
            return body.self();
        }
        Integer parameter = parameterSlots.get(slot);
        if (parameter != null) {
            return body.parameter(parameter);
        }
        return body.access(local(slot, sort));
    }

    /**
     * The local variable of a slot and sort. Without debug info the declared type of a
     * reference local is unknown, and one slot may hold variables of unrelated types, so
     * reference locals are typed {@code java.lang.Object}.
     */
    private Variable local(int slot, char sort) {
        return locals.computeIfAbsent(slot + ":" + sort, k -> Variable.local("local" + slot, typeOfSort(sort)));
    }

    private static char sortOf(int opcode) {
        return switch (opcode) {
            case Opcodes.ILOAD, Opcodes.ISTORE -> 'I';
            case Opcodes.LLOAD, Opcodes.LSTORE -> 'J';
            case Opcodes.FLOAD, Opcodes.FSTORE -> 'F';
            case Opcodes.DLOAD, Opcodes.DSTORE -> 'D';
            default -> 'A';
        };
    }

    private static TypeRef typeOfSort(char sort) {
        return switch (sort) {
            case 'I' -> INT;
            case 'J' -> LONG;
            case 'F' -> FLOAT;
            case 'D' -> DOUBLE;
            default -> TypeRef.OBJECT;
        };
    }

    @Override
    public void visitVarInsn(int opcode, int varIndex) {
        char sort = sortOf(opcode);
        if (opcode >= Opcodes.ILOAD && opcode <= Opcodes.ALOAD) {
            push(load(varIndex, sort));
        } else if (opcode >= Opcodes.ISTORE && opcode <= Opcodes.ASTORE) {
            Cell value = popValue();
            Expr rhs = take(value);
            finishStore(value, body.assign(load(varIndex, sort), rhs));
        }
        super.visitVarInsn(opcode, varIndex);
    }

    @Override
    public void visitIincInsn(int varIndex, int increment) {
        Expr target = load(varIndex, 'I');
        body.statement(body.assign(target,
                body.opaque("iinc", INT, load(varIndex, 'I'), body.literal(increment, INT))));
        super.visitIincInsn(varIndex, increment);
    }

    // --- fields ---

    @Override
    public void visitFieldInsn(int opcode, String owner, String name, String descriptor) {
        String ownerFqn = DescriptorParser.toFqn(owner);
        boolean isStatic = opcode == Opcodes.GETSTATIC || opcode == Opcodes.PUTSTATIC;
        Field field = resolver.resolveField(ownerFqn, name, descriptor, isStatic);

        switch (opcode) {
            case Opcodes.GETSTATIC -> push(body.staticField(field));
            case Opcodes.GETFIELD -> push(body.field(take(popValue()), field));
            case Opcodes.PUTSTATIC -> {
                Cell value = popValue();
                Expr rhs = take(value);
                finishStore(value, body.assign(body.staticField(field), rhs));
            }
            case Opcodes.PUTFIELD -> {
                Cell value = popValue();
                Cell object = popValue();
                Expr rhs = take(value);
                finishStore(value, body.assign(body.field(take(object), field), rhs));
            }
            default -> {
                // No other field opcodes
            }
        }
        super.visitFieldInsn(opcode, owner, name, descriptor);
    }

    // --- calls ---

    @Override
    public void visitMethodInsn(int opcode, String owner, String name, String descriptor, boolean isInterface) {
        boolean isStatic = opcode == Opcodes.INVOKESTATIC;
        Callable target = resolver.resolveCallable(DescriptorParser.toFqn(owner), name, descriptor, isStatic);
        List<Cell> arguments = popValues(target.parameterCount());
        Cell receiver = isStatic ? null : popValue();

        if (opcode == Opcodes.INVOKESPECIAL && target.isConstructor() && receiver.pendingNew != null) {
            Call creation = isPackedVarargs(target, arguments)
                    ? body.varargsConstruct(target, fixedArguments(arguments), packedArguments(arguments))
                    : body.construct(target, takeAll(arguments));
            markVarargsCarrier(creation, arguments);
            receiver.pendingNew = null;
            receiver.expr = creation;
            receiver.consumed = !onStack(receiver);
            if (receiver.consumed) {
                body.statement(creation);
            }
        } else {
            Expr qualifier = receiver != null ? take(receiver) : null;
            Call call = isPackedVarargs(target, arguments)
                    ? body.varargsCall(target, qualifier, fixedArguments(arguments), packedArguments(arguments))
                    : body.call(target, qualifier, takeAll(arguments));
            markVarargsCarrier(call, arguments);
            if (TypeRef.VOID.equals(target.returnType())) {
                body.statement(call);
            } else {
                push(call);
            }
        }
        super.visitMethodInsn(opcode, owner, name, descriptor, isInterface);
    }

    /**
     * Whether the last argument is a fresh array whose elements javac packed for a varargs callee.
     */
    private boolean isPackedVarargs(Callable target, List<Cell> arguments) {
        if (!target.isVarargs() || arguments.isEmpty()) {
            return false;
        }
        Cell last = arguments.get(arguments.size() - 1);
        return last.pendingArray != null
                && !onStack(last)
                && last.dimension instanceof Literal size
                && size.value() instanceof Integer n
                && n == last.elements.size();
    }

    private List<Expr> fixedArguments(List<Cell> arguments) {
        return takeAll(arguments.subList(0, arguments.size() - 1));
    }

    private List<Expr> packedArguments(List<Cell> arguments) {
        return List.copyOf(arguments.get(arguments.size() - 1).elements);
    }

    private void markVarargsCarrier(Call call, List<Cell> arguments) {
        if (arguments.isEmpty()) {
            return;
        }
        Cell last = arguments.get(arguments.size() - 1);
        if (last.pendingArray != null) {
            last.pendingArray = null;
            last.expr = call.arguments().get(call.argumentCount() - 1);
            last.consumed = true;
        }
    }

    @Override
    public void visitInvokeDynamicInsn(String name, String descriptor, Handle bootstrapMethodHandle,
                                       Object... bootstrapMethodArguments) {
        List<Expr> operands = takeAll(popValues(DescriptorParser.parseParameterTypes(descriptor).size()));
        TypeRef returnType = DescriptorParser.parseReturnType(descriptor);
        Expr dynamic = body.opaque("invokedynamic:" + name, returnType, operands);
        if (TypeRef.VOID.equals(returnType)) {
            body.statement(dynamic);
        } else {
            push(dynamic);
        }
        super.visitInvokeDynamicInsn(name, descriptor, bootstrapMethodHandle, bootstrapMethodArguments);
    }

    // --- objects and arrays ---

    @Override
    public void visitTypeInsn(int opcode, String type) {
        switch (opcode) {
            case Opcodes.NEW -> push(new Cell((TypeRef.ClassType) DescriptorParser.parseTypeOperand(type)));
            case Opcodes.ANEWARRAY -> {
                Expr size = take(popValue());
                push(new Cell(TypeRef.arrayOf(DescriptorParser.parseTypeOperand(type)), size));
            }
            case Opcodes.INSTANCEOF -> push(body.opaque("instanceof", BOOLEAN, take(popValue())));
            default -> {
                // CHECKCAST leaves the value and its static type as they are
            }
        }
        super.visitTypeInsn(opcode, type);
    }

    @Override
    public void visitIntInsn(int opcode, int operand) {
        if (opcode == Opcodes.BIPUSH || opcode == Opcodes.SIPUSH) {
            push(body.literal(operand, INT));
        } else if (opcode == Opcodes.NEWARRAY) {
            Expr size = take(popValue());
            push(new Cell(TypeRef.arrayOf(DescriptorParser.primitiveArrayElement(operand)), size));
        }
        super.visitIntInsn(opcode, operand);
    }

    @Override
    public void visitMultiANewArrayInsn(String descriptor, int numDimensions) {
        List<Expr> dimensions = takeAll(popValues(numDimensions));
        TypeRef type = DescriptorParser.parseFieldType(descriptor);
        TypeRef component = type instanceof TypeRef.ArrayType array ? array.component() : TypeRef.OBJECT;
        push(body.newArray(component, dimensions.toArray(new Expr[0])));
        super.visitMultiANewArrayInsn(descriptor, numDimensions);
    }

    private void arrayStore() {
        Cell value = popValue();
        Cell index = popValue();
        Cell array = popValue();
        if (array.pendingArray != null && onStack(array)) {
            // new T[]{...}: element stores into a fresh array still being initialized
            index.consumed = true;
            array.elements.add(take(value));
            return;
        }
        Expr arrayExpr = take(array);
        Expr indexExpr = take(index);
        Expr rhs = take(value);
        finishStore(value, body.assign(body.arrayElement(arrayExpr, indexExpr), rhs));
    }

    private void arrayLoad() {
        Cell index = popValue();
        Cell array = popValue();
        Expr arrayExpr = take(array);
        push(body.arrayElement(arrayExpr, take(index)));
    }

    // --- constants ---

    @Override
    public void visitLdcInsn(Object value) {
        if (value instanceof String) {
            push(body.literal(value, STRING));
        } else if (value instanceof Integer) {
            push(body.literal(value, INT));
        } else if (value instanceof Long) {
            push(body.literal(value, LONG));
        } else if (value instanceof Float) {
            push(body.literal(value, FLOAT));
        } else if (value instanceof Double) {
            push(body.literal(value, DOUBLE));
        } else if (value instanceof Type type && type.getSort() != Type.METHOD) {
            push(body.literal(type.getClassName(), CLASS));
        } else if (value instanceof ConstantDynamic constant) {
            push(body.opaque("condy:" + constant.getName(), DescriptorParser.parseFieldType(constant.getDescriptor())));
        } else {
            push(body.opaque("ldc", TypeRef.OBJECT));
        }
        super.visitLdcInsn(value);
    }

    // --- plain instructions ---

    @Override
    public void visitInsn(int opcode) {
        if (opcode == Opcodes.ACONST_NULL) {
            push(body.nullLiteral());
        } else if (opcode >= Opcodes.ICONST_M1 && opcode <= Opcodes.ICONST_5) {
            push(body.literal(opcode - Opcodes.ICONST_0, INT));
        } else if (opcode == Opcodes.LCONST_0 || opcode == Opcodes.LCONST_1) {
            push(body.literal((long) (opcode - Opcodes.LCONST_0), LONG));
        } else if (opcode >= Opcodes.FCONST_0 && opcode <= Opcodes.FCONST_2) {
            push(body.literal((float) (opcode - Opcodes.FCONST_0), FLOAT));
        } else if (opcode == Opcodes.DCONST_0 || opcode == Opcodes.DCONST_1) {
            push(body.literal((double) (opcode - Opcodes.DCONST_0), DOUBLE));
        } else if (opcode >= Opcodes.IALOAD && opcode <= Opcodes.SALOAD) {
            arrayLoad();
        } else if (opcode >= Opcodes.IASTORE && opcode <= Opcodes.SASTORE) {
            arrayStore();
        } else if (opcode >= Opcodes.POP && opcode <= Opcodes.SWAP) {
            stackManipulation(opcode);
        } else if (opcode >= Opcodes.IADD && opcode <= Opcodes.DREM
                || opcode >= Opcodes.ISHL && opcode <= Opcodes.LXOR
                || opcode >= Opcodes.LCMP && opcode <= Opcodes.DCMPG) {
            Cell right = popValue();
            Cell left = popValue();
            Expr leftExpr = take(left);
            push(body.opaque("binary", arithmeticType(opcode), leftExpr, take(right)));
        } else if (opcode >= Opcodes.INEG && opcode <= Opcodes.DNEG) {
            push(body.opaque("negate", arithmeticType(opcode), take(popValue())));
        } else if (opcode >= Opcodes.I2L && opcode <= Opcodes.I2S) {
            push(body.opaque("convert", conversionType(opcode), take(popValue())));
        } else if (opcode == Opcodes.ARRAYLENGTH) {
            push(body.opaque("arraylength", INT, take(popValue())));
        } else if (opcode >= Opcodes.IRETURN && opcode <= Opcodes.ARETURN) {
            body.returns(take(popValue()));
            flushStack();
        } else if (opcode == Opcodes.RETURN) {
            body.returnsVoid();
            flushStack();
        } else if (opcode == Opcodes.ATHROW) {
            body.statement(body.opaque("throw", TypeRef.VOID, take(popValue())));
            flushStack();
        } else if (opcode == Opcodes.MONITORENTER || opcode == Opcodes.MONITOREXIT) {
            body.statement(body.opaque(opcode == Opcodes.MONITORENTER ? "monitorenter" : "monitorexit",
                    TypeRef.VOID, take(popValue())));
        }
        super.visitInsn(opcode);
    }

    /**
     * POP, POP2, the DUP family and SWAP, on slots.
     */
    private void stackManipulation(int opcode) {
        switch (opcode) {
            case Opcodes.POP -> discard(popSlot());
            case Opcodes.POP2 -> {
                Cell first = popSlot();
                Cell second = popSlot();
                discard(first);
                if (second != first) {
                    discard(second);
                }
            }
            case Opcodes.DUP -> {
                Cell top = popSlot();
                pushSlots(top, top);
            }
            case Opcodes.DUP_X1 -> {
                Cell a = popSlot();
                Cell b = popSlot();
                pushSlots(a, b, a);
            }
            case Opcodes.DUP_X2 -> {
                Cell a = popSlot();
                Cell b = popSlot();
                Cell c = popSlot();
                pushSlots(a, c, b, a);
            }
            case Opcodes.DUP2 -> {
                Cell a = popSlot();
                Cell b = popSlot();
                pushSlots(b, a, b, a);
            }
            case Opcodes.DUP2_X1 -> {
                Cell a = popSlot();
                Cell b = popSlot();
                Cell c = popSlot();
                pushSlots(b, a, c, b, a);
            }
            case Opcodes.DUP2_X2 -> {
                Cell a = popSlot();
                Cell b = popSlot();
                Cell c = popSlot();
                Cell d = popSlot();
                pushSlots(b, a, d, c, b, a);
            }
            case Opcodes.SWAP -> {
                Cell a = popSlot();
                Cell b = popSlot();
                pushSlots(a, b);
            }
            default -> {
                // Range checked by the caller
            }
        }
    }

    /**
     * Pushes raw slots, bottom first.
     */
    private void pushSlots(Cell... cells) {
        for (Cell cell : cells) {
            stack.push(cell);
        }
    }

    private static TypeRef arithmeticType(int opcode) {
        if (opcode >= Opcodes.LCMP && opcode <= Opcodes.DCMPG) {
            return INT;
        }
        if (opcode >= Opcodes.ISHL && opcode <= Opcodes.LXOR) {
            return (opcode - Opcodes.ISHL) % 2 == 0 ? INT : LONG;
        }
        // IADD..DNEG cycle through int, long, float, double
        return switch ((opcode - Opcodes.IADD) % 4) {
            case 0 -> INT;
            case 1 -> LONG;
            case 2 -> FLOAT;
            default -> DOUBLE;
        };
    }

    private static TypeRef conversionType(int opcode) {
        return switch (opcode) {
            case Opcodes.I2L, Opcodes.F2L, Opcodes.D2L -> LONG;
            case Opcodes.I2F, Opcodes.L2F, Opcodes.D2F -> FLOAT;
            case Opcodes.I2D, Opcodes.L2D, Opcodes.F2D -> DOUBLE;
            case Opcodes.I2B -> TypeRef.of("byte");
            case Opcodes.I2C -> TypeRef.of("char");
            case Opcodes.I2S -> TypeRef.of("short");
            default -> INT;
        };
    }

    // --- control flow ---

    @Override
    public void visitJumpInsn(int opcode, Label label) {
        if (opcode >= Opcodes.IFEQ && opcode <= Opcodes.IFLE
                || opcode == Opcodes.IFNULL || opcode == Opcodes.IFNONNULL) {
            body.statement(body.opaque("branch", BOOLEAN, take(popValue())));
        } else if (opcode >= Opcodes.IF_ICMPEQ && opcode <= Opcodes.IF_ACMPNE) {
            Cell right = popValue();
            Cell left = popValue();
            Expr leftExpr = take(left);
            body.statement(body.opaque("branch", BOOLEAN, leftExpr, take(right)));
        }
        // GOTO doesn't pop anything
        super.visitJumpInsn(opcode, label);
    }

    @Override
    public void visitTableSwitchInsn(int min, int max, Label dflt, Label... labels) {
        body.statement(body.opaque("switch", TypeRef.VOID, take(popValue())));
        super.visitTableSwitchInsn(min, max, dflt, labels);
    }

    @Override
    public void visitLookupSwitchInsn(Label dflt, int[] keys, Label[] labels) {
        body.statement(body.opaque("switch", TypeRef.VOID, take(popValue())));
        super.visitLookupSwitchInsn(dflt, keys, labels);
    }

    @Override
    public void visitTryCatchBlock(Label start, Label end, Label handler, String type) {
        handlers.put(handler, type != null ? DescriptorParser.toFqn(type) : "java.lang.Throwable");
        super.visitTryCatchBlock(start, end, handler, type);
    }

    @Override
    public void visitLabel(Label label) {
        String caught = handlers.get(label);
        if (caught != null) {
            // The handler starts with only the exception on the stack
            flushStack();
            push(body.opaque("caught", TypeRef.classType(caught)));
        }
        super.visitLabel(label);
    }

    @Override
    public void visitEnd() {
        flushStack();
        super.visitEnd();
    }
}
