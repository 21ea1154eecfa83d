package io.flowmodel.adapter.bytecode;

import io.flowmodel.ast.Callable;
import io.flowmodel.ast.Program;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

/**
 * Second pass: rebuilds the expression trees of every method with code.
 */
public class BodyScanner extends ClassVisitor {

    private final Program.Builder program;
    private final MemberResolver resolver;
    private String className;

    public BodyScanner(Program.Builder program) {
        super(Opcodes.ASM9);
        this.program = program;
        this.resolver = new MemberResolver(program);
    }

    @Override
    public void visit(int version, int access, String name, String signature,
                      String superName, String[] interfaces) {
        this.className = DescriptorParser.toFqn(name);
        super.visit(version, access, name, signature, superName, interfaces);
    }

    @Override
    public MethodVisitor visitMethod(int access, String name, String descriptor,
                                     String signature, String[] exceptions) {
        // Abstract and native methods have no body to rebuild
        if ((access & (Opcodes.ACC_ABSTRACT | Opcodes.ACC_NATIVE)) != 0) {
            return super.visitMethod(access, name, descriptor, signature, exceptions);
        }
        boolean isStatic = (access & Opcodes.ACC_STATIC) != 0;
        Callable declared = MemberResolver.callable(className, name, descriptor, isStatic,
                (access & Opcodes.ACC_VARARGS) != 0);
        Callable callable = program.callable(declared.key()).orElse(declared);
        return new ExpressionTreeBuilder(program.body(callable), resolver);
    }
}
