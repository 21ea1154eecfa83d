package io.flowmodel.adapter.bytecode;

import io.flowmodel.ast.Field;
import io.flowmodel.ast.Program;
import io.flowmodel.ast.TypeDecl;
import io.flowmodel.ast.TypeKind;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.FieldVisitor;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * First pass: records the type, its fields and its callables (with their varargs flags) in
 * the program builder. Method bodies are left to {@link BodyScanner}, which needs every
 * declaration to be known first.
 */
public class DeclarationScanner extends ClassVisitor {

    private final Program.Builder program;
    private String className;

    public DeclarationScanner(Program.Builder program) {
        super(Opcodes.ASM9);
        this.program = program;
    }

    @Override
    public void visit(int version, int access, String name, String signature,
                      String superName, String[] interfaces) {
        this.className = DescriptorParser.toFqn(name);
        TypeKind kind = kindOf(access);

        Set<String> implemented = new LinkedHashSet<>();
        if (interfaces != null) {
            Arrays.stream(interfaces)
                    .map(DescriptorParser::toFqn)
                    .forEach(implemented::add);
        }

        program.addType(TypeDecl.builder()
                .fqn(className)
                .kind(kind)
                // Interfaces name java/lang/Object as superclass in bytecode
                .superclass(superName != null && !kind.isInterface() ? DescriptorParser.toFqn(superName) : null)
                .interfaces(implemented)
                .isFinal((access & Opcodes.ACC_FINAL) != 0)
                .build());

        super.visit(version, access, name, signature, superName, interfaces);
    }

    @Override
    public FieldVisitor visitField(int access, String name, String descriptor,
                                   String signature, Object value) {
        program.addField(new Field(className, name, DescriptorParser.parseFieldType(descriptor),
                (access & Opcodes.ACC_STATIC) != 0));
        return super.visitField(access, name, descriptor, signature, value);
    }

    @Override
    public MethodVisitor visitMethod(int access, String name, String descriptor,
                                     String signature, String[] exceptions) {
        program.addCallable(MemberResolver.callable(className, name, descriptor,
                (access & Opcodes.ACC_STATIC) != 0,
                (access & Opcodes.ACC_VARARGS) != 0));
        return super.visitMethod(access, name, descriptor, signature, exceptions);
    }

    /**
     * Name of the last visited class, or null if none was visited.
     */
    public String getClassName() {
        return className;
    }

    static TypeKind kindOf(int access) {
        if ((access & Opcodes.ACC_ANNOTATION) != 0) {
            return TypeKind.ANNOTATION;
        }
        if ((access & Opcodes.ACC_INTERFACE) != 0) {
            return TypeKind.INTERFACE;
        }
        if ((access & Opcodes.ACC_ENUM) != 0) {
            return TypeKind.ENUM;
        }
        if ((access & Opcodes.ACC_RECORD) != 0) {
            return TypeKind.RECORD;
        }
        return TypeKind.CLASS;
    }
}
