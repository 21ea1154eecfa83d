package io.flowmodel.adapter.bytecode;

import io.flowmodel.FlowModelConfig;
import io.flowmodel.ast.Program;
import org.objectweb.asm.ClassReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Enumeration;
import java.util.List;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;

/**
 * Builds a {@link Program} from compiled classes: class directories, JARs or raw class files.
 * <p>
 * Loading runs in two passes over all classes: first every declaration (types, fields,
 * callables), then every method body, so calls into other loaded classes see the callee's
 * varargs flag and inherited members resolve. A class that fails to parse is logged and
 * skipped.
 */
public class ClassFileLoader {

    private final Logger logger = LoggerFactory.getLogger(getClass());

    private final FlowModelConfig config;

    private int classesLoaded = 0;
    private int classesSkipped = 0;
    private int jarsLoaded = 0;

    /**
     * A class file read into memory, with where it came from for diagnostics.
     */
    private record ClassFile(String origin, byte[] bytes) {
    }

    public ClassFileLoader() {
        this(FlowModelConfig.loadDefault());
    }

    public ClassFileLoader(FlowModelConfig config) {
        this.config = config;
    }

    /**
     * Loads classes from directories, JARs and single {@code .class} files.
     * A Maven project root (a directory with a pom.xml and target/classes) loads its
     * target/classes.
     */
    public Program load(List<Path> paths) throws IOException {
        List<ClassFile> classFiles = new ArrayList<>();
        for (Path path : paths) {
            collect(path, classFiles);
        }
        return build(classFiles);
    }

    public Program load(Path path) throws IOException {
        return load(List.of(path));
    }

    /**
     * Loads classes from in-memory class file contents.
     */
    public Program loadClassFiles(Collection<byte[]> classFiles) {
        List<ClassFile> files = new ArrayList<>();
        int i = 0;
        for (byte[] bytes : classFiles) {
            files.add(new ClassFile("class file #" + i++, bytes));
        }
        return build(files);
    }

    /**
     * Loads classes from streams; the streams are read fully but not closed.
     */
    public Program loadStreams(Collection<? extends InputStream> streams) throws IOException {
        List<byte[]> contents = new ArrayList<>();
        for (InputStream in : streams) {
            contents.add(in.readAllBytes());
        }
        return loadClassFiles(contents);
    }

    private void collect(Path path, List<ClassFile> classFiles) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("No such file or directory: " + path);
        }
        if (Files.isDirectory(path)) {
            Path mavenClasses = path.resolve("target").resolve("classes");
            if (Files.exists(path.resolve("pom.xml")) && Files.isDirectory(mavenClasses)) {
                logger.debug("Using Maven output directory {}", mavenClasses);
                collectDirectory(mavenClasses, classFiles);
            } else {
                collectDirectory(path, classFiles);
            }
        } else if (path.toString().endsWith(".jar")) {
            collectJar(path, classFiles);
        } else if (path.toString().endsWith(".class")) {
            classFiles.add(new ClassFile(path.toString(), Files.readAllBytes(path)));
        } else {
            throw new IOException("Not a class directory, JAR or class file: " + path);
        }
    }

    private void collectDirectory(Path directory, List<ClassFile> classFiles) throws IOException {
        int before = classFiles.size();
        Files.walkFileTree(directory, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                if (file.toString().endsWith(".class")) {
                    classFiles.add(new ClassFile(directory.relativize(file).toString(), Files.readAllBytes(file)));
                }
                return FileVisitResult.CONTINUE;
            }
        });
        logger.debug("Read {} class files from {}", classFiles.size() - before, directory);
    }

    private void collectJar(Path jarPath, List<ClassFile> classFiles) throws IOException {
        int before = classFiles.size();
        try (JarFile jarFile = new JarFile(jarPath.toFile())) {
            jarsLoaded++;
            Enumeration<JarEntry> entries = jarFile.entries();
            while (entries.hasMoreElements()) {
                JarEntry entry = entries.nextElement();
                String name = entry.getName();
                if (name.endsWith(".class") && !name.startsWith("META-INF/")) {
                    try (InputStream is = jarFile.getInputStream(entry)) {
                        classFiles.add(new ClassFile(jarPath.getFileName() + "!/" + name, is.readAllBytes()));
                    }
                }
            }
        }
        logger.debug("Read {} class files from {}", classFiles.size() - before, jarPath);
    }

    private Program build(List<ClassFile> classFiles) {
        Program.Builder program = Program.builder();

        List<ClassReader> readers = new ArrayList<>();
        for (ClassFile classFile : classFiles) {
            try {
                ClassReader reader = new ClassReader(classFile.bytes());
                String className = DescriptorParser.toFqn(reader.getClassName());
                if (!config.shouldLoadClass(className)) {
                    continue;
                }
                // Frames and debug info are not needed to rebuild expressions
                reader.accept(new DeclarationScanner(program), ClassReader.SKIP_CODE | ClassReader.SKIP_DEBUG);
                readers.add(reader);
            } catch (RuntimeException e) {
                classesSkipped++;
                logger.warn("Skipping unreadable class {}: {}", classFile.origin(), e.toString());
            }
        }

        for (ClassReader reader : readers) {
            String className = DescriptorParser.toFqn(reader.getClassName());
            try {
                reader.accept(new BodyScanner(program), ClassReader.SKIP_DEBUG | ClassReader.SKIP_FRAMES);
                classesLoaded++;
            } catch (RuntimeException e) {
                classesSkipped++;
                // A partly rebuilt class would leave truncated bodies behind
                int dropped = program.removeBodies(className);
                logger.warn("Dropping {} method bodies of class {}, keeping its declarations: {}",
                        dropped, className, e.toString());
            }
        }

        logger.info("Loaded {} classes ({} skipped, {} JARs)", classesLoaded, classesSkipped, jarsLoaded);
        return program.build();
    }

    /**
     * Returns the number of classes loaded so far.
     */
    public int getClassesLoaded() {
        return classesLoaded;
    }

    public int getClassesSkipped() {
        return classesSkipped;
    }

    public int getJarsLoaded() {
        return jarsLoaded;
    }
}
