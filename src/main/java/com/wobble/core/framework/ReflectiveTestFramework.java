package com.wobble.core.framework;

import com.wobble.core.model.TestHandle;
import com.wobble.core.tags.TagReader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Disabled;
import org.junit.jupiter.api.Test;
import org.opentest4j.TestAbortedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.annotation.Annotation;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Runs compiled test classes that use the JUnit Jupiter annotations, one method at a time, by
 * reflection.
 * <p>
 * Classes are loaded from a classes root (plus optional extra classpath entries) through a dedicated
 * class loader that lives as long as this framework. Supported: {@code @Test}, {@code @BeforeEach},
 * {@code @AfterEach} and {@code @Disabled}. A fresh instance of the test class is created for every
 * test method.
 */
public class ReflectiveTestFramework implements TestFramework {

    private static final Logger log = LoggerFactory.getLogger(ReflectiveTestFramework.class);

    private static final String CLASS_SUFFIX = ".class";

    /** Directories never searched for tests. */
    private static final Set<String> IGNORE_DIRS = Set.of(
            ".git", "META-INF", "node_modules", ".idea", ".gradle", ".mvn"
    );

    private final Path classesRoot;
    private final URLClassLoader classLoader;

    public ReflectiveTestFramework(Path classesRoot, List<Path> extraClasspath) {
        this.classesRoot = classesRoot.toAbsolutePath().normalize();
        List<URL> urls = new ArrayList<>();
        urls.add(toUrl(this.classesRoot));
        for (Path entry : extraClasspath) {
            urls.add(toUrl(entry.toAbsolutePath().normalize()));
        }
        this.classLoader = new URLClassLoader("wobble-tests", urls.toArray(URL[]::new),
                Thread.currentThread().getContextClassLoader());
    }

    public Path classesRoot() {
        return classesRoot;
    }

    @Override
    public List<TestSource> locate(Path searchRoot, String pattern) throws IOException {
        Path root = searchRoot.toAbsolutePath().normalize();
        if (!root.startsWith(classesRoot)) {
            throw new IllegalArgumentException("Search root " + root + " is outside the classes root " + classesRoot);
        }
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + normalizePattern(pattern));

        try (Stream<Path> stream = Files.walk(root)) {
            return stream.filter(Files::isRegularFile)
                    .filter(p -> !shouldIgnore(root, p))
                    .filter(p -> isTopLevelClassFile(p.getFileName().toString()))
                    .filter(p -> matcher.matches(p.getFileName()))
                    .map(p -> new TestSource(p, relativize(p)))
                    .sorted()
                    .toList();
        }
    }

    /**
     * Loads the class behind the source and reads its test methods and tags. Any failure while doing so,
     * including a linkage error raised by a superclass, is reported as a {@link TestLoadException}.
     */
    @Override
    public List<LoadedTest> load(TestSource source) throws TestLoadException {
        String className = toClassName(source.relativePath());
        try {
            return loadClass(source, className);
        } catch (ClassNotFoundException | LinkageError | RuntimeException e) {
            throw new TestLoadException(className, "Could not load " + className + ": " + e, e);
        }
    }

    private List<LoadedTest> loadClass(TestSource source, String className) throws ClassNotFoundException {
        Class<?> testClass = Class.forName(className, true, classLoader);
        Method[] declared = testClass.getDeclaredMethods();

        int modifiers = testClass.getModifiers();
        if (testClass.isInterface() || testClass.isAnnotation() || testClass.isEnum()
                || Modifier.isAbstract(modifiers)) {
            log.debug("Skipping non-instantiable type {}", className);
            return List.of();
        }

        List<Method> beforeEach = lifecycleMethods(testClass, BeforeEach.class);
        List<Method> afterEach = lifecycleMethods(testClass, AfterEach.class);
        Collections.reverse(afterEach);
        String classDisabled = disabledReason(testClass.getAnnotation(Disabled.class));

        List<LoadedTest> tests = new ArrayList<>();
        Arrays.stream(declared)
                .filter(m -> m.isAnnotationPresent(Test.class))
                .filter(m -> !Modifier.isStatic(m.getModifiers()))
                .sorted(Comparator.comparing(Method::getName))
                .forEach(m -> {
                    String disabled = classDisabled != null ? classDisabled
                            : disabledReason(m.getAnnotation(Disabled.class));
                    var handle = new ReflectiveHandle(testClass, m, beforeEach, afterEach, disabled);
                    tests.add(new LoadedTest(className, m.getName(), TagReader.read(testClass, m), handle));
                });
        log.debug("Loaded {} test(s) from {}", tests.size(), source.relativePath());
        return tests;
    }

    @Override
    public NativeOutcome execute(TestHandle handle) {
        if (!(handle instanceof ReflectiveHandle test)) {
            throw new IllegalArgumentException("Not a handle of this framework: " + handle);
        }
        if (test.disabledReason() != null) {
            return NativeOutcome.skipped(test.disabledReason());
        }

        Object instance;
        try {
            Constructor<?> constructor = test.testClass().getDeclaredConstructor();
            constructor.setAccessible(true);
            instance = constructor.newInstance();
        } catch (InvocationTargetException e) {
            return NativeOutcome.error(e.getCause());
        } catch (ReflectiveOperationException | RuntimeException e) {
            return NativeOutcome.error(e);
        }

        Throwable failure = null;
        try {
            for (Method before : test.beforeEach()) {
                invoke(before, instance);
            }
            invoke(test.method(), instance);
        } catch (InvocationTargetException e) {
            failure = e.getCause();
        } catch (ReflectiveOperationException | RuntimeException e) {
            failure = e;
        }

        for (Method after : test.afterEach()) {
            try {
                invoke(after, instance);
            } catch (ReflectiveOperationException | RuntimeException e) {
                Throwable cause = e instanceof InvocationTargetException ite ? ite.getCause() : e;
                if (failure == null) {
                    failure = cause;
                } else {
                    failure.addSuppressed(cause);
                }
            }
        }

        return failure == null ? NativeOutcome.success() : classify(failure);
    }

    @Override
    public void close() {
        try {
            classLoader.close();
        } catch (IOException e) {
            log.warn("Failed to close test class loader: {}", e.getMessage(), e);
        }
    }

    static NativeOutcome classify(Throwable t) {
        if (t instanceof TestAbortedException) {
            return NativeOutcome.skipped(t.getMessage(), t);
        }
        if (t instanceof AssertionError) {
            return NativeOutcome.assertionFailure(t);
        }
        return NativeOutcome.error(t);
    }

    /** Patterns without an extension match class file names, so {@code *Test} works like {@code *Test.class}. */
    static String normalizePattern(String pattern) {
        return pattern.contains(".") ? pattern : pattern + CLASS_SUFFIX;
    }

    private static void invoke(Method method, Object instance) throws ReflectiveOperationException {
        method.setAccessible(true);
        method.invoke(instance);
    }

    private static List<Method> lifecycleMethods(Class<?> testClass, Class<? extends Annotation> annotation) {
        List<Class<?>> hierarchy = new ArrayList<>();
        for (Class<?> c = testClass; c != null && c != Object.class; c = c.getSuperclass()) {
            hierarchy.add(0, c);
        }
        List<Method> methods = new ArrayList<>();
        for (Class<?> c : hierarchy) {
            Arrays.stream(c.getDeclaredMethods())
                    .filter(m -> m.isAnnotationPresent(annotation))
                    .filter(m -> !Modifier.isStatic(m.getModifiers()))
                    .sorted(Comparator.comparing(Method::getName))
                    .forEach(methods::add);
        }
        return methods;
    }

    private static String disabledReason(Disabled disabled) {
        if (disabled == null) return null;
        return disabled.value().isBlank() ? "disabled" : disabled.value();
    }

    private static boolean isTopLevelClassFile(String fileName) {
        return fileName.endsWith(CLASS_SUFFIX) && !fileName.contains("$")
                && !fileName.equals("module-info.class") && !fileName.equals("package-info.class");
    }

    private boolean shouldIgnore(Path root, Path path) {
        for (Path component : root.relativize(path)) {
            if (IGNORE_DIRS.contains(component.toString())) return true;
        }
        return false;
    }

    private String relativize(Path file) {
        return classesRoot.relativize(file.toAbsolutePath().normalize()).toString().replace('\\', '/');
    }

    private static String toClassName(String relativePath) {
        return relativePath.substring(0, relativePath.length() - CLASS_SUFFIX.length()).replace('/', '.');
    }

    private static URL toUrl(Path path) {
        try {
            return path.toUri().toURL();
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException("Invalid classpath entry: " + path, e);
        }
    }
}
