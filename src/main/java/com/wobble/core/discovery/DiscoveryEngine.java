package com.wobble.core.discovery;

import com.wobble.core.framework.LoadedTest;
import com.wobble.core.framework.TestFramework;
import com.wobble.core.framework.TestLoadException;
import com.wobble.core.framework.TestSource;
import com.wobble.core.model.CategorySource;
import com.wobble.core.model.ErrorDetail;
import com.wobble.core.model.TestCategory;
import com.wobble.core.model.TestUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Walks the configured search roots and builds the {@link TestUnitRegistry} for a run.
 * <p>
 * Hierarchical (category directory) and flat (tag based) layouts are merged into one mapping; a unit
 * found under several search roots is registered once. Sources that fail to load become synthetic
 * units so that one broken file never hides the rest of the tree. Discovery order is the lexical order
 * of source paths, then declaration order inside a source.
 */
public class DiscoveryEngine {

    private static final Logger log = LoggerFactory.getLogger(DiscoveryEngine.class);

    private final TestFramework framework;

    public DiscoveryEngine(TestFramework framework) {
        this.framework = framework;
    }

    /**
     * Discovers every unit under the request's search roots, ignoring the request's filter.
     *
     * @throws IOException if a search root cannot be walked
     */
    public TestUnitRegistry discover(DiscoveryRequest request) throws IOException {
        Map<String, TestSource> sources = new TreeMap<>();
        for (Path root : request.searchRoots()) {
            for (TestSource source : framework.locate(root, request.pattern())) {
                sources.putIfAbsent(source.relativePath(), source);
            }
        }
        log.debug("Located {} test source(s) matching '{}'", sources.size(), request.pattern());

        TestUnitRegistry.Builder registry = TestUnitRegistry.builder();
        for (TestSource source : sources.values()) {
            Optional<TestCategory> directoryCategory = CategoryResolver.directoryCategory(source.relativeDirectory());
            List<LoadedTest> loaded;
            try {
                loaded = load(source);
            } catch (TestLoadException e) {
                log.warn("Could not load test source {}: {}", source.relativePath(), e.getMessage());
                registry.add(TestUnit.loadFailure(
                        e.getClassName(),
                        source.relativePath(),
                        directoryCategory.orElse(TestCategory.UNCATEGORIZED),
                        directoryCategory.isPresent() ? CategorySource.DIRECTORY : CategorySource.DEFAULT,
                        ErrorDetail.from(e, e.getClassName())));
                continue;
            }

            for (LoadedTest test : loaded) {
                var resolution = CategoryResolver.resolve(test.declaredTags(), source.relativeDirectory());
                if (resolution.source() == CategorySource.TAG && directoryCategory.isPresent()
                        && directoryCategory.get() != resolution.category()) {
                    log.debug("{} is tagged {} but lives under a {} directory; using the tag",
                            test.id(), resolution.category().id(), directoryCategory.get().id());
                }
                TestUnit unit = new TestUnit(
                        test.id(),
                        test.className(),
                        test.methodName(),
                        source.relativePath(),
                        resolution.category(),
                        resolution.source(),
                        test.declaredTags().scope(),
                        test.declaredTags().phase(),
                        test.declaredTags().slow(),
                        test.declaredTags().skipCi(),
                        test.handle(),
                        null);
                if (!registry.add(unit)) {
                    log.debug("Ignoring duplicate unit {}", unit.id());
                }
            }
        }

        TestUnitRegistry result = registry.build();
        log.info("Discovered {} unit(s): {}", result.size(), result.countsByCategory());
        return result;
    }

    private List<LoadedTest> load(TestSource source) throws TestLoadException {
        try {
            return framework.load(source);
        } catch (RuntimeException | LinkageError e) {
            String name = sourceName(source);
            throw new TestLoadException(name, "Could not load " + name + ": " + e, e);
        }
    }

    /** Dotted name of the source without its extension, used when the framework gave no class name. */
    static String sourceName(TestSource source) {
        String path = source.relativePath();
        int dot = path.lastIndexOf('.');
        if (dot > path.lastIndexOf('/')) {
            path = path.substring(0, dot);
        }
        return path.replace('/', '.');
    }

    /**
     * Discovers and applies the request's filter.
     *
     * @throws IOException if a search root cannot be walked
     */
    public List<TestUnit> discoverSelected(DiscoveryRequest request) throws IOException {
        return discover(request).select(request.filter());
    }
}
