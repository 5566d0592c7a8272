package com.wobble.dispatch.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class TestLocationResolverTest {

    @TempDir
    Path tempDir;

    @Test
    void repositoryRootIsTheNearestMarker() throws Exception {
        Path project = Files.createDirectories(tempDir.resolve("project"));
        Files.createFile(project.resolve("pom.xml"));
        Path nested = Files.createDirectories(project.resolve("src/test/java"));

        assertEquals(project, TestLocationResolver.detectRepositoryRoot(nested).orElseThrow());
    }

    @Test
    void classesRootInsideCompiledTests() throws Exception {
        Path classes = Files.createDirectories(tempDir.resolve("target/test-classes"));
        Path packageDir = Files.createDirectories(classes.resolve("com/acme"));

        assertEquals(classes, TestLocationResolver.detectClassesRoot(packageDir));
    }

    @Test
    void classesRootBelowProject() throws Exception {
        Path classes = Files.createDirectories(tempDir.resolve("build/classes/java/test"));

        assertEquals(classes, TestLocationResolver.detectClassesRoot(tempDir));
    }

    @Test
    void fallsBackToThePathItself() {
        assertEquals(tempDir.toAbsolutePath().normalize(), TestLocationResolver.detectClassesRoot(tempDir));
    }
}
