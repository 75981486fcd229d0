package com.tessera.test;

import com.tessera.domain.pkg.model.valobj.UnitFileTypes;
import com.tessera.domain.runner.adapter.driver.IDriverFactory;
import com.tessera.domain.runner.adapter.driver.IFrameworkDriver;
import com.tessera.domain.runner.model.valobj.IsolationContext;
import com.tessera.infrastructure.driver.DriverResolverImpl;
import com.tessera.infrastructure.driver.InvalidUnitDriver;
import com.tessera.infrastructure.driver.SkippedUnitDriver;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class DriverResolverImplTest {

    @TempDir
    Path tempDir;

    private String jarFile;

    @BeforeEach
    public void setUp() throws IOException {
        jarFile = Files.createFile(tempDir.resolve("tests.jar")).toString();
    }

    @Test
    public void shouldUseFirstSupportingFactory() {
        IFrameworkDriver driver = mock(IFrameworkDriver.class);
        IDriverFactory unsupported = mock(IDriverFactory.class);
        IDriverFactory supported = mock(IDriverFactory.class);
        IDriverFactory later = mock(IDriverFactory.class);
        when(unsupported.isSupported(jarFile, "jvm-17")).thenReturn(false);
        when(supported.isSupported(jarFile, "jvm-17")).thenReturn(true);
        when(supported.createDriver(IsolationContext.DEFAULT, jarFile)).thenReturn(driver);
        DriverResolverImpl resolver = new DriverResolverImpl(List.of(unsupported, supported, later), UnitFileTypes.DEFAULT);

        IFrameworkDriver resolved = resolver.resolve(IsolationContext.DEFAULT, jarFile, "jvm-17", false);

        Assertions.assertSame(driver, resolved);
        verify(later, never()).isSupported(anyString(), any());
    }

    @Test
    public void shouldReturnInvalidDriverWhenFileMissing() {
        DriverResolverImpl resolver = new DriverResolverImpl(Collections.emptyList(), UnitFileTypes.DEFAULT);
        String missing = tempDir.resolve("missing.jar").toString();

        IFrameworkDriver resolved = resolver.resolve(IsolationContext.DEFAULT, missing, null, true);

        Assertions.assertTrue(resolved instanceof InvalidUnitDriver);
        Assertions.assertEquals("File not found: " + missing, ((InvalidUnitDriver) resolved).getMessage());
    }

    @Test
    public void shouldReturnInvalidDriverWhenPathIsMalformed() {
        DriverResolverImpl resolver = new DriverResolverImpl(Collections.emptyList(), UnitFileTypes.DEFAULT);

        IFrameworkDriver resolved = resolver.resolve(IsolationContext.DEFAULT, "a\u0000.jar", null, false);

        Assertions.assertTrue(resolved instanceof InvalidUnitDriver);
        Assertions.assertEquals("File not found: a\u0000.jar", ((InvalidUnitDriver) resolved).getMessage());
    }

    @Test
    public void shouldReturnInvalidDriverForUnsupportedFileType() throws IOException {
        String textFile = Files.createFile(tempDir.resolve("notes.txt")).toString();
        IDriverFactory factory = mock(IDriverFactory.class);
        when(factory.isSupported(anyString(), any())).thenReturn(true);
        DriverResolverImpl resolver = new DriverResolverImpl(List.of(factory), UnitFileTypes.DEFAULT);

        IFrameworkDriver resolved = resolver.resolve(IsolationContext.DEFAULT, textFile, null, false);

        Assertions.assertTrue(resolved instanceof InvalidUnitDriver);
        Assertions.assertEquals("File type is not supported", ((InvalidUnitDriver) resolved).getMessage());
        verify(factory, never()).createDriver(any(), anyString());
    }

    @Test
    public void shouldRejectUnmanagedFrameworkHint() {
        DriverResolverImpl resolver = new DriverResolverImpl(Collections.emptyList(), UnitFileTypes.DEFAULT);

        IFrameworkDriver resolved = resolver.resolve(IsolationContext.DEFAULT, jarFile, "Unmanaged,Version=1", true);

        Assertions.assertTrue(resolved instanceof InvalidUnitDriver);
        Assertions.assertEquals("Unmanaged libraries cannot be tested", ((InvalidUnitDriver) resolved).getMessage());
    }

    @Test
    public void shouldSkipOrRejectWhenNoFactoryMatches() {
        DriverResolverImpl resolver = new DriverResolverImpl(Collections.emptyList(), UnitFileTypes.DEFAULT);

        Assertions.assertTrue(resolver.resolve(IsolationContext.DEFAULT, jarFile, null, true) instanceof SkippedUnitDriver);
        Assertions.assertTrue(resolver.resolve(IsolationContext.DEFAULT, jarFile, null, false) instanceof InvalidUnitDriver);
    }

    @Test
    public void shouldDescribeNotRunnableUnitInResultFragments() {
        DriverResolverImpl resolver = new DriverResolverImpl(Collections.emptyList(), UnitFileTypes.DEFAULT);
        IFrameworkDriver skipped = resolver.resolve(IsolationContext.DEFAULT, jarFile, null, true);
        skipped.setId("4");

        String loaded = skipped.load(jarFile, Collections.emptyMap());
        String run = skipped.run(null, "<filter/>");

        Assertions.assertTrue(loaded.startsWith("<test-suite type=\"Unit\" id=\"4-1\" name=\"tests.jar\""));
        Assertions.assertTrue(loaded.contains("runstate=\"Runnable\""));
        Assertions.assertFalse(loaded.contains("result="));
        Assertions.assertTrue(run.contains("result=\"Skipped\""));
        Assertions.assertTrue(run.contains("<message>Skipping non-test unit</message>"));
        Assertions.assertEquals(0, skipped.countTestCases("<filter/>"));
        skipped.stopRun(true);
    }

    @Test
    public void shouldEscapeMessageInInvalidUnitFragment() {
        InvalidUnitDriver driver = new InvalidUnitDriver("/units/a.jar", "Bad <unit> & \"name\"");
        driver.setId("0");

        String explored = driver.explore("<filter/>");

        Assertions.assertTrue(explored.contains("runstate=\"NotRunnable\""));
        Assertions.assertTrue(explored.contains("&lt;unit&gt; &amp; &quot;name&quot;"));
    }
}
