package com.tessera.test;

import com.tessera.domain.pkg.adapter.codec.IPackageCodec;
import com.tessera.domain.pkg.model.entity.TestPackageEntity;
import com.tessera.domain.pkg.model.valobj.UnitFileTypes;
import com.tessera.domain.pkg.service.TestPackageFactory;
import com.tessera.domain.runner.adapter.driver.IDriverFactory;
import com.tessera.domain.runner.adapter.driver.IFrameworkDriver;
import com.tessera.domain.runner.adapter.listener.ITestEventListener;
import com.tessera.domain.runner.adapter.resolver.IPathResolverRegistry;
import com.tessera.domain.runner.model.valobj.EngineResult;
import com.tessera.domain.runner.model.valobj.IsolationContext;
import com.tessera.domain.runner.model.valobj.TestFilter;
import com.tessera.domain.runner.service.ITestEngineRunner;
import com.tessera.domain.runner.service.TestRunnerFactory;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 引擎上下文测试类。
 * <p>
 * 验证 Spring 上下文装配，并用一个记录型驱动跑通 解码 → 加载 → 统计 → 执行 → 停止。
 * </p>
 *
 * @author getoffer
 * @since 2026-03-02
 */
@Slf4j
@SpringBootTest(properties = "engine.runner.unit-file-extensions=.jar")
public class ApiTest {

    @Autowired
    private TestPackageFactory testPackageFactory;

    @Autowired
    private IPackageCodec packageCodec;

    @Autowired
    private TestRunnerFactory testRunnerFactory;

    @Autowired
    private IPathResolverRegistry pathResolverRegistry;

    @Autowired
    private IsolationContext isolationContext;

    @Autowired
    private UnitFileTypes unitFileTypes;

    @Test
    public void shouldWireEngineComponentsFromConfiguration() {
        Assertions.assertEquals("default", isolationContext.getName());
        Assertions.assertFalse(isolationContext.isIsolated());
        Assertions.assertTrue(unitFileTypes.isUnitFile("/units/a.jar"));
        Assertions.assertFalse(unitFileTypes.isUnitFile("/units/a.dll"));
        Assertions.assertNotNull(pathResolverRegistry);
        log.info("测试完成");
    }

    @Test
    public void shouldRunDecodedPackageEndToEnd() throws IOException {
        Path first = Files.createTempFile("engine-first", ".jar");
        Path second = Files.createTempFile("engine-second", ".jar");
        try {
            TestPackageEntity built = testPackageFactory.createAnonymous(List.of(first.toString(), second.toString()));
            built.addSetting("Workers", 2);
            TestPackageEntity decoded = packageCodec.read(packageCodec.write(built));

            ITestEngineRunner runner = testRunnerFactory.createRunner(decoded);
            List<String> events = new ArrayList<>();
            ITestEventListener listener = events::add;

            Assertions.assertEquals(4, runner.countTestCases(TestFilter.EMPTY));
            EngineResult result = runner.run(listener, TestFilter.EMPTY);
            runner.requestStop();

            Assertions.assertEquals(2, result.size());
            Assertions.assertEquals("<run id=\"" + built.getSubPackages().get(0).getId() + "\"/>", result.getFragments().get(0));
            Assertions.assertEquals(2, events.size());
            Assertions.assertTrue(runner.isPackageLoaded());
            Assertions.assertEquals(2, runner.getLoadResult().size());
        } finally {
            Files.deleteIfExists(first);
            Files.deleteIfExists(second);
        }
    }

    @TestConfiguration
    static class RecordingDriverConfig {

        @Bean
        public IDriverFactory recordingDriverFactory() {
            return new IDriverFactory() {
                @Override
                public boolean isSupported(String testFile, String frameworkHint) {
                    return testFile.endsWith(".jar");
                }

                @Override
                public IFrameworkDriver createDriver(IsolationContext context, String testFile) {
                    return new RecordingDriver();
                }
            };
        }
    }

    static class RecordingDriver implements IFrameworkDriver {

        private String id;

        @Override
        public String getId() {
            return id;
        }

        @Override
        public void setId(String id) {
            this.id = id;
        }

        @Override
        public String load(String testFile, Map<String, Object> settings) {
            return "<load id=\"" + id + "\" workers=\"" + settings.get("Workers") + "\"/>";
        }

        @Override
        public String explore(String filter) {
            return "<explore id=\"" + id + "\"/>";
        }

        @Override
        public int countTestCases(String filter) {
            return 2;
        }

        @Override
        public String run(ITestEventListener listener, String filter) {
            listener.onTestEvent("<test-case id=\"" + id + "-1\"/>");
            return "<run id=\"" + id + "\"/>";
        }

        @Override
        public void stopRun(boolean force) {
            // 执行是同步完成的，没有需要停止的线程
        }
    }
}
