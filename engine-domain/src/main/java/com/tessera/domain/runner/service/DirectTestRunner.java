package com.tessera.domain.runner.service;

import com.tessera.domain.pkg.model.entity.TestPackageEntity;
import com.tessera.domain.pkg.model.valobj.UnitFileTypes;
import com.tessera.domain.runner.adapter.driver.IDriverResolver;
import com.tessera.domain.runner.adapter.driver.IFrameworkDriver;
import com.tessera.domain.runner.adapter.listener.ITestEventListener;
import com.tessera.domain.runner.adapter.resolver.IPathResolverRegistry;
import com.tessera.domain.runner.model.valobj.EngineResult;
import com.tessera.domain.runner.model.valobj.IsolationContext;
import com.tessera.domain.runner.model.valobj.TestFilter;
import com.tessera.types.common.PackageSettings;
import com.tessera.types.enums.DriverStageEnum;
import com.tessera.types.exception.DriverOperationException;
import com.tessera.types.exception.EngineException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

/**
 * 直连驱动的 Runner：每个叶子包绑定一个驱动。
 * <p>
 * 包可以是单个单元、若干单元组成的子包，也可以是任意层级的包树，单元只出现在叶子节点。
 * 所有驱动调用按叶子选择顺序串行执行，任一驱动失败即中止本次调用（不返回部分结果）。
 * 加载完成后驱动列表不再变化，因此 requestStop / forceStop 可以在其他线程与 run 并发调用。
 * </p>
 */
@Slf4j
public class DirectTestRunner extends AbstractTestRunner {

    private static final String DRIVER_FAILURE_METRIC = "engine.driver.failure.total";
    private static final String PACKAGE_LOAD_METRIC = "engine.package.load.total";

    private final IDriverResolver driverResolver;
    private final IPathResolverRegistry pathResolverRegistry;
    private final IsolationContext isolationContext;
    private final UnitFileTypes unitFileTypes;

    private volatile List<IFrameworkDriver> drivers = Collections.emptyList();

    /**
     * @param pathResolverRegistry 共享路径解析注册表，为 null 时不注册也不清理
     */
    public DirectTestRunner(TestPackageEntity testPackage,
                            IDriverResolver driverResolver,
                            IPathResolverRegistry pathResolverRegistry,
                            IsolationContext isolationContext,
                            UnitFileTypes unitFileTypes) {
        super(testPackage);
        if (driverResolver == null) {
            throw new IllegalArgumentException("DriverResolver cannot be null");
        }
        this.driverResolver = driverResolver;
        this.pathResolverRegistry = pathResolverRegistry;
        this.isolationContext = isolationContext == null ? IsolationContext.DEFAULT : isolationContext;
        this.unitFileTypes = unitFileTypes == null ? UnitFileTypes.DEFAULT : unitFileTypes;
    }

    /**
     * 当前绑定的驱动，顺序与叶子选择顺序一致。
     */
    public List<IFrameworkDriver> getDrivers() {
        return drivers;
    }

    @Override
    protected EngineResult loadPackage() {
        EngineResult result = new EngineResult();
        List<TestPackageEntity> packagesToLoad = getTestPackage().select(TestPackageEntity::isLeaf);
        List<IFrameworkDriver> loaded = new ArrayList<>(packagesToLoad.size());

        for (TestPackageEntity subPackage : packagesToLoad) {
            String testFile = subPackage.getFullName();
            String targetFramework = subPackage.getSetting(PackageSettings.TARGET_FRAMEWORK, (String) null);
            boolean skipNonTestUnits = subPackage.getSetting(PackageSettings.SKIP_NON_TEST_UNITS, false);

            if (pathResolverRegistry != null && isolationContext.isIsolated()
                    && subPackage.getSetting(PackageSettings.REQUIRES_SHARED_PATH_RESOLVER, false)) {
                // add 本身幂等
                pathResolverRegistry.addPathFromFile(testFile);
            }

            IFrameworkDriver driver = driverResolver.resolve(isolationContext, testFile, targetFramework, skipNonTestUnits);
            driver.setId(subPackage.getId());
            log.debug("Driver bound. packageId={}, testFile={}, driver={}",
                    subPackage.getId(), testFile, driver.getClass().getSimpleName());

            String fragment;
            try {
                fragment = driver.load(testFile, subPackage.getSettings());
            } catch (EngineException ex) {
                throw ex;
            } catch (RuntimeException | LinkageError ex) {
                throw wrap(DriverStageEnum.LOAD, driver, ex, result.getFragments());
            }
            result.add(fragment);
            loaded.add(driver);
        }

        drivers = Collections.unmodifiableList(loaded);
        Counter.builder(PACKAGE_LOAD_METRIC).register(Metrics.globalRegistry).increment();
        log.info("Package loaded. packageId={}, drivers={}", getTestPackage().getId(), loaded.size());
        return result;
    }

    @Override
    public EngineResult explore(TestFilter filter) {
        ensurePackageIsLoaded();
        EngineResult result = new EngineResult();
        for (IFrameworkDriver driver : drivers) {
            result.add(invoke(DriverStageEnum.EXPLORE, driver, () -> driver.explore(filter.getText())));
        }
        return result;
    }

    @Override
    public int countTestCases(TestFilter filter) {
        ensurePackageIsLoaded();
        int count = 0;
        for (IFrameworkDriver driver : drivers) {
            count += invoke(DriverStageEnum.COUNT, driver, () -> driver.countTestCases(filter.getText()));
        }
        return count;
    }

    @Override
    protected EngineResult runTests(ITestEventListener listener, TestFilter filter) {
        ensurePackageIsLoaded();
        EngineResult result = new EngineResult();
        for (IFrameworkDriver driver : drivers) {
            result.add(invoke(DriverStageEnum.RUN, driver, () -> driver.run(listener, filter.getText())));
        }

        // 失败中止时不清理，注册的路径保留到进程结束
        if (pathResolverRegistry != null) {
            for (TestPackageEntity unitPackage : getTestPackage().select(p -> p.isUnitPackage(unitFileTypes))) {
                pathResolverRegistry.removePathFromFile(unitPackage.getFullName());
            }
        }
        log.info("Run finished. packageId={}, fragments={}", getTestPackage().getId(), result.size());
        return result;
    }

    @Override
    public void requestStop() {
        stopRun(false);
    }

    @Override
    public void forceStop() {
        stopRun(true);
    }

    private void stopRun(boolean force) {
        ensurePackageIsLoaded();
        for (IFrameworkDriver driver : drivers) {
            invoke(DriverStageEnum.STOP, driver, () -> {
                driver.stopRun(force);
                return null;
            });
        }
    }

    private <T> T invoke(DriverStageEnum stage, IFrameworkDriver driver, Supplier<T> call) {
        try {
            return call.get();
        } catch (EngineException ex) {
            throw ex;
        } catch (RuntimeException | LinkageError ex) {
            throw wrap(stage, driver, ex, Collections.emptyList());
        }
    }

    private DriverOperationException wrap(DriverStageEnum stage,
                                          IFrameworkDriver driver,
                                          Throwable cause,
                                          List<String> partialFragments) {
        Counter.builder(DRIVER_FAILURE_METRIC)
                .tag("stage", stage.getCode())
                .register(Metrics.globalRegistry)
                .increment();
        log.warn("Driver failed. packageId={}, stage={}, error={}",
                driver.getId(), stage.getCode(), cause.getMessage());
        return new DriverOperationException(stage, cause, new ArrayList<>(partialFragments));
    }
}
