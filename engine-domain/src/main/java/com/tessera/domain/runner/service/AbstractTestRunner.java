package com.tessera.domain.runner.service;

import com.tessera.domain.pkg.model.entity.TestPackageEntity;
import com.tessera.domain.runner.adapter.listener.ITestEventListener;
import com.tessera.domain.runner.model.valobj.EngineResult;
import com.tessera.domain.runner.model.valobj.TestFilter;

/**
 * Runner 基类：维护加载状态，并把 run 委托给子类的 runTests。
 */
public abstract class AbstractTestRunner implements ITestEngineRunner {

    private final TestPackageEntity testPackage;

    private volatile EngineResult loadResult;

    protected AbstractTestRunner(TestPackageEntity testPackage) {
        if (testPackage == null) {
            throw new IllegalArgumentException("TestPackage cannot be null");
        }
        this.testPackage = testPackage;
    }

    public TestPackageEntity getTestPackage() {
        return testPackage;
    }

    @Override
    public EngineResult load() {
        loadResult = loadPackage();
        return loadResult;
    }

    @Override
    public boolean isPackageLoaded() {
        return loadResult != null;
    }

    @Override
    public EngineResult getLoadResult() {
        return loadResult;
    }

    @Override
    public EngineResult run(ITestEventListener listener, TestFilter filter) {
        return runTests(listener, filter);
    }

    protected void ensurePackageIsLoaded() {
        if (!isPackageLoaded()) {
            loadResult = loadPackage();
        }
    }

    protected abstract EngineResult loadPackage();

    protected abstract EngineResult runTests(ITestEventListener listener, TestFilter filter);
}
