package com.tessera.domain.runner.service;

import com.tessera.domain.pkg.model.entity.TestPackageEntity;
import com.tessera.domain.pkg.model.valobj.UnitFileTypes;
import com.tessera.domain.runner.adapter.driver.IDriverResolver;
import com.tessera.domain.runner.adapter.resolver.IPathResolverRegistry;
import com.tessera.domain.runner.model.valobj.IsolationContext;

/**
 * Runner 创建服务：用统一的驱动解析、路径注册表与隔离上下文为测试包创建 Runner。
 *
 * @author getoffer
 * @since 2026-03-02
 */
public class TestRunnerFactory {

    private final IDriverResolver driverResolver;
    private final IPathResolverRegistry pathResolverRegistry;
    private final IsolationContext isolationContext;
    private final UnitFileTypes unitFileTypes;

    /**
     * 创建 TestRunnerFactory。
     *
     * @param pathResolverRegistry 共享路径解析注册表，可为 null
     */
    public TestRunnerFactory(IDriverResolver driverResolver,
                             IPathResolverRegistry pathResolverRegistry,
                             IsolationContext isolationContext,
                             UnitFileTypes unitFileTypes) {
        this.driverResolver = driverResolver;
        this.pathResolverRegistry = pathResolverRegistry;
        this.isolationContext = isolationContext;
        this.unitFileTypes = unitFileTypes;
    }

    /**
     * 为测试包创建新的 Runner；同一个包重新加载时也应调用此方法。
     */
    public ITestEngineRunner createRunner(TestPackageEntity testPackage) {
        return new DirectTestRunner(testPackage, driverResolver, pathResolverRegistry, isolationContext, unitFileTypes);
    }
}
