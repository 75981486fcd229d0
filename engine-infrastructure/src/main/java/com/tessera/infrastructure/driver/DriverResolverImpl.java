package com.tessera.infrastructure.driver;

import com.tessera.domain.pkg.model.valobj.UnitFileTypes;
import com.tessera.domain.runner.adapter.driver.IDriverFactory;
import com.tessera.domain.runner.adapter.driver.IDriverResolver;
import com.tessera.domain.runner.adapter.driver.IFrameworkDriver;
import com.tessera.domain.runner.model.valobj.IsolationContext;
import com.tessera.types.common.PackageSettings;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 驱动解析实现。
 * <p>
 * 按以下顺序通过静态检查选择驱动：
 * <ul>
 *   <li>文件不存在或不是单元文件类型：无效单元驱动</li>
 *   <li>框架提示为非托管库：无效单元驱动</li>
 *   <li>第一个声明支持该单元的驱动工厂</li>
 *   <li>都不支持：按 skipNonTestUnits 返回跳过驱动或无效单元驱动</li>
 * </ul>
 * </p>
 *
 * @author getoffer
 * @since 2026-03-02
 */
@Slf4j
@Component
public class DriverResolverImpl implements IDriverResolver {

    private final List<IDriverFactory> driverFactories;
    private final UnitFileTypes unitFileTypes;

    @Autowired
    public DriverResolverImpl(ObjectProvider<IDriverFactory> driverFactoryProvider, UnitFileTypes unitFileTypes) {
        this(driverFactoryProvider.orderedStream().collect(Collectors.toList()), unitFileTypes);
    }

    public DriverResolverImpl(List<IDriverFactory> driverFactories, UnitFileTypes unitFileTypes) {
        this.driverFactories = driverFactories == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(driverFactories));
        this.unitFileTypes = unitFileTypes == null ? UnitFileTypes.DEFAULT : unitFileTypes;
    }

    @Override
    public IFrameworkDriver resolve(IsolationContext context,
                                    String testFile,
                                    String frameworkHint,
                                    boolean skipNonTestUnits) {
        if (StringUtils.isBlank(testFile) || !exists(testFile)) {
            return new InvalidUnitDriver(testFile, "File not found: " + testFile);
        }
        if (!unitFileTypes.isUnitFile(testFile)) {
            return new InvalidUnitDriver(testFile, "File type is not supported");
        }
        if (StringUtils.startsWith(frameworkHint, PackageSettings.UNMANAGED_FRAMEWORK_PREFIX)) {
            return new InvalidUnitDriver(testFile, "Unmanaged libraries cannot be tested");
        }

        for (IDriverFactory factory : driverFactories) {
            if (factory.isSupported(testFile, frameworkHint)) {
                log.debug("Driver factory selected. testFile={}, factory={}", testFile, factory.getClass().getSimpleName());
                return factory.createDriver(context, testFile);
            }
        }

        if (skipNonTestUnits) {
            return new SkippedUnitDriver(testFile);
        }
        return new InvalidUnitDriver(testFile, "No suitable tests found in '" + testFile + "'. "
                + "Either the unit contains no tests or a proper test driver has not been found.");
    }

    private boolean exists(String testFile) {
        try {
            return Files.exists(Paths.get(testFile));
        } catch (InvalidPathException ex) {
            log.warn("Invalid test file path. testFile={}, error={}", testFile, ex.getMessage());
            return false;
        }
    }
}
