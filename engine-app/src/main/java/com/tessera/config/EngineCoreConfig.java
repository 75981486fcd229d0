package com.tessera.config;

import com.tessera.domain.pkg.model.valobj.UnitFileTypes;
import com.tessera.domain.runner.adapter.driver.IDriverResolver;
import com.tessera.domain.runner.adapter.resolver.IPathResolverRegistry;
import com.tessera.domain.runner.model.valobj.IsolationContext;
import com.tessera.domain.runner.service.TestRunnerFactory;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 引擎核心配置类。
 * <p>
 * 根据 engine.runner 配置组装隔离上下文、单元文件类型与 Runner 工厂。
 * 关闭 path-resolver-enabled 时 Runner 不会注册或清理任何路径。
 * </p>
 *
 * @author getoffer
 * @since 2026-03-02
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(EngineRunnerProperties.class)
public class EngineCoreConfig {

    @Bean
    public IsolationContext isolationContext(EngineRunnerProperties properties) {
        String name = StringUtils.defaultIfBlank(properties.getIsolationName(), IsolationContext.DEFAULT.getName());
        return new IsolationContext(name, Boolean.TRUE.equals(properties.getIsolated()));
    }

    @Bean
    public UnitFileTypes unitFileTypes(EngineRunnerProperties properties) {
        if (properties.getUnitFileExtensions() == null || properties.getUnitFileExtensions().isEmpty()) {
            return UnitFileTypes.DEFAULT;
        }
        return new UnitFileTypes(properties.getUnitFileExtensions());
    }

    @Bean
    public TestRunnerFactory testRunnerFactory(EngineRunnerProperties properties,
                                               IDriverResolver driverResolver,
                                               IPathResolverRegistry pathResolverRegistry,
                                               IsolationContext isolationContext,
                                               UnitFileTypes unitFileTypes) {
        boolean pathResolverEnabled = !Boolean.FALSE.equals(properties.getPathResolverEnabled());
        log.info("Test runner factory configured. isolation={}, isolated={}, pathResolverEnabled={}, unitFileTypes={}",
                isolationContext.getName(), isolationContext.isIsolated(), pathResolverEnabled, unitFileTypes);
        return new TestRunnerFactory(driverResolver,
                pathResolverEnabled ? pathResolverRegistry : null,
                isolationContext,
                unitFileTypes);
    }

}
