package com.tessera.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Runner 配置属性类。
 * <p>
 * 从配置文件中读取 Runner 相关配置，配置前缀为 engine.runner。
 * </p>
 *
 * @author getoffer
 * @since 2026-03-02
 */
@Data
@ConfigurationProperties(prefix = "engine.runner", ignoreInvalidFields = true)
public class EngineRunnerProperties {

    /** 是否为 Runner 提供共享路径解析注册表，默认 true */
    private Boolean pathResolverEnabled = true;

    /** 隔离上下文名称，默认 default */
    private String isolationName = "default";

    /** 是否运行在非默认隔离边界内，默认 false；为 true 时才会注册路径 */
    private Boolean isolated = false;

    /** 可加载单元的文件扩展名 */
    private List<String> unitFileExtensions = new ArrayList<>(List.of(".jar", ".war", ".dll", ".exe"));

}
