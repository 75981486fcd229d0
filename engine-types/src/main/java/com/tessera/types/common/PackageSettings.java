package com.tessera.types.common;

/**
 * 测试包设置名常量。
 * <p>
 * Runner 在加载叶子包时读取这些设置，其余设置原样透传给驱动。
 * </p>
 *
 * @author getoffer
 * @since 2026-03-02
 */
public class PackageSettings {

    /** 目标框架提示（字符串），透传给驱动解析 */
    public final static String TARGET_FRAMEWORK = "TargetFramework";

    /** 是否跳过不含测试的单元（布尔，默认 false） */
    public final static String SKIP_NON_TEST_UNITS = "SkipNonTestUnits";

    /** 是否需要共享路径解析注册（布尔，默认 false） */
    public final static String REQUIRES_SHARED_PATH_RESOLVER = "RequiresSharedPathResolver";

    /** 非托管库的框架提示前缀 */
    public final static String UNMANAGED_FRAMEWORK_PREFIX = "Unmanaged,";

}
