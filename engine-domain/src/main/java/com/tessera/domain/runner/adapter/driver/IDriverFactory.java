package com.tessera.domain.runner.adapter.driver;

import com.tessera.domain.runner.model.valobj.IsolationContext;

/**
 * 驱动工厂接口，每种测试框架一个实现。
 *
 * @author getoffer
 * @since 2026-03-02
 */
public interface IDriverFactory {

    /**
     * 通过静态检查（文件类型、框架提示）判断是否支持该单元。
     *
     * @param testFile 单元路径
     * @param frameworkHint 目标框架提示，可能为 null
     * @return 是否支持
     */
    boolean isSupported(String testFile, String frameworkHint);

    /**
     * 创建绑定到该单元的驱动。
     */
    IFrameworkDriver createDriver(IsolationContext context, String testFile);
}
