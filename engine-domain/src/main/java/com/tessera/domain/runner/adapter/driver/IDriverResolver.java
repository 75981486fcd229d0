package com.tessera.domain.runner.adapter.driver;

import com.tessera.domain.runner.model.valobj.IsolationContext;

/**
 * 驱动解析接口。
 *
 * @author getoffer
 * @since 2026-03-02
 */
public interface IDriverResolver {

    /**
     * 为单元解析驱动。
     *
     * @param context 隔离上下文
     * @param testFile 单元路径
     * @param frameworkHint 目标框架提示，可能为 null
     * @param skipNonTestUnits 找不到合适驱动时是否跳过而不是报错
     * @return 绑定到该单元的驱动
     */
    IFrameworkDriver resolve(IsolationContext context, String testFile, String frameworkHint, boolean skipNonTestUnits);
}
