package com.tessera.domain.runner.service;

import com.tessera.domain.runner.adapter.listener.ITestEventListener;
import com.tessera.domain.runner.model.valobj.EngineResult;
import com.tessera.domain.runner.model.valobj.TestFilter;

/**
 * 测试 Runner 接口。
 * <p>
 * 除 load 外的操作都会先确保包已加载（惰性、幂等）。状态只能从未加载变为已加载，
 * 重新加载需要新建 Runner。
 * </p>
 *
 * @author getoffer
 * @since 2026-03-02
 */
public interface ITestEngineRunner {

    /**
     * 加载测试包。
     *
     * @return 加载结果，每个叶子包一个片段
     */
    EngineResult load();

    /**
     * 包是否已加载。
     */
    boolean isPackageLoaded();

    /**
     * 最近一次成功加载的结果，未加载时为 null。
     */
    EngineResult getLoadResult();

    /**
     * 探索测试。
     */
    EngineResult explore(TestFilter filter);

    /**
     * 统计测试用例数。
     */
    int countTestCases(TestFilter filter);

    /**
     * 执行测试。
     */
    EngineResult run(ITestEventListener listener, TestFilter filter);

    /**
     * 请求协作式停止；没有进行中的执行时忽略。
     */
    void requestStop();

    /**
     * 强制停止，必要时由驱动终止线程或进程；没有进行中的执行时忽略。
     */
    void forceStop();
}
