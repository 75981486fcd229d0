package com.tessera.domain.runner.adapter.driver;

import com.tessera.domain.runner.adapter.listener.ITestEventListener;

import java.util.Map;

/**
 * 测试框架驱动接口。
 * <p>
 * 每个实例在生命周期内只绑定一个可加载单元。结果均为文本片段，Runner 不解析其内容。
 * 停止请求可能从执行 run 以外的线程发出，实现需要异步响应；没有进行中的执行时应忽略。
 * </p>
 *
 * @author getoffer
 * @since 2026-03-02
 */
public interface IFrameworkDriver {

    /**
     * 获取驱动 ID（即所绑定叶子包的 ID）。
     */
    String getId();

    /**
     * 设置驱动 ID，由 Runner 在加载时分配。
     */
    void setId(String id);

    /**
     * 加载测试单元。
     *
     * @param testFile 单元路径
     * @param settings 叶子包设置
     * @return 加载结果片段
     */
    String load(String testFile, Map<String, Object> settings);

    /**
     * 探索测试。
     *
     * @param filter 过滤表达式文本
     * @return 探索结果片段
     */
    String explore(String filter);

    /**
     * 统计匹配过滤条件的测试用例数。
     */
    int countTestCases(String filter);

    /**
     * 执行测试，执行过程中的事件发送给 listener。
     *
     * @param listener 事件监听器
     * @param filter 过滤表达式文本
     * @return 执行结果片段
     */
    String run(ITestEventListener listener, String filter);

    /**
     * 停止执行。
     *
     * @param force true 为强制停止，false 为协作式停止
     */
    void stopRun(boolean force);
}
