package com.tessera.domain.runner.adapter.listener;

/**
 * 测试事件监听器，由驱动在执行期间通知；Runner 只透传，不解析也不缓冲。
 *
 * @author getoffer
 * @since 2026-03-02
 */
public interface ITestEventListener {

    void onTestEvent(String report);
}
