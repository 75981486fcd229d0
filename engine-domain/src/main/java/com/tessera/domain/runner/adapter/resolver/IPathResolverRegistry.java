package com.tessera.domain.runner.adapter.resolver;

import java.util.List;

/**
 * 共享路径解析注册表接口。
 * <p>
 * 进程内共享；add/remove 幂等，实现需保证并发安全。
 * </p>
 *
 * @author getoffer
 * @since 2026-03-02
 */
public interface IPathResolverRegistry {

    /**
     * 注册单元文件所在目录，已存在时忽略。
     */
    void addPathFromFile(String testFile);

    /**
     * 移除单元文件所在目录，不存在时忽略。
     */
    void removePathFromFile(String testFile);

    /**
     * 单元文件所在目录是否已注册。
     */
    boolean containsPathForFile(String testFile);

    /**
     * 当前已注册的目录。
     */
    List<String> getPaths();
}
