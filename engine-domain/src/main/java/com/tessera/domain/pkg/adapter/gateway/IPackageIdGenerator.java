package com.tessera.domain.pkg.adapter.gateway;

/**
 * 测试包 ID 生成器接口。
 * <p>
 * 同一进程内生成的 ID 必须唯一；跨进程不保证唯一。
 * </p>
 *
 * @author getoffer
 * @since 2026-03-02
 */
public interface IPackageIdGenerator {

    /**
     * 生成下一个包 ID。
     *
     * @return 新的包 ID
     */
    String nextId();
}
