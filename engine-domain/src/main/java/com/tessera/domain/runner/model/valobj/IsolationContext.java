package com.tessera.domain.runner.model.valobj;

import lombok.Value;

/**
 * 隔离上下文值对象。
 * <p>
 * 对 Runner 不透明，只用于驱动解析；isolated 为 true 时才会使用共享路径解析注册表。
 * </p>
 */
@Value
public class IsolationContext {

    public static final IsolationContext DEFAULT = new IsolationContext("default", false);

    /**
     * 上下文名称
     */
    String name;

    /**
     * 是否处于非默认的隔离边界内
     */
    boolean isolated;
}
