package com.tessera.types.enums;

import lombok.Getter;

/**
 * 驱动调用阶段枚举
 *
 * @author getoffer
 * @since 2026-03-02
 */
@Getter
public enum DriverStageEnum {

    /**
     * 加载测试单元
     */
    LOAD("load", "loading tests"),

    /**
     * 探索测试
     */
    EXPLORE("explore", "exploring tests"),

    /**
     * 统计测试用例
     */
    COUNT("count", "counting test cases"),

    /**
     * 执行测试
     */
    RUN("run", "running tests"),

    /**
     * 停止执行
     */
    STOP("stop", "stopping the run");

    private final String code;

    private final String activity;

    DriverStageEnum(String code, String activity) {
        this.code = code;
        this.activity = activity;
    }
}
