package com.tessera.types.enums;

import lombok.Getter;

/**
 * 引擎错误码枚举。
 *
 * @author getoffer
 * @since 2026-03-02
 */
@Getter
public enum ResponseCode {

    /** 测试包格式错误 */
    PACKAGE_FORMAT_ERROR("E0101", "测试包格式错误"),

    /** 设置类型不匹配 */
    SETTING_TYPE_MISMATCH("E0102", "设置类型不匹配"),

    /** 驱动操作失败 */
    DRIVER_OPERATION_ERROR("E0201", "驱动操作失败");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
