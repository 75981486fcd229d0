package com.tessera.types.exception;

import com.tessera.types.enums.ResponseCode;
import lombok.Getter;

/**
 * 包设置的存储值类型与读取方请求的类型不兼容。
 *
 * @author getoffer
 * @since 2026-03-02
 */
@Getter
public class SettingTypeMismatchException extends EngineException {

    private static final long serialVersionUID = 4410728563310952236L;

    /** 设置名 */
    private final String settingName;

    /** 请求的类型 */
    private final Class<?> requestedType;

    /** 实际存储的类型 */
    private final Class<?> actualType;

    public SettingTypeMismatchException(String settingName, Class<?> requestedType, Class<?> actualType) {
        this(settingName, requestedType, actualType, null);
    }

    public SettingTypeMismatchException(String settingName, Class<?> requestedType, Class<?> actualType,
                                        Throwable cause) {
        super(ResponseCode.SETTING_TYPE_MISMATCH.getCode(),
                "Setting '" + settingName + "' holds a " + actualType.getName()
                        + " which cannot be read as " + requestedType.getName(), cause);
        this.settingName = settingName;
        this.requestedType = requestedType;
        this.actualType = actualType;
    }

}
