package com.tessera.types.exception;

import com.tessera.types.enums.ResponseCode;

/**
 * 序列化的测试包格式错误（元素未闭合、出现意外节点等），不可恢复。
 *
 * @author getoffer
 * @since 2026-03-02
 */
public class PackageFormatException extends EngineException {

    private static final long serialVersionUID = -6429513025841957701L;

    public PackageFormatException(String message) {
        super(ResponseCode.PACKAGE_FORMAT_ERROR.getCode(), message);
    }

    public PackageFormatException(String message, Throwable cause) {
        super(ResponseCode.PACKAGE_FORMAT_ERROR.getCode(), message, cause);
    }

}
