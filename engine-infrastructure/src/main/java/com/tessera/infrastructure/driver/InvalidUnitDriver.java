package com.tessera.infrastructure.driver;

/**
 * 无效单元驱动：文件不存在、类型不支持或找不到合适的测试框架。
 */
public class InvalidUnitDriver extends NotRunnableDriver {

    public InvalidUnitDriver(String testFile, String message) {
        super(testFile, message, "NotRunnable", "Failed", "Invalid");
    }
}
