package com.tessera.infrastructure.driver;

/**
 * 跳过的单元驱动：单元不含测试且包设置要求跳过此类单元。
 */
public class SkippedUnitDriver extends NotRunnableDriver {

    public SkippedUnitDriver(String testFile) {
        super(testFile, "Skipping non-test unit", "Runnable", "Skipped", "NoTests");
    }
}
