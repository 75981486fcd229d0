package com.tessera.domain.runner.model.valobj;

import lombok.Value;

/**
 * 测试过滤条件值对象。文本原样透传给每个驱动，Runner 不解析。
 */
@Value
public class TestFilter {

    public static final TestFilter EMPTY = new TestFilter("<filter/>");

    String text;

    public TestFilter(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Filter text cannot be null");
        }
        this.text = text;
    }
}
