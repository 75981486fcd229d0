package com.tessera.domain.runner.model.valobj;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 聚合结果：各驱动结果片段按驱动顺序排列，调用方把它当作整个包的单一结果。
 */
public class EngineResult {

    private final List<String> fragments = new ArrayList<>();

    public void add(String fragment) {
        if (fragment == null) {
            throw new IllegalArgumentException("Result fragment cannot be null");
        }
        fragments.add(fragment);
    }

    public List<String> getFragments() {
        return Collections.unmodifiableList(fragments);
    }

    public int size() {
        return fragments.size();
    }

    public boolean isEmpty() {
        return fragments.isEmpty();
    }

    @Override
    public String toString() {
        return String.join(System.lineSeparator(), fragments);
    }
}
