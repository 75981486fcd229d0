package com.tessera.domain.pkg.model.valobj;

import org.apache.commons.lang3.StringUtils;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 可加载测试单元的文件类型（按扩展名识别）。
 */
public final class UnitFileTypes {

    public static final UnitFileTypes DEFAULT = new UnitFileTypes(List.of(".jar", ".war", ".dll", ".exe"));

    private final Set<String> extensions;

    public UnitFileTypes(Collection<String> extensions) {
        Set<String> normalized = new LinkedHashSet<>();
        if (extensions != null) {
            for (String extension : extensions) {
                if (StringUtils.isBlank(extension)) {
                    continue;
                }
                String trimmed = extension.trim().toLowerCase(Locale.ROOT);
                normalized.add(trimmed.startsWith(".") ? trimmed : "." + trimmed);
            }
        }
        this.extensions = Collections.unmodifiableSet(normalized);
    }

    public boolean isUnitFile(String path) {
        if (StringUtils.isBlank(path)) {
            return false;
        }
        String lower = path.toLowerCase(Locale.ROOT);
        for (String extension : extensions) {
            if (lower.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    public Set<String> getExtensions() {
        return extensions;
    }

    @Override
    public String toString() {
        return "UnitFileTypes" + extensions;
    }
}
