package com.tessera.infrastructure.resolver;

import com.tessera.domain.runner.adapter.resolver.IPathResolverRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 共享路径解析注册表实现。
 * <p>
 * 以单元文件所在目录为键；同一目录下的多个单元共享一条记录。
 * 进程内所有 Runner 共用一个实例，读写均加锁。
 * </p>
 *
 * @author getoffer
 * @since 2026-03-02
 */
@Slf4j
@Component
public class ProvidedPathsResolverRegistry implements IPathResolverRegistry {

    private final Set<String> paths = new LinkedHashSet<>();

    @Override
    public synchronized void addPathFromFile(String testFile) {
        String directory = directoryOf(testFile);
        if (directory != null && paths.add(directory)) {
            log.debug("Resolver path added. path={}", directory);
        }
    }

    @Override
    public synchronized void removePathFromFile(String testFile) {
        String directory = directoryOf(testFile);
        if (directory != null && paths.remove(directory)) {
            log.debug("Resolver path removed. path={}", directory);
        }
    }

    @Override
    public synchronized boolean containsPathForFile(String testFile) {
        String directory = directoryOf(testFile);
        return directory != null && paths.contains(directory);
    }

    @Override
    public synchronized List<String> getPaths() {
        return new ArrayList<>(paths);
    }

    private String directoryOf(String testFile) {
        if (StringUtils.isBlank(testFile)) {
            return null;
        }
        Path parent = Paths.get(testFile).toAbsolutePath().normalize().getParent();
        return parent == null ? null : parent.toString();
    }
}
