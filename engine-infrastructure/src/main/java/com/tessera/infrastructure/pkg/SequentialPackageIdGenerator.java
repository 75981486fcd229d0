package com.tessera.infrastructure.pkg;

import com.tessera.domain.pkg.adapter.gateway.IPackageIdGenerator;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 递增包 ID 生成器，从 0 开始，只在进程启动时重置。
 *
 * @author getoffer
 * @since 2026-03-02
 */
@Component
public class SequentialPackageIdGenerator implements IPackageIdGenerator {

    private final AtomicInteger nextId;

    public SequentialPackageIdGenerator() {
        this(0);
    }

    public SequentialPackageIdGenerator(int start) {
        this.nextId = new AtomicInteger(start);
    }

    @Override
    public String nextId() {
        return String.valueOf(nextId.getAndIncrement());
    }
}
