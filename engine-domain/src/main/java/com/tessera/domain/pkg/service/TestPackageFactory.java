package com.tessera.domain.pkg.service;

import com.tessera.domain.pkg.adapter.gateway.IPackageIdGenerator;
import com.tessera.domain.pkg.model.entity.TestPackageEntity;
import org.springframework.stereotype.Service;

import java.nio.file.Paths;
import java.util.List;

/**
 * 测试包创建领域服务：负责分配包 ID 与规范化单元路径。
 */
@Service
public class TestPackageFactory {

    private final IPackageIdGenerator idGenerator;

    public TestPackageFactory(IPackageIdGenerator idGenerator) {
        this.idGenerator = idGenerator;
    }

    /**
     * 创建命名包，路径转为绝对路径。
     */
    public TestPackageEntity createNamed(String filePath) {
        String id = idGenerator.nextId();
        String fullName = filePath == null ? null : Paths.get(filePath).toAbsolutePath().normalize().toString();
        return new TestPackageEntity(id, fullName);
    }

    /**
     * 创建匿名包，每个文件对应一个命名子包。
     */
    public TestPackageEntity createAnonymous(List<String> testFiles) {
        TestPackageEntity testPackage = new TestPackageEntity(idGenerator.nextId(), null);
        if (testFiles != null) {
            for (String testFile : testFiles) {
                testPackage.addSubPackage(createNamed(testFile));
            }
        }
        return testPackage;
    }

    /**
     * 创建空包，供程序化组装使用。
     */
    public TestPackageEntity createEmpty() {
        return new TestPackageEntity(idGenerator.nextId(), null);
    }
}
