package com.tessera.domain.pkg.adapter.codec;

import com.tessera.domain.pkg.model.entity.TestPackageEntity;

/**
 * 测试包文本编解码接口。
 * <p>
 * 编码与解码必须互为往返：id、fullName、settings 以及完整子树（含顺序）保持一致。
 * </p>
 *
 * @author getoffer
 * @since 2026-03-02
 */
public interface IPackageCodec {

    /**
     * 将测试包树编码为文本。
     *
     * @param testPackage 根包
     * @return 编码后的文本
     */
    String write(TestPackageEntity testPackage);

    /**
     * 从文本解析测试包树。
     *
     * @param text 编码后的文本
     * @return 根包
     * @throws com.tessera.types.exception.PackageFormatException 文本格式非法时
     */
    TestPackageEntity read(String text);
}
