/**
 * Package 领域 - 测试包树
 *
 * <p>职责：测试包的层级结构、设置继承、稳定标识与序列化端口</p>
 *
 * <h3>核心概念</h3>
 * <ul>
 *   <li>叶子包：没有子包且带 fullName，对应唯一一个可加载的测试单元</li>
 *   <li>结构包：含子包的分组节点，本身不绑定驱动</li>
 *   <li>设置传播：只有 addSetting 会向整棵子树传播，直接修改 settings 不传播</li>
 * </ul>
 *
 * <h3>聚合根</h3>
 * <ul>
 *   <li>{@link com.tessera.domain.pkg.model.entity.TestPackageEntity}</li>
 * </ul>
 *
 * @author getoffer
 * @since 2026-03-02
 */
package com.tessera.domain.pkg;
