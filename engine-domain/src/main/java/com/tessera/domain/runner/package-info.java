/**
 * Runner 领域 - 驱动编排
 *
 * <p>职责：为每个叶子包绑定一个驱动，驱动其生命周期（load → explore/run/count → stop），
 * 统一包装驱动异常并按驱动顺序汇总结果</p>
 *
 * <h3>核心概念</h3>
 * <ul>
 *   <li>驱动：绑定到单个可加载单元的后端能力</li>
 *   <li>聚合结果：各驱动结果片段按驱动顺序合并</li>
 *   <li>停止：协作式（force=false）与强制式（force=true），由驱动自行实现</li>
 * </ul>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>DirectTestRunner - 直连驱动的 Runner</li>
 *   <li>TestRunnerFactory - Runner 创建服务</li>
 * </ul>
 *
 * @author getoffer
 * @since 2026-03-02
 */
package com.tessera.domain.runner;
