package com.tessera;

import org.springframework.beans.factory.annotation.Configurable;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 测试引擎核心启动类。
 * <p>
 * 位于顶层包路径，确保能够扫描到所有子模块中的组件（ID 生成器、编解码、驱动解析、路径注册表）。
 * </p>
 *
 * @author getoffer
 * @since 2026-03-02
 */
@SpringBootApplication
@Configurable
public class Application {

    /**
     * 应用程序主入口。
     *
     * @param args 命令行参数
     */
    public static void main(String[] args){
        SpringApplication.run(Application.class, args);
    }

}
