package com.aura;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * AURA 简历筛选与模拟面试服务启动类。
 * <p>
 * Application 位于顶层包路径，确保能够扫描到 domain / infrastructure / trigger 各模块中的组件。
 * </p>
 *
 * @author aura
 * @since 2026-02-01
 */
@SpringBootApplication
public class Application {

    /**
     * 应用程序主入口。
     *
     * @param args 命令行参数
     */
    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

}
