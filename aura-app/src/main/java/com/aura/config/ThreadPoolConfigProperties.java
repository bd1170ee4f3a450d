package com.aura.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 线程池配置属性类。
 * <p>
 * 配置前缀为 thread.pool.executor.config。该线程池承载模型调用与 PDF 文本抽取，
 * 请求线程同步等待其结果。
 * </p>
 *
 * @author aura
 * @since 2026-02-01
 */
@Data
@ConfigurationProperties(prefix = "thread.pool.executor.config", ignoreInvalidFields = true)
public class ThreadPoolConfigProperties {

    /** 核心线程数，默认8 */
    private Integer corePoolSize = 8;

    /** 最大线程数，默认32 */
    private Integer maxPoolSize = 32;

    /** 空闲线程最大存活时间（秒），默认30L */
    private Long keepAliveTime = 30L;

    /** 阻塞队列最大容量，默认200 */
    private Integer blockQueueSize = 200;

    /** 线程名前缀 */
    private String threadNamePrefix = "aura-worker-";

    /**
     * 拒绝策略，默认AbortPolicy。
     * <ul>
     *   <li>AbortPolicy：丢弃任务并抛出RejectedExecutionException异常</li>
     *   <li>DiscardPolicy：直接丢弃任务，不抛出异常</li>
     *   <li>DiscardOldestPolicy：将最早进入队列的任务删除，之后再尝试加入队列</li>
     *   <li>CallerRunsPolicy：如果任务添加线程池失败，主线程自己执行该任务</li>
     * </ul>
     */
    private String policy = "AbortPolicy";

}
