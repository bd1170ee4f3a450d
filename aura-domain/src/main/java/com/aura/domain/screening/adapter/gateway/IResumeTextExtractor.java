package com.aura.domain.screening.adapter.gateway;

import java.nio.file.Path;

/**
 * 简历文本抽取端口。
 */
public interface IResumeTextExtractor {

    /**
     * 尽力抽取文档文本。
     *
     * @param documentPath 已存储的文档路径
     * @return 抽取出的文本，失败时返回空字符串，从不抛出异常
     */
    String extractText(Path documentPath);
}
