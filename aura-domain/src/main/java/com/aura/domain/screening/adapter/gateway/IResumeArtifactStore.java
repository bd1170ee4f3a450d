package com.aura.domain.screening.adapter.gateway;

import java.nio.file.Path;

/**
 * 上传简历文件存储端口。
 */
public interface IResumeArtifactStore {

    /**
     * 保存上传内容。
     *
     * @param content 文件内容
     * @param originalFilename 原始文件名
     * @return 不透明的文件引用
     */
    String store(byte[] content, String originalFilename);

    /**
     * 将引用解析为可读取的本地路径。
     */
    Path resolve(String artifactRef);

    /**
     * 释放引用对应的文件，文件不存在时静默返回。
     */
    void release(String artifactRef);
}
