package com.aura.infrastructure.document;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 上传简历的本地存储配置，前缀 aura.storage。
 */
@Data
@ConfigurationProperties(prefix = "aura.storage", ignoreInvalidFields = true)
public class ScreeningStorageProperties {

    /** 存储目录，相对路径基于进程工作目录，默认 data */
    private String directory = "data";

    /** 存储文件名前缀 */
    private String filePrefix = "resume_";

    /** 存储文件扩展名 */
    private String fileSuffix = ".pdf";

}
