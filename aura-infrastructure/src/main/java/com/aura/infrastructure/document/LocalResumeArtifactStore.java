package com.aura.infrastructure.document;

import com.aura.domain.screening.adapter.gateway.IResumeArtifactStore;
import com.aura.types.enums.ResponseCode;
import com.aura.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;

/**
 * 本地目录简历存储。
 * <p>
 * 文件名为 {前缀}{uuid}{扩展名}，引用即文件名；解析引用时拒绝越出存储目录的路径。
 * </p>
 */
@Slf4j
@Component
@EnableConfigurationProperties(ScreeningStorageProperties.class)
public class LocalResumeArtifactStore implements IResumeArtifactStore {

    private final Path root;
    private final ScreeningStorageProperties properties;

    public LocalResumeArtifactStore(ScreeningStorageProperties properties) {
        this.properties = properties;
        this.root = Paths.get(StringUtils.defaultIfBlank(properties.getDirectory(), "data"))
                .toAbsolutePath()
                .normalize();
    }

    @Override
    public String store(byte[] content, String originalFilename) {
        if (content == null || content.length == 0) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Uploaded file is empty");
        }
        String artifactRef = properties.getFilePrefix() + UUID.randomUUID() + properties.getFileSuffix();
        Path target = root.resolve(artifactRef);
        try {
            Files.createDirectories(root);
            Files.write(target, content);
        } catch (IOException ex) {
            log.error("Failed to store resume artifact. target={}, originalFilename={}", target, originalFilename, ex);
            throw new AppException(ResponseCode.UN_ERROR, "Failed to store uploaded file", ex);
        }
        log.info("Resume artifact stored. artifactRef={}, originalFilename={}, bytes={}",
                artifactRef, originalFilename, content.length);
        return artifactRef;
    }

    @Override
    public Path resolve(String artifactRef) {
        if (StringUtils.isBlank(artifactRef)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Artifact reference is empty");
        }
        Path resolved = root.resolve(artifactRef).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Invalid artifact reference: " + artifactRef);
        }
        return resolved;
    }

    @Override
    public void release(String artifactRef) {
        if (StringUtils.isBlank(artifactRef)) {
            return;
        }
        try {
            boolean deleted = Files.deleteIfExists(resolve(artifactRef));
            log.info("Resume artifact released. artifactRef={}, deleted={}", artifactRef, deleted);
        } catch (IOException | AppException ex) {
            log.warn("Failed to release resume artifact. artifactRef={}, error={}", artifactRef, ex.getMessage());
        }
    }

    public Path getRoot() {
        return root;
    }
}
