package com.aura.infrastructure.repository.screening;

import com.aura.domain.screening.adapter.gateway.IResumeArtifactStore;
import com.aura.domain.screening.adapter.repository.IScreeningSessionRepository;
import com.aura.domain.screening.model.entity.ScreeningSessionEntity;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 筛选会话内存仓储实现。
 * <p>
 * 会话只存活于进程生命周期内，没有过期策略；进程关闭时清空并释放全部简历文件。
 * </p>
 *
 * @author aura
 * @since 2026-02-01
 */
@Slf4j
@Repository
public class InMemoryScreeningSessionRepository implements IScreeningSessionRepository {

    private final Map<String, ScreeningSessionEntity> sessions = new ConcurrentHashMap<>();
    private final IResumeArtifactStore resumeArtifactStore;

    public InMemoryScreeningSessionRepository(IResumeArtifactStore resumeArtifactStore) {
        this.resumeArtifactStore = resumeArtifactStore;
    }

    @Override
    public ScreeningSessionEntity save(ScreeningSessionEntity entity) {
        if (entity == null) {
            throw new IllegalArgumentException("Session cannot be null");
        }
        sessions.put(entity.getSessionId(), entity);
        return entity;
    }

    @Override
    public ScreeningSessionEntity findById(String sessionId) {
        if (StringUtils.isBlank(sessionId)) {
            return null;
        }
        return sessions.get(sessionId);
    }

    @Override
    public ScreeningSessionEntity remove(String sessionId) {
        if (StringUtils.isBlank(sessionId)) {
            return null;
        }
        return sessions.remove(sessionId);
    }

    @Override
    public List<ScreeningSessionEntity> clear() {
        List<ScreeningSessionEntity> removed = new ArrayList<>();
        for (String sessionId : new ArrayList<>(sessions.keySet())) {
            ScreeningSessionEntity entity = sessions.remove(sessionId);
            if (entity != null) {
                removed.add(entity);
            }
        }
        return removed;
    }

    @PreDestroy
    public void shutdown() {
        List<ScreeningSessionEntity> removed = clear();
        for (ScreeningSessionEntity entity : removed) {
            resumeArtifactStore.release(entity.getArtifactRef());
        }
        log.info("Screening sessions cleared on shutdown. count={}", removed.size());
    }
}
