package com.aura.domain.screening.adapter.repository;

import com.aura.domain.screening.model.entity.ScreeningSessionEntity;

import java.util.List;

/**
 * 筛选会话仓储接口。
 * <p>
 * 仓储独占全部会话对象；只保证结构性操作（插入/删除/查找）的线程安全，
 * 单个会话内部的状态变更由会话自身的锁串行化。
 * </p>
 */
public interface IScreeningSessionRepository {

    ScreeningSessionEntity save(ScreeningSessionEntity entity);

    ScreeningSessionEntity findById(String sessionId);

    /**
     * 移除会话。
     *
     * @return 被移除的会话，不存在时返回 null
     */
    ScreeningSessionEntity remove(String sessionId);

    /**
     * 清空全部会话。
     *
     * @return 被清空的会话
     */
    List<ScreeningSessionEntity> clear();
}
