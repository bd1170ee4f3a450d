package com.aura.trigger.application.query;

import com.aura.api.dto.SessionSummaryDTO;
import com.aura.domain.screening.adapter.repository.IScreeningSessionRepository;
import com.aura.domain.screening.model.entity.ScreeningSessionEntity;
import com.aura.trigger.application.common.ScreeningViewAssembler;
import com.aura.types.enums.ResponseCode;
import com.aura.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

/**
 * 筛选会话读用例。
 */
@Service
public class ScreeningSessionQueryService {

    private final IScreeningSessionRepository screeningSessionRepository;
    private final ScreeningViewAssembler screeningViewAssembler;

    public ScreeningSessionQueryService(IScreeningSessionRepository screeningSessionRepository,
                                        ScreeningViewAssembler screeningViewAssembler) {
        this.screeningSessionRepository = screeningSessionRepository;
        this.screeningViewAssembler = screeningViewAssembler;
    }

    public SessionSummaryDTO getSummary(String sessionId) {
        if (StringUtils.isBlank(sessionId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "sessionId is required");
        }
        ScreeningSessionEntity session = screeningSessionRepository.findById(sessionId);
        if (session == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "Session not found");
        }
        return session.withLock(() -> screeningViewAssembler.toSummaryDTO(session));
    }
}
