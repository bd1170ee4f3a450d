package com.aura.trigger.application.command;

import com.aura.domain.screening.adapter.gateway.IResumeArtifactStore;
import com.aura.domain.screening.adapter.gateway.IResumeTextExtractor;
import com.aura.domain.screening.adapter.repository.IScreeningSessionRepository;
import com.aura.domain.screening.model.entity.ScreeningSessionEntity;
import com.aura.domain.screening.model.valobj.AnswerEvaluationVO;
import com.aura.domain.screening.model.valobj.FinalResultVO;
import com.aura.domain.screening.model.valobj.ResumeAnalysisVO;
import com.aura.domain.screening.service.ScoringAggregationDomainService;
import com.aura.types.enums.ResponseCode;
import com.aura.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * 筛选会话写用例：上传建会话、简历分析、开始面试、提交回答、删除会话。
 * <p>
 * 分析 / 开始面试 / 提交回答在会话锁内完成"校验 -> 调用模型 -> 提交状态"，
 * 同一会话单写者；失败时不提交任何状态变更。
 * </p>
 */
@Slf4j
@Service
public class ScreeningSessionCommandService {

    private static final String PDF_CONTENT_TYPE = "application/pdf";
    private static final String PDF_EXTENSION = ".pdf";

    private final IScreeningSessionRepository screeningSessionRepository;
    private final IResumeArtifactStore resumeArtifactStore;
    private final IResumeTextExtractor resumeTextExtractor;
    private final ScreeningPipelineApplicationService screeningPipelineApplicationService;
    private final ScoringAggregationDomainService scoringAggregationDomainService;
    private final Executor commonThreadPoolExecutor;
    private final long maxUploadBytes;

    public ScreeningSessionCommandService(IScreeningSessionRepository screeningSessionRepository,
                                          IResumeArtifactStore resumeArtifactStore,
                                          IResumeTextExtractor resumeTextExtractor,
                                          ScreeningPipelineApplicationService screeningPipelineApplicationService,
                                          ScoringAggregationDomainService scoringAggregationDomainService,
                                          @Qualifier("commonThreadPoolExecutor") Executor commonThreadPoolExecutor,
                                          @Value("${aura.upload.max-bytes:8388608}") long maxUploadBytes) {
        this.screeningSessionRepository = screeningSessionRepository;
        this.resumeArtifactStore = resumeArtifactStore;
        this.resumeTextExtractor = resumeTextExtractor;
        this.screeningPipelineApplicationService = screeningPipelineApplicationService;
        this.scoringAggregationDomainService = scoringAggregationDomainService;
        this.commonThreadPoolExecutor = commonThreadPoolExecutor;
        this.maxUploadBytes = maxUploadBytes;
    }

    public ScreeningSessionEntity uploadResume(String originalFilename, String contentType, byte[] content) {
        if (!isPdf(originalFilename, contentType)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Only PDF files are allowed.");
        }
        if (content == null || content.length == 0) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Uploaded file is empty");
        }
        if (content.length > maxUploadBytes) {
            throw new AppException(ResponseCode.PAYLOAD_TOO_LARGE, "File too large.");
        }

        String artifactRef = resumeArtifactStore.store(content, originalFilename);
        String resumeText;
        try {
            Path documentPath = resumeArtifactStore.resolve(artifactRef);
            resumeText = CompletableFuture
                    .supplyAsync(() -> resumeTextExtractor.extractText(documentPath), commonThreadPoolExecutor)
                    .join();
        } catch (CompletionException | RejectedExecutionException | AppException ex) {
            resumeArtifactStore.release(artifactRef);
            Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
            log.error("Failed to extract resume text. artifactRef={}, error={}", artifactRef, cause.getMessage(), cause);
            throw new AppException(ResponseCode.UN_ERROR, "Failed to extract text: " + cause.getMessage(), cause);
        }

        ScreeningSessionEntity session = new ScreeningSessionEntity(
                UUID.randomUUID().toString(), resumeText, artifactRef, originalFilename);
        screeningSessionRepository.save(session);
        log.info("SCREENING_SESSION_CREATED sessionId={}, artifactRef={}, resumeTextLength={}",
                session.getSessionId(), artifactRef, session.getResumeText().length());
        return session;
    }

    public ResumeAnalysisVO analyzeResume(String sessionId, String jobDescription) {
        ScreeningSessionEntity session = requireSession(sessionId);
        return session.withLock(() -> {
            guard(() -> {
                session.validateAnalyzable(jobDescription);
                return null;
            });
            ResumeAnalysisVO analysis = screeningPipelineApplicationService.analyzeResume(
                    session.getResumeText(), jobDescription);
            guard(() -> {
                session.applyAnalysis(jobDescription, analysis);
                return null;
            });
            log.info("SCREENING_SESSION_ANALYZED sessionId={}, overallScore={}, stage={}",
                    sessionId, analysis.getOverallScore(), session.getStage().getCode());
            return analysis;
        });
    }

    public List<String> startInterview(String sessionId) {
        ScreeningSessionEntity session = requireSession(sessionId);
        return session.withLock(() -> {
            guard(() -> {
                session.validateInterviewStartable();
                return null;
            });
            List<String> questions = screeningPipelineApplicationService.generateQuestions(
                    session.getJobDescription(), session.getAnalysis());
            int discarded = guard(() -> session.startInterview(questions));
            if (discarded > 0) {
                log.info("Interview restarted, previous answers discarded. sessionId={}, discardedAnswers={}",
                        sessionId, discarded);
            }
            log.info("SCREENING_INTERVIEW_STARTED sessionId={}, questions={}", sessionId, questions.size());
            return session.getQuestions();
        });
    }

    public AnswerSubmitResult submitAnswer(String sessionId, Integer questionIndex, String answer) {
        if (questionIndex == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Invalid question index");
        }
        if (StringUtils.isBlank(answer)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Answer is required");
        }
        ScreeningSessionEntity session = requireSession(sessionId);
        return session.withLock(() -> {
            String question = guard(() -> session.resolveAnswerableQuestion(questionIndex));
            AnswerEvaluationVO evaluation = screeningPipelineApplicationService.evaluateAnswer(
                    questionIndex, question, answer);
            boolean complete = guard(() -> session.recordAnswer(evaluation));
            FinalResultVO finalResult = null;
            if (complete) {
                finalResult = scoringAggregationDomainService.aggregate(
                        session.getResumeScore(), session.getAnswerScores());
                FinalResultVO result = finalResult;
                guard(() -> {
                    session.complete(result);
                    return null;
                });
                log.info("SCREENING_INTERVIEW_COMPLETED sessionId={}, finalScore={}, recommendation={}",
                        sessionId, finalResult.getFinalScore(), finalResult.getRecommendation().getLabel());
            }
            log.info("SCREENING_ANSWER_RECORDED sessionId={}, questionIndex={}, score={}, fallback={}, progress={}/{}",
                    sessionId, questionIndex, evaluation.getScore(), evaluation.isFallback(),
                    session.getAnsweredCount(), session.getQuestions().size());
            return new AnswerSubmitResult(evaluation, questionIndex, complete, finalResult);
        });
    }

    /**
     * 删除会话并释放简历文件。会话不存在时视为成功。
     *
     * @return 是否确实删除了会话
     */
    public boolean deleteSession(String sessionId) {
        ScreeningSessionEntity removed = screeningSessionRepository.remove(sessionId);
        if (removed == null) {
            log.debug("Screening session already absent. sessionId={}", sessionId);
            return false;
        }
        resumeArtifactStore.release(removed.getArtifactRef());
        log.info("SCREENING_SESSION_DELETED sessionId={}", sessionId);
        return true;
    }

    private ScreeningSessionEntity requireSession(String sessionId) {
        if (StringUtils.isBlank(sessionId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "sessionId is required");
        }
        ScreeningSessionEntity session = screeningSessionRepository.findById(sessionId);
        if (session == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "Session not found");
        }
        return session;
    }

    private <T> T guard(Supplier<T> action) {
        try {
            return action.get();
        } catch (IllegalStateException ex) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, ex.getMessage(), ex);
        }
    }

    private boolean isPdf(String originalFilename, String contentType) {
        if (StringUtils.isNotBlank(contentType)
                && PDF_CONTENT_TYPE.equals(contentType.trim().toLowerCase(Locale.ROOT))) {
            return true;
        }
        return StringUtils.isNotBlank(originalFilename)
                && originalFilename.trim().toLowerCase(Locale.ROOT).endsWith(PDF_EXTENSION);
    }

    public record AnswerSubmitResult(AnswerEvaluationVO evaluation,
                                     int questionIndex,
                                     boolean complete,
                                     FinalResultVO finalResult) {
    }
}
