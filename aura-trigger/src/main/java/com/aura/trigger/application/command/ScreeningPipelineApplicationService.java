package com.aura.trigger.application.command;

import com.aura.domain.screening.adapter.gateway.ILanguageModelGateway;
import com.aura.domain.screening.model.valobj.AnswerEvaluationVO;
import com.aura.domain.screening.model.valobj.ModelOutcome;
import com.aura.domain.screening.model.valobj.ResumeAnalysisVO;
import com.aura.domain.screening.service.ModelInvocationPolicyDomainService;
import com.aura.domain.screening.service.ModelInvocationPolicyDomainService.InvocationResult;
import com.aura.domain.screening.service.ScreeningPromptDomainService;
import com.aura.domain.screening.service.StructuredResultDomainService;
import com.aura.domain.screening.service.StructuredResultDomainService.EvaluationExtraction;
import com.aura.domain.screening.service.StructuredResultDomainService.QuestionsExtraction;
import com.aura.domain.screening.service.TextSanitizerDomainService;
import com.aura.types.enums.PipelineStageEnum;
import com.aura.types.enums.ResponseCode;
import com.aura.types.exception.AppException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 模型流水线用例：按环节串联 提示词构建 -> 两级调用 -> 清洗 -> 解析 -> 兜底。
 * <p>
 * 简历分析没有兜底，失败时抛出分类后的 AppException；
 * 面试出题与回答评估仅在两级提示词均被拒绝或结果无法解析时返回固定兜底内容，并记录 WARN 日志与 fallback 计数；
 * 上游异常与空输出同样抛出 UPSTREAM_FAILURE，会话保持不变，调用方可重试。
 * </p>
 */
@Slf4j
@Service
public class ScreeningPipelineApplicationService {

    private static final String INVOCATION_COUNTER = "aura.model.invocation.total";
    private static final String FALLBACK_COUNTER = "aura.pipeline.fallback.total";
    private static final int LOG_PREVIEW_LENGTH = 500;

    private final ILanguageModelGateway languageModelGateway;
    private final ScreeningPromptDomainService screeningPromptDomainService;
    private final ModelInvocationPolicyDomainService modelInvocationPolicyDomainService;
    private final StructuredResultDomainService structuredResultDomainService;
    private final TextSanitizerDomainService textSanitizerDomainService;
    private final ObjectMapper objectMapper;

    public ScreeningPipelineApplicationService(ILanguageModelGateway languageModelGateway,
                                               ScreeningPromptDomainService screeningPromptDomainService,
                                               ModelInvocationPolicyDomainService modelInvocationPolicyDomainService,
                                               StructuredResultDomainService structuredResultDomainService,
                                               TextSanitizerDomainService textSanitizerDomainService,
                                               ObjectMapper objectMapper) {
        this.languageModelGateway = languageModelGateway;
        this.screeningPromptDomainService = screeningPromptDomainService;
        this.modelInvocationPolicyDomainService = modelInvocationPolicyDomainService;
        this.structuredResultDomainService = structuredResultDomainService;
        this.textSanitizerDomainService = textSanitizerDomainService;
        this.objectMapper = objectMapper;
    }

    public ResumeAnalysisVO analyzeResume(String resumeText, String jobDescription) {
        InvocationResult result = invoke(PipelineStageEnum.ANALYSIS,
                screeningPromptDomainService.buildAnalysisPrompt(resumeText, jobDescription),
                () -> screeningPromptDomainService.buildAnalysisPromptSimplified(resumeText, jobDescription));
        ModelOutcome outcome = result.outcome();
        if (result.refusedOnAllTiers()) {
            log.warn("Resume analysis refused on all prompt tiers. attempts={}, detail={}",
                    result.attempts(), outcome.getDetail());
            throw new AppException(ResponseCode.UPSTREAM_REFUSED,
                    "Resume analysis blocked by safety filters. Please try a different resume or job description.");
        }
        if (!outcome.isSuccess()) {
            log.warn("Resume analysis failed upstream. status={}, detail={}", outcome.getStatus(), outcome.getDetail());
            throw new AppException(ResponseCode.UPSTREAM_FAILURE,
                    "Resume analysis failed: " + StringUtils.defaultIfBlank(outcome.getDetail(), "no detail"));
        }

        String raw = outcome.getText();
        try {
            ResumeAnalysisVO analysis = structuredResultDomainService.extractAnalysis(raw, jsonParser());
            log.info("Resume analysis completed. candidate={}, overallScore={}, skills={}, simplifiedPrompt={}",
                    StringUtils.defaultIfBlank(analysis.getName(), "Unknown"),
                    analysis.getOverallScore(),
                    analysis.getSkills().size(),
                    result.simplifiedUsed());
            return analysis;
        } catch (AppException ex) {
            log.warn("Resume analysis returned malformed JSON. error={}, rawLength={}, rawPreview={}, cleanedPreview={}",
                    ex.getInfo(),
                    raw.length(),
                    preview(raw),
                    preview(textSanitizerDomainService.sanitize(raw)));
            throw ex;
        }
    }

    public List<String> generateQuestions(String jobDescription, ResumeAnalysisVO analysis) {
        InvocationResult result = invoke(PipelineStageEnum.QUESTIONS,
                screeningPromptDomainService.buildQuestionsPrompt(jobDescription, analysis),
                () -> screeningPromptDomainService.buildQuestionsPromptSimplified(jobDescription, analysis));
        ModelOutcome outcome = result.outcome();
        if (result.refusedOnAllTiers()) {
            recordFallback(PipelineStageEnum.QUESTIONS, reasonOf(outcome), outcome.getDetail());
            return structuredResultDomainService.fallbackQuestions();
        }
        if (!outcome.isSuccess()) {
            throw upstreamFailure(PipelineStageEnum.QUESTIONS, outcome);
        }
        QuestionsExtraction extraction = structuredResultDomainService.extractQuestions(outcome.getText(), jsonParser());
        if (extraction.fallback()) {
            recordFallback(PipelineStageEnum.QUESTIONS, extraction.fallbackReason(), preview(outcome.getText()));
        } else {
            log.info("Interview questions generated. count={}, simplifiedPrompt={}",
                    extraction.questions().size(), result.simplifiedUsed());
        }
        return extraction.questions();
    }

    public AnswerEvaluationVO evaluateAnswer(int questionIndex, String question, String answer) {
        InvocationResult result = invoke(PipelineStageEnum.EVALUATION,
                screeningPromptDomainService.buildEvaluationPrompt(question, answer),
                () -> screeningPromptDomainService.buildEvaluationPromptSimplified(question, answer));
        ModelOutcome outcome = result.outcome();
        if (result.refusedOnAllTiers()) {
            recordFallback(PipelineStageEnum.EVALUATION, reasonOf(outcome), outcome.getDetail());
            return structuredResultDomainService.fallbackEvaluation(questionIndex, question, answer);
        }
        if (!outcome.isSuccess()) {
            throw upstreamFailure(PipelineStageEnum.EVALUATION, outcome);
        }
        EvaluationExtraction extraction = structuredResultDomainService.extractEvaluation(
                questionIndex, question, answer, outcome.getText(), jsonParser());
        if (extraction.fallback()) {
            recordFallback(PipelineStageEnum.EVALUATION, extraction.fallbackReason(), preview(outcome.getText()));
        } else {
            log.info("Answer evaluated. questionIndex={}, score={}", questionIndex, extraction.evaluation().getScore());
        }
        return extraction.evaluation();
    }

    private InvocationResult invoke(PipelineStageEnum stage,
                                    String primaryPrompt,
                                    Supplier<String> simplifiedPrompt) {
        InvocationResult result = modelInvocationPolicyDomainService.invokeWithSimplifiedRetry(
                primaryPrompt, simplifiedPrompt, prompt -> invokeOnce(stage, prompt));
        if (result.simplifiedUsed()) {
            log.info("Primary prompt refused, simplified prompt used. stage={}, firstAttemptDetail={}, finalStatus={}",
                    stage.getCode(), result.firstAttemptDetail(), result.outcome().getStatus());
        }
        return result;
    }

    private ModelOutcome invokeOnce(PipelineStageEnum stage, String prompt) {
        long startedAt = System.currentTimeMillis();
        ModelOutcome outcome = languageModelGateway.invoke(prompt);
        if (outcome == null) {
            outcome = ModelOutcome.upstreamError("Model gateway returned no outcome");
        }
        long costMs = System.currentTimeMillis() - startedAt;
        log.info("MODEL_INVOCATION stage={}, status={}, costMs={}, promptLength={}",
                stage.getCode(), outcome.getStatus(), costMs, StringUtils.length(prompt));
        Counter.builder(INVOCATION_COUNTER)
                .tag("stage", stage.getCode())
                .tag("status", outcome.getStatus().name().toLowerCase(Locale.ROOT))
                .register(Metrics.globalRegistry)
                .increment();
        return outcome;
    }

    private void recordFallback(PipelineStageEnum stage, String reason, String detail) {
        log.warn("PIPELINE_FALLBACK stage={}, reason={}, detail={}", stage.getCode(), reason, detail);
        Counter.builder(FALLBACK_COUNTER)
                .tag("stage", stage.getCode())
                .tag("reason", reason)
                .register(Metrics.globalRegistry)
                .increment();
    }

    private AppException upstreamFailure(PipelineStageEnum stage, ModelOutcome outcome) {
        log.warn("Model invocation failed upstream. stage={}, status={}, detail={}",
                stage.getCode(), outcome.getStatus(), outcome.getDetail());
        return new AppException(ResponseCode.UPSTREAM_FAILURE,
                "Model call failed during " + stage.getCode() + ": "
                        + StringUtils.defaultIfBlank(outcome.getDetail(), "no detail"));
    }

    private String reasonOf(ModelOutcome outcome) {
        return outcome.getStatus().name().toLowerCase(Locale.ROOT);
    }

    private Function<String, Object> jsonParser() {
        return text -> {
            try {
                return objectMapper.readValue(text, Object.class);
            } catch (JsonProcessingException ex) {
                throw new IllegalArgumentException(ex.getOriginalMessage(), ex);
            }
        };
    }

    private String preview(String text) {
        if (text == null || text.length() <= LOG_PREVIEW_LENGTH) {
            return text;
        }
        return text.substring(0, LOG_PREVIEW_LENGTH);
    }
}
