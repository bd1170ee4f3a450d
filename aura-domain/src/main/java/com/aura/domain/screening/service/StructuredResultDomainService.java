package com.aura.domain.screening.service;

import com.aura.domain.screening.model.valobj.AnswerEvaluationVO;
import com.aura.domain.screening.model.valobj.ResumeAnalysisVO;
import com.aura.types.common.Constants;
import com.aura.types.enums.ResponseCode;
import com.aura.types.exception.AppException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 结构化结果领域服务：把清洗后的模型输出解析为分析结果、面试题与回答评估，并提供各环节的兜底内容。
 * <p>
 * JSON 解析器由调用方注入（通常包装 Jackson），本服务只负责字段校验、类型纠正与分数钳制。
 * 解析器解析失败时应抛出 RuntimeException。
 * </p>
 */
@Service
public class StructuredResultDomainService {

    public static final String REASON_PARSE_ERROR = "parse_error";
    public static final String REASON_NOT_ARRAY = "not_array";
    public static final String REASON_INSUFFICIENT_QUESTIONS = "insufficient_questions";
    public static final String REASON_NOT_OBJECT = "not_object";
    public static final String REASON_MISSING_FIELDS = "missing_fields";
    public static final String REASON_NON_NUMERIC_SCORE = "non_numeric_score";

    /** 分析结果缺少 overallScore 时采用的默认分 */
    public static final int DEFAULT_OVERALL_SCORE = 75;

    public static final int FALLBACK_SCORE = 70;
    public static final String FALLBACK_FEEDBACK = "Answer accepted. See strengths and improvements.";
    public static final String FALLBACK_STRENGTHS = "Candidate provided a substantive response";
    public static final String FALLBACK_IMPROVEMENTS = "Consider more specific examples";

    // 输出无法解析时的兜底文案，与拒答兜底区分
    public static final String UNPARSEABLE_FEEDBACK = "Answer accepted";
    public static final String UNPARSEABLE_STRENGTHS = "Provided response";
    public static final String UNPARSEABLE_IMPROVEMENTS = "More detail would help";

    private static final List<String> FALLBACK_QUESTIONS = Collections.unmodifiableList(List.of(
            "What is your experience with the technical stack for this role?",
            "Can you describe a challenging project you worked on and how you solved it?",
            "How do you approach learning new technologies in your field?",
            "What are your strengths and how would they contribute to this role?"
    ));

    private final TextSanitizerDomainService textSanitizerDomainService;

    public StructuredResultDomainService(TextSanitizerDomainService textSanitizerDomainService) {
        this.textSanitizerDomainService = textSanitizerDomainService;
    }

    /**
     * 解析简历分析结果。分析环节没有兜底，解析失败直接抛出 MALFORMED_RESPONSE。
     */
    public ResumeAnalysisVO extractAnalysis(String raw, Function<String, Object> parser) {
        String cleaned = textSanitizerDomainService.sanitize(raw);
        Object parsed;
        try {
            parsed = parser.apply(cleaned);
        } catch (RuntimeException ex) {
            throw malformed(ex.getMessage(), cleaned, ex);
        }
        if (!(parsed instanceof Map<?, ?>)) {
            throw malformed("Expected a JSON object", cleaned, null);
        }
        Map<?, ?> payload = (Map<?, ?>) parsed;

        ResumeAnalysisVO analysis = new ResumeAnalysisVO();
        analysis.setName(getText(payload, "name"));
        analysis.setSkills(getTextList(payload, "skills"));
        analysis.setExperience(getText(payload, "experience"));
        analysis.setEducation(getText(payload, "education"));
        analysis.setProjects(getTextList(payload, "projects"));
        analysis.setSkillMatch(getScore(payload, "skillMatch", 0));
        analysis.setExperienceMatch(getScore(payload, "experienceMatch", 0));
        analysis.setProjectRelevance(getScore(payload, "projectRelevance", 0));
        analysis.setEducationMatch(getScore(payload, "educationMatch", 0));
        analysis.setOverallScore(getScore(payload, "overallScore", DEFAULT_OVERALL_SCORE));
        analysis.setStrengths(getTextList(payload, "strengths"));
        analysis.setWeaknesses(getTextList(payload, "weaknesses"));
        return analysis.clampScores();
    }

    public QuestionsExtraction extractQuestions(String raw, Function<String, Object> parser) {
        String cleaned = textSanitizerDomainService.sanitize(raw);
        Object parsed;
        try {
            parsed = parser.apply(cleaned);
        } catch (RuntimeException ex) {
            return QuestionsExtraction.fallback(fallbackQuestions(), REASON_PARSE_ERROR);
        }
        if (!(parsed instanceof List<?>)) {
            return QuestionsExtraction.fallback(fallbackQuestions(), REASON_NOT_ARRAY);
        }
        List<String> questions = new ArrayList<>();
        for (Object item : (List<?>) parsed) {
            if (questions.size() >= Constants.INTERVIEW_QUESTION_COUNT) {
                break;
            }
            if (item instanceof String && !isBlank((String) item)) {
                questions.add(((String) item).trim());
            }
        }
        if (questions.size() < Constants.INTERVIEW_QUESTION_COUNT) {
            return QuestionsExtraction.fallback(fallbackQuestions(), REASON_INSUFFICIENT_QUESTIONS);
        }
        return new QuestionsExtraction(questions, false, null);
    }

    public EvaluationExtraction extractEvaluation(int questionIndex,
                                                  String question,
                                                  String answer,
                                                  String raw,
                                                  Function<String, Object> parser) {
        String cleaned = textSanitizerDomainService.sanitize(raw);
        Object parsed;
        try {
            parsed = parser.apply(cleaned);
        } catch (RuntimeException ex) {
            return EvaluationExtraction.fallback(unparseableEvaluation(questionIndex, question, answer), REASON_PARSE_ERROR);
        }
        if (!(parsed instanceof Map<?, ?>)) {
            return EvaluationExtraction.fallback(unparseableEvaluation(questionIndex, question, answer), REASON_NOT_OBJECT);
        }
        Map<?, ?> payload = (Map<?, ?>) parsed;
        if (payload.get("score") == null || payload.get("feedback") == null) {
            return EvaluationExtraction.fallback(unparseableEvaluation(questionIndex, question, answer), REASON_MISSING_FIELDS);
        }
        Integer score = toInteger(payload.get("score"));
        if (score == null) {
            return EvaluationExtraction.fallback(unparseableEvaluation(questionIndex, question, answer), REASON_NON_NUMERIC_SCORE);
        }

        AnswerEvaluationVO evaluation = new AnswerEvaluationVO();
        evaluation.setQuestionIndex(questionIndex);
        evaluation.setQuestion(question);
        evaluation.setAnswer(answer);
        evaluation.setScore(score);
        evaluation.setFeedback(getText(payload, "feedback"));
        evaluation.setStrengths(getJoinedText(payload, "strengths"));
        evaluation.setImprovements(getJoinedText(payload, "improvements"));
        evaluation.setFallback(false);
        return new EvaluationExtraction(evaluation.clampScore(), false, null);
    }

    public List<String> fallbackQuestions() {
        return new ArrayList<>(FALLBACK_QUESTIONS);
    }

    /**
     * 两级提示词均被拒绝时的兜底评估。
     */
    public AnswerEvaluationVO fallbackEvaluation(int questionIndex, String question, String answer) {
        return buildFallbackEvaluation(questionIndex, question, answer,
                FALLBACK_FEEDBACK, FALLBACK_STRENGTHS, FALLBACK_IMPROVEMENTS);
    }

    /**
     * 模型输出无法解析或缺少必填字段时的兜底评估。
     */
    public AnswerEvaluationVO unparseableEvaluation(int questionIndex, String question, String answer) {
        return buildFallbackEvaluation(questionIndex, question, answer,
                UNPARSEABLE_FEEDBACK, UNPARSEABLE_STRENGTHS, UNPARSEABLE_IMPROVEMENTS);
    }

    private AnswerEvaluationVO buildFallbackEvaluation(int questionIndex, String question, String answer,
                                                       String feedback, String strengths, String improvements) {
        AnswerEvaluationVO evaluation = new AnswerEvaluationVO();
        evaluation.setQuestionIndex(questionIndex);
        evaluation.setQuestion(question);
        evaluation.setAnswer(answer);
        evaluation.setScore(FALLBACK_SCORE);
        evaluation.setFeedback(feedback);
        evaluation.setStrengths(strengths);
        evaluation.setImprovements(improvements);
        evaluation.setFallback(true);
        return evaluation;
    }

    private AppException malformed(String parserError, String cleaned, Throwable cause) {
        String message = "Invalid JSON from language model: " + defaultIfBlank(parserError, "unknown parse error")
                + "; response preview: " + preview(cleaned);
        return new AppException(ResponseCode.MALFORMED_RESPONSE, message, cause);
    }

    private String preview(String text) {
        String value = text == null ? "" : text;
        int limit = Constants.DIAGNOSTIC_PREVIEW_LENGTH;
        return value.length() <= limit ? value : value.substring(0, limit);
    }

    private String getText(Map<?, ?> payload, String key) {
        Object value = payload.get(key);
        if (value == null) {
            return "";
        }
        return String.valueOf(value).trim();
    }

    private String getJoinedText(Map<?, ?> payload, String key) {
        Object value = payload.get(key);
        if (value instanceof List<?>) {
            return String.join(Constants.SPLIT, toTextList((List<?>) value));
        }
        return getText(payload, key);
    }

    private List<String> getTextList(Map<?, ?> payload, String key) {
        Object value = payload.get(key);
        if (value == null) {
            return new ArrayList<>();
        }
        if (value instanceof List<?>) {
            return toTextList((List<?>) value);
        }
        List<String> single = new ArrayList<>();
        String text = String.valueOf(value).trim();
        if (!text.isEmpty()) {
            single.add(text);
        }
        return single;
    }

    private List<String> toTextList(List<?> values) {
        List<String> result = new ArrayList<>();
        for (Object item : values) {
            if (item == null) {
                continue;
            }
            String text = String.valueOf(item).trim();
            if (!text.isEmpty()) {
                result.add(text);
            }
        }
        return result;
    }

    private int getScore(Map<?, ?> payload, String key, int defaultValue) {
        Integer score = toInteger(payload.get(key));
        return score == null ? defaultValue : score;
    }

    private Integer toInteger(Object value) {
        if (value == null || value instanceof Boolean) {
            return null;
        }
        String text = String.valueOf(value).trim();
        if (text.isEmpty()) {
            return null;
        }
        BigDecimal number;
        try {
            number = new BigDecimal(text);
        } catch (NumberFormatException ex) {
            return null;
        }
        BigDecimal rounded = number.setScale(0, RoundingMode.HALF_UP);
        if (rounded.compareTo(BigDecimal.valueOf(Integer.MAX_VALUE)) > 0) {
            return Integer.MAX_VALUE;
        }
        if (rounded.compareTo(BigDecimal.valueOf(Integer.MIN_VALUE)) < 0) {
            return Integer.MIN_VALUE;
        }
        return rounded.intValue();
    }

    private boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private String defaultIfBlank(String value, String defaultValue) {
        return isBlank(value) ? defaultValue : value;
    }

    public record QuestionsExtraction(List<String> questions, boolean fallback, String fallbackReason) {

        static QuestionsExtraction fallback(List<String> questions, String reason) {
            return new QuestionsExtraction(questions, true, reason);
        }
    }

    public record EvaluationExtraction(AnswerEvaluationVO evaluation, boolean fallback, String fallbackReason) {

        static EvaluationExtraction fallback(AnswerEvaluationVO evaluation, String reason) {
            return new EvaluationExtraction(evaluation, true, reason);
        }
    }
}
