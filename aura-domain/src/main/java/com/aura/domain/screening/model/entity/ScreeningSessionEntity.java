package com.aura.domain.screening.model.entity;

import com.aura.domain.screening.model.valobj.AnswerEvaluationVO;
import com.aura.domain.screening.model.valobj.FinalResultVO;
import com.aura.domain.screening.model.valobj.ResumeAnalysisVO;
import com.aura.types.enums.ScreeningStageEnum;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 候选人筛选会话实体（聚合根）。
 * <p>
 * 阶段由数据推导而来，不单独存储：
 * 有最终结果为 COMPLETED；有题目且已有回答为 ANSWERING；有题目无回答为 INTERVIEW_STARTED；
 * 有分析结果为 ANALYZED；否则为 CREATED。
 * 所有变更方法都应在 {@link #withLock(Supplier)} 内调用。
 * </p>
 */
@Getter
public class ScreeningSessionEntity {

    private final String sessionId;
    private final String resumeText;
    private final String artifactRef;
    private final String originalFilename;
    private final LocalDateTime createdAt;

    private String jobDescription;
    private ResumeAnalysisVO analysis;
    @Getter(AccessLevel.NONE)
    private List<String> questions = new ArrayList<>();
    @Getter(AccessLevel.NONE)
    private final List<AnswerEvaluationVO> answers = new ArrayList<>();
    private FinalResultVO finalResult;
    private LocalDateTime updatedAt;

    @Getter(AccessLevel.NONE)
    private final ReentrantLock lock = new ReentrantLock();

    public ScreeningSessionEntity(String sessionId,
                                  String resumeText,
                                  String artifactRef,
                                  String originalFilename) {
        if (sessionId == null || sessionId.trim().isEmpty()) {
            throw new IllegalArgumentException("Session ID cannot be empty");
        }
        this.sessionId = sessionId;
        this.resumeText = resumeText == null ? "" : resumeText;
        this.artifactRef = artifactRef;
        this.originalFilename = originalFilename;
        this.createdAt = LocalDateTime.now();
        this.updatedAt = this.createdAt;
    }

    /**
     * 在会话独占锁内执行操作。
     */
    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public ScreeningStageEnum getStage() {
        if (finalResult != null) {
            return ScreeningStageEnum.COMPLETED;
        }
        if (!questions.isEmpty()) {
            return answers.isEmpty() ? ScreeningStageEnum.INTERVIEW_STARTED : ScreeningStageEnum.ANSWERING;
        }
        if (analysis != null) {
            return ScreeningStageEnum.ANALYZED;
        }
        return ScreeningStageEnum.CREATED;
    }

    public List<String> getQuestions() {
        return Collections.unmodifiableList(questions);
    }

    public List<AnswerEvaluationVO> getAnswers() {
        return Collections.unmodifiableList(answers);
    }

    public boolean hasAnalysis() {
        return analysis != null;
    }

    public int getAnsweredCount() {
        return answers.size();
    }

    public boolean isAllAnswered() {
        return !questions.isEmpty() && answers.size() == questions.size();
    }

    public void validateAnalyzable(String jobDescription) {
        if (resumeText.trim().isEmpty()) {
            throw new IllegalStateException("Resume text is empty");
        }
        if (jobDescription == null || jobDescription.trim().isEmpty()) {
            throw new IllegalStateException("Job description is required");
        }
    }

    /**
     * 写入分析结果。可重复调用，后一次覆盖前一次的岗位描述与分析结果。
     */
    public void applyAnalysis(String jobDescription, ResumeAnalysisVO analysis) {
        validateAnalyzable(jobDescription);
        if (analysis == null) {
            throw new IllegalStateException("Analysis cannot be null");
        }
        this.jobDescription = jobDescription;
        this.analysis = analysis.clampScores();
        touch();
    }

    public void validateInterviewStartable() {
        if (analysis == null) {
            throw new IllegalStateException("Must analyze resume first");
        }
    }

    /**
     * 固定题目列表并清空已有回答与最终结果。
     *
     * @return 被丢弃的回答数量
     */
    public int startInterview(List<String> newQuestions) {
        validateInterviewStartable();
        if (newQuestions == null || newQuestions.isEmpty()) {
            throw new IllegalStateException("Interview questions cannot be empty");
        }
        int discarded = answers.size();
        this.questions = new ArrayList<>(newQuestions);
        this.answers.clear();
        this.finalResult = null;
        touch();
        return discarded;
    }

    /**
     * 校验题目下标可作答，并返回题目文本。
     */
    public String resolveAnswerableQuestion(int questionIndex) {
        ScreeningStageEnum stage = getStage();
        if (stage == ScreeningStageEnum.COMPLETED) {
            throw new IllegalStateException("Interview already completed");
        }
        if (!stage.isInterviewInProgress()) {
            throw new IllegalStateException("Interview has not been started");
        }
        if (questionIndex < 0 || questionIndex >= questions.size()) {
            throw new IllegalStateException("Invalid question index: " + questionIndex);
        }
        for (AnswerEvaluationVO answer : answers) {
            if (answer.getQuestionIndex() == questionIndex) {
                throw new IllegalStateException("Question " + questionIndex + " already answered");
            }
        }
        return questions.get(questionIndex);
    }

    /**
     * 追加一条评估。
     *
     * @return 追加后是否已全部作答
     */
    public boolean recordAnswer(AnswerEvaluationVO evaluation) {
        if (evaluation == null) {
            throw new IllegalStateException("Evaluation cannot be null");
        }
        resolveAnswerableQuestion(evaluation.getQuestionIndex());
        answers.add(evaluation.clampScore());
        touch();
        return isAllAnswered();
    }

    public void complete(FinalResultVO result) {
        if (!isAllAnswered()) {
            throw new IllegalStateException("Interview is not fully answered");
        }
        if (finalResult != null) {
            throw new IllegalStateException("Final result already recorded");
        }
        if (result == null) {
            throw new IllegalStateException("Final result cannot be null");
        }
        this.finalResult = result;
        touch();
    }

    public List<Integer> getAnswerScores() {
        List<Integer> scores = new ArrayList<>(answers.size());
        for (AnswerEvaluationVO answer : answers) {
            scores.add(answer.getScore());
        }
        return scores;
    }

    public int getResumeScore() {
        return analysis == null ? 0 : analysis.getOverallScore();
    }

    private void touch() {
        this.updatedAt = LocalDateTime.now();
    }
}
