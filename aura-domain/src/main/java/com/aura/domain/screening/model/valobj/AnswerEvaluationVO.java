package com.aura.domain.screening.model.valobj;

import lombok.Data;

/**
 * 单题回答评估。
 */
@Data
public class AnswerEvaluationVO {

    /**
     * 对应题目下标。
     */
    private int questionIndex;

    private String question;

    private String answer;

    /**
     * 0~100。
     */
    private int score;

    private String feedback;

    private String strengths;

    private String improvements;

    /**
     * 是否使用了固定兜底评估。
     */
    private boolean fallback;

    public AnswerEvaluationVO clampScore() {
        this.score = ResumeAnalysisVO.clamp(score);
        return this;
    }
}
