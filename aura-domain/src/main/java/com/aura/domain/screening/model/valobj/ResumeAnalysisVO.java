package com.aura.domain.screening.model.valobj;

import com.aura.types.common.Constants;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 简历结构化分析结果。
 */
@Data
public class ResumeAnalysisVO {

    /**
     * 候选人姓名。
     */
    private String name;

    /**
     * 技能列表。
     */
    private List<String> skills = new ArrayList<>();

    /**
     * 工作经验概述。
     */
    private String experience;

    /**
     * 教育背景。
     */
    private String education;

    /**
     * 关键项目。
     */
    private List<String> projects = new ArrayList<>();

    private int skillMatch;

    private int experienceMatch;

    private int projectRelevance;

    private int educationMatch;

    /**
     * 综合得分，作为最终评分中的简历分。
     */
    private int overallScore;

    private List<String> strengths = new ArrayList<>();

    private List<String> weaknesses = new ArrayList<>();

    /**
     * 将全部分数钳制到 [0, 100]。
     */
    public ResumeAnalysisVO clampScores() {
        this.skillMatch = clamp(skillMatch);
        this.experienceMatch = clamp(experienceMatch);
        this.projectRelevance = clamp(projectRelevance);
        this.educationMatch = clamp(educationMatch);
        this.overallScore = clamp(overallScore);
        return this;
    }

    public static int clamp(int score) {
        return Math.max(Constants.MIN_SCORE, Math.min(Constants.MAX_SCORE, score));
    }
}
