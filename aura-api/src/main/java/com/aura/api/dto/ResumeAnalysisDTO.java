package com.aura.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 简历分析结果 DTO，分数均在 0~100 之间。
 */
@Data
public class ResumeAnalysisDTO {

    private String name;

    private List<String> skills;

    private String experience;

    private String education;

    private List<String> projects;

    private Integer skillMatch;

    private Integer experienceMatch;

    private Integer projectRelevance;

    private Integer educationMatch;

    private Integer overallScore;

    private List<String> strengths;

    private List<String> weaknesses;
}
