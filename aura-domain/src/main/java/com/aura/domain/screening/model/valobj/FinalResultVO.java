package com.aura.domain.screening.model.valobj;

import com.aura.types.enums.RecommendationEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 面试完成后的综合评分结果。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FinalResultVO {

    private int resumeScore;

    /**
     * 各题得分的算术平均。
     */
    private double interviewScore;

    /**
     * 简历分与面试分各占 50%，保留一位小数。
     */
    private double finalScore;

    private RecommendationEnum recommendation;

    private String summary;
}
