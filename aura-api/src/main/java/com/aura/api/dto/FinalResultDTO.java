package com.aura.api.dto;

import com.aura.types.enums.RecommendationEnum;
import lombok.Data;

/**
 * 最终评分结果 DTO
 */
@Data
public class FinalResultDTO {

    private Integer resumeScore;

    private Double interviewScore;

    private Double finalScore;

    private RecommendationEnum recommendation;

    private String summary;
}
