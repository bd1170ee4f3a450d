package com.aura.domain.screening.service;

import com.aura.domain.screening.model.valobj.FinalResultVO;
import com.aura.types.enums.RecommendationEnum;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * 综合评分领域服务：简历分与面试平均分各占一半，并给出录用建议。
 * 综合分保留一位小数，恰好居中时向偶数舍入。
 */
@Service
public class ScoringAggregationDomainService {

    private static final BigDecimal WEIGHT = new BigDecimal("0.5");
    private static final double STRONG_YES_INTERVIEW_THRESHOLD = 75D;
    private static final double STRONG_YES_RESUME_THRESHOLD = 80D;
    private static final double YES_INTERVIEW_THRESHOLD = 65D;

    private static final String SUMMARY_TEMPLATE = "Candidate demonstrates strong technical skills with relevant experience. "
            + "Interview responses show %s problem-solving ability and communication skills.";

    public FinalResultVO aggregate(int resumeScore, List<Integer> answerScores) {
        double interviewScore = mean(answerScores);
        double finalScore = BigDecimal.valueOf(resumeScore).multiply(WEIGHT)
                .add(BigDecimal.valueOf(interviewScore).multiply(WEIGHT))
                .setScale(1, RoundingMode.HALF_EVEN)
                .doubleValue();
        RecommendationEnum recommendation = recommend(resumeScore, interviewScore);
        String quality = interviewScore > STRONG_YES_INTERVIEW_THRESHOLD ? "excellent" : "good";
        return new FinalResultVO(resumeScore, interviewScore, finalScore, recommendation,
                String.format(SUMMARY_TEMPLATE, quality));
    }

    public RecommendationEnum recommend(int resumeScore, double interviewScore) {
        if (interviewScore > STRONG_YES_INTERVIEW_THRESHOLD && resumeScore > STRONG_YES_RESUME_THRESHOLD) {
            return RecommendationEnum.STRONG_YES;
        }
        if (interviewScore > YES_INTERVIEW_THRESHOLD) {
            return RecommendationEnum.YES;
        }
        return RecommendationEnum.MAYBE;
    }

    private double mean(List<Integer> scores) {
        if (scores == null || scores.isEmpty()) {
            return 0D;
        }
        long total = 0L;
        int count = 0;
        for (Integer score : scores) {
            if (score == null) {
                continue;
            }
            total += score;
            count++;
        }
        return count == 0 ? 0D : (double) total / count;
    }
}
