package com.aura.trigger.application.common;

import com.aura.api.dto.AnswerEvaluationDTO;
import com.aura.api.dto.FinalResultDTO;
import com.aura.api.dto.ResumeAnalysisDTO;
import com.aura.api.dto.SessionSummaryDTO;
import com.aura.domain.screening.model.entity.ScreeningSessionEntity;
import com.aura.domain.screening.model.valobj.AnswerEvaluationVO;
import com.aura.domain.screening.model.valobj.FinalResultVO;
import com.aura.domain.screening.model.valobj.ResumeAnalysisVO;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 筛选视图组装器：领域对象到 API DTO 的映射，列表字段均复制一份返回。
 */
@Component
public class ScreeningViewAssembler {

    public ResumeAnalysisDTO toAnalysisDTO(ResumeAnalysisVO analysis) {
        if (analysis == null) {
            return null;
        }
        ResumeAnalysisDTO dto = new ResumeAnalysisDTO();
        dto.setName(analysis.getName());
        dto.setSkills(copy(analysis.getSkills()));
        dto.setExperience(analysis.getExperience());
        dto.setEducation(analysis.getEducation());
        dto.setProjects(copy(analysis.getProjects()));
        dto.setSkillMatch(analysis.getSkillMatch());
        dto.setExperienceMatch(analysis.getExperienceMatch());
        dto.setProjectRelevance(analysis.getProjectRelevance());
        dto.setEducationMatch(analysis.getEducationMatch());
        dto.setOverallScore(analysis.getOverallScore());
        dto.setStrengths(copy(analysis.getStrengths()));
        dto.setWeaknesses(copy(analysis.getWeaknesses()));
        return dto;
    }

    public AnswerEvaluationDTO toEvaluationDTO(AnswerEvaluationVO evaluation) {
        if (evaluation == null) {
            return null;
        }
        AnswerEvaluationDTO dto = new AnswerEvaluationDTO();
        dto.setQuestionIndex(evaluation.getQuestionIndex());
        dto.setQuestion(evaluation.getQuestion());
        dto.setScore(evaluation.getScore());
        dto.setFeedback(evaluation.getFeedback());
        dto.setStrengths(evaluation.getStrengths());
        dto.setImprovements(evaluation.getImprovements());
        dto.setFallback(evaluation.isFallback());
        return dto;
    }

    public FinalResultDTO toFinalResultDTO(FinalResultVO result) {
        if (result == null) {
            return null;
        }
        FinalResultDTO dto = new FinalResultDTO();
        dto.setResumeScore(result.getResumeScore());
        dto.setInterviewScore(result.getInterviewScore());
        dto.setFinalScore(result.getFinalScore());
        dto.setRecommendation(result.getRecommendation());
        dto.setSummary(result.getSummary());
        return dto;
    }

    public SessionSummaryDTO toSummaryDTO(ScreeningSessionEntity session) {
        if (session == null) {
            return null;
        }
        SessionSummaryDTO dto = new SessionSummaryDTO();
        dto.setSessionId(session.getSessionId());
        dto.setStage(session.getStage());
        dto.setHasAnalysis(session.hasAnalysis());
        dto.setInterviewProgress(session.getAnsweredCount());
        dto.setTotalQuestions(session.getQuestions().size());
        dto.setFinalResult(toFinalResultDTO(session.getFinalResult()));
        return dto;
    }

    private List<String> copy(List<String> values) {
        return values == null ? new ArrayList<>() : new ArrayList<>(values);
    }
}
