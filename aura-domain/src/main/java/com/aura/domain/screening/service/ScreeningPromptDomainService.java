package com.aura.domain.screening.service;

import com.aura.domain.screening.model.valobj.ResumeAnalysisVO;
import com.aura.types.common.Constants;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 筛选提示词领域服务：负责简历分析、面试出题、回答评估三个环节的完整版与精简版提示词。
 * <p>
 * 精简版在完整版被模型拒答后使用：截断输入、措辞中性、不做额外说明。
 * </p>
 */
@Service
public class ScreeningPromptDomainService {

    private static final int ANALYSIS_SIMPLIFIED_INPUT_LIMIT = 500;
    private static final int QUESTIONS_JOB_DESCRIPTION_LIMIT = 1000;
    private static final int QUESTIONS_SIMPLIFIED_JOB_DESCRIPTION_LIMIT = 300;
    private static final int QUESTIONS_TOP_SKILLS = 5;
    private static final int QUESTIONS_SIMPLIFIED_TOP_SKILLS = 3;
    private static final int EVALUATION_SIMPLIFIED_INPUT_LIMIT = 500;
    private static final String EXPERIENCE_NOT_SPECIFIED = "Not specified";

    public String buildAnalysisPrompt(String resumeText, String jobDescription) {
        StringBuilder builder = new StringBuilder();
        builder.append("You are an expert HR AI. Extract structured fields from the resume ")
                .append("and score the candidate against the job description.\n\n");
        builder.append("JOB_DESC:\n").append(defaultString(jobDescription)).append("\n\n");
        builder.append("RESUME:\n").append(defaultString(resumeText)).append("\n\n");
        builder.append("Return ONLY a valid JSON object (no markdown, no extra text, no code blocks) ")
                .append("with these exact keys:\n");
        builder.append("- name: candidate's name (string)\n");
        builder.append("- skills: list of technical skills (array of strings)\n");
        builder.append("- experience: years and type of experience (string)\n");
        builder.append("- education: educational background (string)\n");
        builder.append("- projects: list of key projects (array of strings)\n");
        builder.append("- skillMatch: match score 0-100 (integer)\n");
        builder.append("- experienceMatch: match score 0-100 (integer)\n");
        builder.append("- projectRelevance: match score 0-100 (integer)\n");
        builder.append("- educationMatch: match score 0-100 (integer)\n");
        builder.append("- overallScore: overall score 0-100 (integer)\n");
        builder.append("- strengths: list of strengths (array of strings)\n");
        builder.append("- weaknesses: list of areas to improve (array of strings)\n\n");
        builder.append("Return ONLY the raw JSON, nothing else. No markdown code blocks. ")
                .append("Ensure all array fields are properly closed with brackets.");
        return builder.toString();
    }

    public String buildAnalysisPromptSimplified(String resumeText, String jobDescription) {
        return "Analyze this resume against the job description. Output pure JSON only.\n\n"
                + "Job: " + truncate(jobDescription, ANALYSIS_SIMPLIFIED_INPUT_LIMIT) + "\n"
                + "Resume: " + truncate(resumeText, ANALYSIS_SIMPLIFIED_INPUT_LIMIT) + "\n\n"
                + "Output JSON with: name, skills, experience, education, projects, "
                + "skillMatch (0-100), experienceMatch (0-100), projectRelevance (0-100), "
                + "educationMatch (0-100), overallScore (0-100), strengths, weaknesses";
    }

    public String buildQuestionsPrompt(String jobDescription, ResumeAnalysisVO analysis) {
        int count = Constants.INTERVIEW_QUESTION_COUNT;
        StringBuilder builder = new StringBuilder();
        builder.append("You are an expert HR interviewer. Generate exactly ").append(count)
                .append(" technical interview questions tailored for this role.\n\n");
        builder.append("JOB DESCRIPTION:\n")
                .append(truncate(jobDescription, QUESTIONS_JOB_DESCRIPTION_LIMIT)).append("\n\n");
        builder.append("CANDIDATE PROFILE:\n");
        builder.append("Skills: ").append(topSkills(analysis, QUESTIONS_TOP_SKILLS)).append("\n");
        builder.append("Experience: ").append(experienceOf(analysis)).append("\n\n");
        builder.append("Generate ").append(count)
                .append(" interview questions that test technical skills and problem-solving for this role.\n");
        builder.append("Return ONLY a JSON array of exactly ").append(count)
                .append(" strings. No markdown, no code blocks, no extra text.\n");
        builder.append("Format: [\"question1\", \"question2\", \"question3\", \"question4\"]");
        return builder.toString();
    }

    public String buildQuestionsPromptSimplified(String jobDescription, ResumeAnalysisVO analysis) {
        int count = Constants.INTERVIEW_QUESTION_COUNT;
        return "Write " + count + " interview questions for this role. Output a JSON array of "
                + count + " strings only.\n\n"
                + "Role: " + truncate(jobDescription, QUESTIONS_SIMPLIFIED_JOB_DESCRIPTION_LIMIT) + "\n"
                + "Skills: " + topSkills(analysis, QUESTIONS_SIMPLIFIED_TOP_SKILLS);
    }

    public String buildEvaluationPrompt(String question, String answer) {
        return "Evaluate this interview answer objectively. Provide a score 0-100 and feedback.\n\n"
                + "Question: " + defaultString(question) + "\n"
                + "Answer: " + defaultString(answer) + "\n\n"
                + "Return only valid JSON (no markdown):\n"
                + "{\"score\": 75, \"feedback\": \"feedback text\", "
                + "\"strengths\": \"strengths\", \"improvements\": \"improvements\"}";
    }

    public String buildEvaluationPromptSimplified(String question, String answer) {
        return "Score this answer from 0 to 100. Output JSON only.\n\n"
                + "Question: " + truncate(question, EVALUATION_SIMPLIFIED_INPUT_LIMIT) + "\n"
                + "Answer: " + truncate(answer, EVALUATION_SIMPLIFIED_INPUT_LIMIT) + "\n\n"
                + "Output JSON with: score, feedback, strengths, improvements";
    }

    private String topSkills(ResumeAnalysisVO analysis, int limit) {
        if (analysis == null || analysis.getSkills() == null) {
            return "";
        }
        List<String> skills = new ArrayList<>();
        for (String skill : analysis.getSkills()) {
            if (skills.size() >= limit) {
                break;
            }
            if (!isBlank(skill)) {
                skills.add(skill.trim());
            }
        }
        return String.join(Constants.SPLIT, skills);
    }

    private String experienceOf(ResumeAnalysisVO analysis) {
        if (analysis == null || isBlank(analysis.getExperience())) {
            return EXPERIENCE_NOT_SPECIFIED;
        }
        return analysis.getExperience();
    }

    private String truncate(String value, int limit) {
        String text = defaultString(value);
        return text.length() <= limit ? text : text.substring(0, limit);
    }

    private boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private String defaultString(String value) {
        return value == null ? "" : value;
    }
}
