package com.aura.test.domain;

import com.aura.domain.screening.model.valobj.ResumeAnalysisVO;
import com.aura.domain.screening.service.ScreeningPromptDomainService;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class ScreeningPromptDomainServiceTest {

    private final ScreeningPromptDomainService service = new ScreeningPromptDomainService();

    @Test
    public void shouldEmbedFullInputsInAnalysisPrompt() {
        String resume = "r".repeat(800);
        String prompt = service.buildAnalysisPrompt(resume, "Senior Java Engineer");

        Assertions.assertTrue(prompt.contains("JOB_DESC:\nSenior Java Engineer"));
        Assertions.assertTrue(prompt.contains(resume));
        Assertions.assertTrue(prompt.contains("overallScore"));
        Assertions.assertTrue(prompt.contains("weaknesses"));
    }

    @Test
    public void shouldTruncateInputsInSimplifiedAnalysisPrompt() {
        String prompt = service.buildAnalysisPromptSimplified("r".repeat(800), "j".repeat(800));

        Assertions.assertTrue(prompt.contains("r".repeat(500)));
        Assertions.assertFalse(prompt.contains("r".repeat(501)));
        Assertions.assertTrue(prompt.contains("j".repeat(500)));
        Assertions.assertFalse(prompt.contains("j".repeat(501)));
    }

    @Test
    public void shouldUseTopFiveSkillsAndDefaultExperienceInQuestionsPrompt() {
        ResumeAnalysisVO analysis = new ResumeAnalysisVO();
        analysis.setSkills(List.of("Java", "Spring", "Kafka", "Redis", "SQL", "Docker"));
        analysis.setExperience(" ");

        String prompt = service.buildQuestionsPrompt("d".repeat(1200), analysis);

        Assertions.assertTrue(prompt.contains("Skills: Java, Spring, Kafka, Redis, SQL\n"));
        Assertions.assertFalse(prompt.contains("Docker"));
        Assertions.assertTrue(prompt.contains("Experience: Not specified"));
        Assertions.assertTrue(prompt.contains("d".repeat(1000)));
        Assertions.assertFalse(prompt.contains("d".repeat(1001)));
        Assertions.assertTrue(prompt.contains("exactly 4"));
    }

    @Test
    public void shouldUseTopThreeSkillsInSimplifiedQuestionsPrompt() {
        ResumeAnalysisVO analysis = new ResumeAnalysisVO();
        analysis.setSkills(List.of("Java", "Spring", "Kafka", "Redis"));

        String prompt = service.buildQuestionsPromptSimplified("d".repeat(400), analysis);

        Assertions.assertTrue(prompt.endsWith("Skills: Java, Spring, Kafka"));
        Assertions.assertFalse(prompt.contains("d".repeat(301)));
    }

    @Test
    public void shouldTolerateMissingAnalysisInQuestionsPrompt() {
        String prompt = service.buildQuestionsPrompt(null, null);
        Assertions.assertTrue(prompt.contains("Experience: Not specified"));
    }

    @Test
    public void shouldBuildEvaluationPrompts() {
        String prompt = service.buildEvaluationPrompt("What is a JVM?", "A virtual machine");
        Assertions.assertTrue(prompt.contains("Question: What is a JVM?"));
        Assertions.assertTrue(prompt.contains("Answer: A virtual machine"));
        Assertions.assertTrue(prompt.contains("\"score\""));

        String simplified = service.buildEvaluationPromptSimplified("q".repeat(600), "a".repeat(600));
        Assertions.assertTrue(simplified.contains("a".repeat(500)));
        Assertions.assertFalse(simplified.contains("a".repeat(501)));
    }
}
