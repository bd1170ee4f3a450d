package com.aura.test.domain;

import com.aura.domain.screening.model.entity.ScreeningSessionEntity;
import com.aura.domain.screening.model.valobj.AnswerEvaluationVO;
import com.aura.domain.screening.model.valobj.FinalResultVO;
import com.aura.domain.screening.model.valobj.ResumeAnalysisVO;
import com.aura.types.enums.RecommendationEnum;
import com.aura.types.enums.ScreeningStageEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class ScreeningSessionEntityTest {

    private static final List<String> QUESTIONS = List.of("q0", "q1", "q2", "q3");

    @Test
    public void shouldAdvanceStageThroughLifecycle() {
        ScreeningSessionEntity session = newSession("resume text");
        Assertions.assertEquals(ScreeningStageEnum.CREATED, session.getStage());

        session.applyAnalysis("Backend engineer", analysis(82));
        Assertions.assertEquals(ScreeningStageEnum.ANALYZED, session.getStage());
        Assertions.assertTrue(session.hasAnalysis());

        Assertions.assertEquals(0, session.startInterview(QUESTIONS));
        Assertions.assertEquals(ScreeningStageEnum.INTERVIEW_STARTED, session.getStage());

        for (int i = 0; i < 3; i++) {
            Assertions.assertFalse(session.recordAnswer(evaluation(i, 70)));
            Assertions.assertEquals(ScreeningStageEnum.ANSWERING, session.getStage());
        }
        Assertions.assertTrue(session.recordAnswer(evaluation(3, 90)));
        Assertions.assertTrue(session.isAllAnswered());

        session.complete(new FinalResultVO(82, 75D, 78.5D, RecommendationEnum.YES, "summary"));
        Assertions.assertEquals(ScreeningStageEnum.COMPLETED, session.getStage());
        Assertions.assertEquals(List.of(70, 70, 70, 90), session.getAnswerScores());
        Assertions.assertEquals(82, session.getResumeScore());
    }

    @Test
    public void shouldRejectAnalysisForEmptyResumeOrJobDescription() {
        ScreeningSessionEntity empty = newSession("   ");
        IllegalStateException emptyResume = Assertions.assertThrows(IllegalStateException.class,
                () -> empty.validateAnalyzable("JD"));
        Assertions.assertEquals("Resume text is empty", emptyResume.getMessage());

        ScreeningSessionEntity session = newSession("resume");
        Assertions.assertThrows(IllegalStateException.class, () -> session.applyAnalysis(" ", analysis(50)));
        Assertions.assertFalse(session.hasAnalysis());
    }

    @Test
    public void shouldClampAnalysisScoresOnApply() {
        ScreeningSessionEntity session = newSession("resume");
        ResumeAnalysisVO analysis = analysis(130);
        analysis.setSkillMatch(-10);

        session.applyAnalysis("JD", analysis);

        Assertions.assertEquals(100, session.getAnalysis().getOverallScore());
        Assertions.assertEquals(0, session.getAnalysis().getSkillMatch());
    }

    @Test
    public void shouldRequireAnalysisBeforeInterview() {
        ScreeningSessionEntity session = newSession("resume");
        IllegalStateException ex = Assertions.assertThrows(IllegalStateException.class,
                () -> session.startInterview(QUESTIONS));
        Assertions.assertEquals("Must analyze resume first", ex.getMessage());
        Assertions.assertTrue(session.getQuestions().isEmpty());
    }

    @Test
    public void shouldRejectAnswerBeforeInterviewStarted() {
        ScreeningSessionEntity session = newSession("resume");
        session.applyAnalysis("JD", analysis(70));

        Assertions.assertThrows(IllegalStateException.class, () -> session.resolveAnswerableQuestion(0));
        Assertions.assertThrows(IllegalStateException.class, () -> session.recordAnswer(evaluation(0, 80)));
        Assertions.assertEquals(0, session.getAnsweredCount());
        Assertions.assertEquals(ScreeningStageEnum.ANALYZED, session.getStage());
    }

    @Test
    public void shouldRejectOutOfRangeAndDuplicateIndex() {
        ScreeningSessionEntity session = startedSession();

        Assertions.assertThrows(IllegalStateException.class, () -> session.resolveAnswerableQuestion(-1));
        Assertions.assertThrows(IllegalStateException.class, () -> session.resolveAnswerableQuestion(4));
        Assertions.assertEquals("q2", session.resolveAnswerableQuestion(2));

        session.recordAnswer(evaluation(2, 60));
        IllegalStateException duplicate = Assertions.assertThrows(IllegalStateException.class,
                () -> session.recordAnswer(evaluation(2, 99)));
        Assertions.assertEquals("Question 2 already answered", duplicate.getMessage());
        Assertions.assertEquals(1, session.getAnsweredCount());
    }

    @Test
    public void shouldAcceptAnswersOutOfOrder() {
        ScreeningSessionEntity session = startedSession();
        session.recordAnswer(evaluation(3, 80));
        session.recordAnswer(evaluation(0, 80));
        Assertions.assertEquals(2, session.getAnsweredCount());
    }

    @Test
    public void shouldRejectAnswerAfterCompletion() {
        ScreeningSessionEntity session = startedSession();
        for (int i = 0; i < QUESTIONS.size(); i++) {
            session.recordAnswer(evaluation(i, 80));
        }
        session.complete(new FinalResultVO(70, 80D, 75D, RecommendationEnum.YES, "summary"));

        IllegalStateException ex = Assertions.assertThrows(IllegalStateException.class,
                () -> session.resolveAnswerableQuestion(0));
        Assertions.assertEquals("Interview already completed", ex.getMessage());
        Assertions.assertThrows(IllegalStateException.class,
                () -> session.complete(new FinalResultVO(70, 80D, 75D, RecommendationEnum.YES, "again")));
    }

    @Test
    public void shouldNotCompleteBeforeAllAnswered() {
        ScreeningSessionEntity session = startedSession();
        session.recordAnswer(evaluation(0, 80));
        Assertions.assertThrows(IllegalStateException.class,
                () -> session.complete(new FinalResultVO(70, 80D, 75D, RecommendationEnum.YES, "summary")));
        Assertions.assertNull(session.getFinalResult());
    }

    @Test
    public void shouldDiscardAnswersWhenInterviewRestarted() {
        ScreeningSessionEntity session = startedSession();
        session.recordAnswer(evaluation(0, 80));
        session.recordAnswer(evaluation(1, 80));

        int discarded = session.startInterview(List.of("n0", "n1", "n2", "n3"));

        Assertions.assertEquals(2, discarded);
        Assertions.assertEquals(0, session.getAnsweredCount());
        Assertions.assertEquals("n0", session.getQuestions().get(0));
        Assertions.assertEquals(ScreeningStageEnum.INTERVIEW_STARTED, session.getStage());
    }

    @Test
    public void shouldExposeReadOnlyQuestionView() {
        ScreeningSessionEntity session = startedSession();
        Assertions.assertThrows(UnsupportedOperationException.class, () -> session.getQuestions().add("extra"));
        Assertions.assertThrows(UnsupportedOperationException.class, () -> session.getAnswers().clear());
    }

    @Test
    public void shouldRejectBlankSessionId() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new ScreeningSessionEntity(" ", "resume", "ref", "cv.pdf"));
    }

    private ScreeningSessionEntity startedSession() {
        ScreeningSessionEntity session = newSession("resume");
        session.applyAnalysis("JD", analysis(70));
        session.startInterview(QUESTIONS);
        return session;
    }

    private ScreeningSessionEntity newSession(String resumeText) {
        return new ScreeningSessionEntity("session-1", resumeText, "resume_1.pdf", "cv.pdf");
    }

    private ResumeAnalysisVO analysis(int overallScore) {
        ResumeAnalysisVO analysis = new ResumeAnalysisVO();
        analysis.setName("Alice");
        analysis.setSkills(List.of("Java", "Spring"));
        analysis.setOverallScore(overallScore);
        return analysis;
    }

    private AnswerEvaluationVO evaluation(int questionIndex, int score) {
        AnswerEvaluationVO evaluation = new AnswerEvaluationVO();
        evaluation.setQuestionIndex(questionIndex);
        evaluation.setQuestion("q" + questionIndex);
        evaluation.setAnswer("answer");
        evaluation.setScore(score);
        evaluation.setFeedback("ok");
        return evaluation;
    }
}
