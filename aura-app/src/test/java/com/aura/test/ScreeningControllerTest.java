package com.aura.test;

import com.aura.api.dto.SessionSummaryDTO;
import com.aura.domain.screening.model.entity.ScreeningSessionEntity;
import com.aura.domain.screening.model.valobj.AnswerEvaluationVO;
import com.aura.domain.screening.model.valobj.FinalResultVO;
import com.aura.domain.screening.model.valobj.ResumeAnalysisVO;
import com.aura.trigger.application.command.ScreeningSessionCommandService;
import com.aura.trigger.application.common.ScreeningViewAssembler;
import com.aura.trigger.application.query.ScreeningSessionQueryService;
import com.aura.trigger.http.GlobalApiExceptionHandler;
import com.aura.trigger.http.HealthController;
import com.aura.trigger.http.ScreeningController;
import com.aura.types.enums.RecommendationEnum;
import com.aura.types.enums.ResponseCode;
import com.aura.types.enums.ScreeningStageEnum;
import com.aura.types.exception.AppException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class ScreeningControllerTest {

    private ScreeningSessionCommandService commandService;
    private ScreeningSessionQueryService queryService;
    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        this.commandService = mock(ScreeningSessionCommandService.class);
        this.queryService = mock(ScreeningSessionQueryService.class);
        this.mockMvc = MockMvcBuilders.standaloneSetup(
                        new ScreeningController(commandService, queryService, new ScreeningViewAssembler()),
                        new HealthController())
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @Test
    public void shouldUploadResumeAndReturnPreview() throws Exception {
        String text = "A".repeat(250);
        when(commandService.uploadResume(eq("cv.pdf"), eq("application/pdf"), any(byte[].class)))
                .thenReturn(new ScreeningSessionEntity("s-1", text, "resume_1.pdf", "cv.pdf"));

        MockMultipartFile file = new MockMultipartFile("file", "cv.pdf", "application/pdf", new byte[]{1, 2, 3});
        mockMvc.perform(multipart("/api/screening/upload").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data.sessionId").value("s-1"))
                .andExpect(jsonPath("$.data.preview").value("A".repeat(200)));
    }

    @Test
    public void shouldRejectUploadWithoutFilePart() throws Exception {
        mockMvc.perform(multipart("/api/screening/upload"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()));
    }

    @Test
    public void shouldAnalyzeResume() throws Exception {
        ResumeAnalysisVO analysis = new ResumeAnalysisVO();
        analysis.setName("Alice");
        analysis.setSkills(List.of("Java"));
        analysis.setOverallScore(84);
        when(commandService.analyzeResume("s-1", "Backend engineer")).thenReturn(analysis);

        mockMvc.perform(post("/api/screening/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\":\"s-1\",\"jobDescription\":\"Backend engineer\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.sessionId").value("s-1"))
                .andExpect(jsonPath("$.data.analysis.name").value("Alice"))
                .andExpect(jsonPath("$.data.analysis.skills[0]").value("Java"))
                .andExpect(jsonPath("$.data.analysis.overallScore").value(84));
    }

    @Test
    public void shouldMapUpstreamRefusal() throws Exception {
        when(commandService.analyzeResume(anyString(), anyString())).thenThrow(new AppException(
                ResponseCode.UPSTREAM_REFUSED,
                "Resume analysis blocked by safety filters. Please try a different resume or job description."));

        mockMvc.perform(post("/api/screening/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\":\"s-1\",\"jobDescription\":\"JD\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.UPSTREAM_REFUSED.getCode()))
                .andExpect(jsonPath("$.info").value(
                        "Resume analysis blocked by safety filters. Please try a different resume or job description."));
    }

    @Test
    public void shouldStartInterview() throws Exception {
        when(commandService.startInterview("s-1")).thenReturn(List.of("q0", "q1", "q2", "q3"));

        mockMvc.perform(post("/api/screening/interview/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\":\"s-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.total").value(4))
                .andExpect(jsonPath("$.data.questions[3]").value("q3"));
    }

    @Test
    public void shouldSubmitFinalAnswer() throws Exception {
        AnswerEvaluationVO evaluation = new AnswerEvaluationVO();
        evaluation.setQuestionIndex(3);
        evaluation.setQuestion("q3");
        evaluation.setAnswer("answer");
        evaluation.setScore(80);
        evaluation.setFeedback("Good");
        FinalResultVO finalResult = new FinalResultVO(85, 80D, 82.5D, RecommendationEnum.STRONG_YES, "summary");
        when(commandService.submitAnswer("s-1", 3, "answer")).thenReturn(
                new ScreeningSessionCommandService.AnswerSubmitResult(evaluation, 3, true, finalResult));

        mockMvc.perform(post("/api/screening/interview/answer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\":\"s-1\",\"questionIndex\":3,\"answer\":\"answer\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.evaluation.score").value(80))
                .andExpect(jsonPath("$.data.complete").value(true))
                .andExpect(jsonPath("$.data.finalResult.finalScore").value(82.5D))
                .andExpect(jsonPath("$.data.finalResult.recommendation").value("Strong Yes"));
    }

    @Test
    public void shouldReturnSessionSummary() throws Exception {
        SessionSummaryDTO summary = new SessionSummaryDTO();
        summary.setSessionId("s-1");
        summary.setStage(ScreeningStageEnum.ANSWERING);
        summary.setHasAnalysis(true);
        summary.setInterviewProgress(2);
        summary.setTotalQuestions(4);
        when(queryService.getSummary("s-1")).thenReturn(summary);

        mockMvc.perform(get("/api/screening/sessions/s-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.stage").value("answering"))
                .andExpect(jsonPath("$.data.interviewProgress").value(2));
    }

    @Test
    public void shouldMapUnknownSessionToNotFound() throws Exception {
        when(queryService.getSummary("missing")).thenThrow(new AppException(ResponseCode.NOT_FOUND, "Session not found"));

        mockMvc.perform(get("/api/screening/sessions/missing"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.NOT_FOUND.getCode()))
                .andExpect(jsonPath("$.info").value("Session not found"));
    }

    @Test
    public void shouldDeleteSession() throws Exception {
        when(commandService.deleteSession("s-1")).thenReturn(true);

        mockMvc.perform(delete("/api/screening/sessions/s-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value(true));
        verify(commandService).deleteSession("s-1");
    }

    @Test
    public void shouldReportHealth() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("healthy"))
                .andExpect(jsonPath("$.data.backend").value("running"))
                .andExpect(jsonPath("$.data.ready").value(true));
    }
}
