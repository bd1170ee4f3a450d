package com.aura.trigger.http;

import com.aura.api.dto.AnswerSubmitRequestDTO;
import com.aura.api.dto.AnswerSubmitResponseDTO;
import com.aura.api.dto.InterviewStartRequestDTO;
import com.aura.api.dto.InterviewStartResponseDTO;
import com.aura.api.dto.ResumeAnalyzeRequestDTO;
import com.aura.api.dto.ResumeAnalyzeResponseDTO;
import com.aura.api.dto.ResumeUploadResponseDTO;
import com.aura.api.dto.SessionSummaryDTO;
import com.aura.api.response.Response;
import com.aura.domain.screening.model.entity.ScreeningSessionEntity;
import com.aura.domain.screening.model.valobj.ResumeAnalysisVO;
import com.aura.trigger.application.command.ScreeningSessionCommandService;
import com.aura.trigger.application.common.ScreeningViewAssembler;
import com.aura.trigger.application.query.ScreeningSessionQueryService;
import com.aura.types.common.Constants;
import com.aura.types.enums.ResponseCode;
import com.aura.types.exception.AppException;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;

/**
 * 简历筛选与模拟面试 API。
 */
@RestController
@RequestMapping("/api/screening")
public class ScreeningController {

    private final ScreeningSessionCommandService screeningSessionCommandService;
    private final ScreeningSessionQueryService screeningSessionQueryService;
    private final ScreeningViewAssembler screeningViewAssembler;

    public ScreeningController(ScreeningSessionCommandService screeningSessionCommandService,
                               ScreeningSessionQueryService screeningSessionQueryService,
                               ScreeningViewAssembler screeningViewAssembler) {
        this.screeningSessionCommandService = screeningSessionCommandService;
        this.screeningSessionQueryService = screeningSessionQueryService;
        this.screeningViewAssembler = screeningViewAssembler;
    }

    @PostMapping("/upload")
    public Response<ResumeUploadResponseDTO> upload(@RequestParam("file") MultipartFile file) {
        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException ex) {
            throw new AppException(ResponseCode.UN_ERROR, "Failed to read uploaded file", ex);
        }
        ScreeningSessionEntity session = screeningSessionCommandService.uploadResume(
                file.getOriginalFilename(), file.getContentType(), content);

        ResumeUploadResponseDTO data = new ResumeUploadResponseDTO();
        data.setSessionId(session.getSessionId());
        data.setPreview(preview(session.getResumeText()));
        return success(data);
    }

    @PostMapping("/analyze")
    public Response<ResumeAnalyzeResponseDTO> analyze(@RequestBody ResumeAnalyzeRequestDTO request) {
        ResumeAnalysisVO analysis = screeningSessionCommandService.analyzeResume(
                request.getSessionId(), request.getJobDescription());

        ResumeAnalyzeResponseDTO data = new ResumeAnalyzeResponseDTO();
        data.setSessionId(request.getSessionId());
        data.setAnalysis(screeningViewAssembler.toAnalysisDTO(analysis));
        return success(data);
    }

    @PostMapping("/interview/start")
    public Response<InterviewStartResponseDTO> startInterview(@RequestBody InterviewStartRequestDTO request) {
        List<String> questions = screeningSessionCommandService.startInterview(request.getSessionId());

        InterviewStartResponseDTO data = new InterviewStartResponseDTO();
        data.setSessionId(request.getSessionId());
        data.setQuestions(questions);
        data.setTotal(questions.size());
        return success(data);
    }

    @PostMapping("/interview/answer")
    public Response<AnswerSubmitResponseDTO> submitAnswer(@RequestBody AnswerSubmitRequestDTO request) {
        ScreeningSessionCommandService.AnswerSubmitResult result = screeningSessionCommandService.submitAnswer(
                request.getSessionId(), request.getQuestionIndex(), request.getAnswer());

        AnswerSubmitResponseDTO data = new AnswerSubmitResponseDTO();
        data.setEvaluation(screeningViewAssembler.toEvaluationDTO(result.evaluation()));
        data.setQuestionIndex(result.questionIndex());
        data.setComplete(result.complete());
        data.setFinalResult(screeningViewAssembler.toFinalResultDTO(result.finalResult()));
        return success(data);
    }

    @GetMapping("/sessions/{sessionId}")
    public Response<SessionSummaryDTO> getSession(@PathVariable("sessionId") String sessionId) {
        return success(screeningSessionQueryService.getSummary(sessionId));
    }

    @DeleteMapping("/sessions/{sessionId}")
    public Response<Boolean> deleteSession(@PathVariable("sessionId") String sessionId) {
        return success(screeningSessionCommandService.deleteSession(sessionId));
    }

    private String preview(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= Constants.RESUME_PREVIEW_LENGTH
                ? text
                : text.substring(0, Constants.RESUME_PREVIEW_LENGTH);
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
