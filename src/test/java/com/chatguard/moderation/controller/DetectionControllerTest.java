package com.chatguard.moderation.controller;

import com.chatguard.moderation.engine.EvaluationCancelledException;
import com.chatguard.moderation.engine.EvaluationException;
import com.chatguard.moderation.model.*;
import com.chatguard.moderation.repository.DetectionDecisionRepository;
import com.chatguard.moderation.service.DetectionService;
import com.chatguard.moderation.service.TrainingCorpusService;
import com.chatguard.moderation.testutil.TestDataFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(DetectionController.class)
class DetectionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private DetectionService detectionService;

    @MockBean
    private DetectionDecisionRepository decisionRepository;

    @MockBean
    private TrainingCorpusService corpusService;

    @Test
    void evaluate_success() throws Exception {
        ContentMessage message = TestDataFactory.createMessage("M-1", "C-1", "A-1", "earn crypto now");
        DetectionDecision decision = TestDataFactory.createDecision("M-1", "A-1", DetectionAction.REVIEW_QUEUE, 65);
        when(detectionService.evaluate(any(ContentMessage.class))).thenReturn(decision);

        mockMvc.perform(post("/api/v1/messages/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(message)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.decisionId").value("M-1:v0"))
                .andExpect(jsonPath("$.action").value("REVIEW_QUEUE"))
                .andExpect(jsonPath("$.netConfidence").value(65))
                .andExpect(jsonPath("$.checkResults[0].checkName").value("STOP_WORDS"));
    }

    @Test
    void evaluate_missingAccountId_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/messages/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "messageId", "M-1",
                                "communityId", "C-1",
                                "text", "hello"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());

        verifyNoInteractions(detectionService);
    }

    @Test
    void evaluate_allChecksFailed_returns503() throws Exception {
        when(detectionService.evaluate(any(ContentMessage.class)))
                .thenThrow(new EvaluationException("Every check failed for message M-1"));

        mockMvc.perform(post("/api/v1/messages/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                TestDataFactory.createMessage("M-1", "C-1", "A-1", "hi"))))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("Every check failed for message M-1"));
    }

    @Test
    void evaluate_cancelled_returns503() throws Exception {
        when(detectionService.evaluate(any(ContentMessage.class)))
                .thenThrow(new EvaluationCancelledException("interrupted"));

        mockMvc.perform(post("/api/v1/messages/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                TestDataFactory.createMessage("M-1", "C-1", "A-1", "hi"))))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("Evaluation cancelled"));
    }

    @Test
    void getLatestDecision_found() throws Exception {
        when(decisionRepository.findLatestByMessageId("M-1"))
                .thenReturn(TestDataFactory.createDecision("M-1", "A-1", DetectionAction.ALLOW, 10));

        mockMvc.perform(get("/api/v1/messages/M-1/decision"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.messageId").value("M-1"))
                .andExpect(jsonPath("$.verdict").value("CLEAN"));
    }

    @Test
    void getLatestDecision_notFound() throws Exception {
        when(decisionRepository.findLatestByMessageId("MISSING")).thenReturn(null);

        mockMvc.perform(get("/api/v1/messages/MISSING/decision"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getDecisionHistory_success() throws Exception {
        DetectionDecision v1 = TestDataFactory.createDecision("M-1", "A-1", DetectionAction.AUTO_BAN, 92);
        v1.setDecisionId("M-1:v1");
        v1.setEditVersion(1);
        when(decisionRepository.findHistory("M-1")).thenReturn(List.of(v1,
                TestDataFactory.createDecision("M-1", "A-1", DetectionAction.ALLOW, 0)));

        mockMvc.perform(get("/api/v1/messages/M-1/decisions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].editVersion").value(1));
    }

    @Test
    void setTrainingEligibility_success() throws Exception {
        when(corpusService.setEligibility("M-1:v0", false)).thenReturn(true);

        mockMvc.perform(put("/api/v1/messages/decisions/M-1:v0/training-eligibility")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"eligible\": false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.eligible").value(false));
    }

    @Test
    void setTrainingEligibility_notBoolean_returns400() throws Exception {
        mockMvc.perform(put("/api/v1/messages/decisions/M-1:v0/training-eligibility")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"eligible\": \"maybe\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("eligible"));
    }

    @Test
    void setTrainingEligibility_unknownDecision_returns404() throws Exception {
        when(corpusService.setEligibility("MISSING:v0", true)).thenReturn(false);

        mockMvc.perform(put("/api/v1/messages/decisions/MISSING:v0/training-eligibility")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"eligible\": true}"))
                .andExpect(status().isNotFound());
    }
}
