package com.chatguard.moderation.controller;

import com.chatguard.moderation.model.*;
import com.chatguard.moderation.service.ReviewQueueService;
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

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ReviewQueueController.class)
class ReviewQueueControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private ReviewQueueService reviewQueueService;

    @Test
    void getQueueItems_success() throws Exception {
        when(reviewQueueService.getQueueItems(any(), any(), any(), anyInt(), any()))
                .thenReturn(new PagedResponse<>(List.of(
                        TestDataFactory.createReviewQueueItem("M-1:v0", "A-1", ReviewStatus.PENDING)), false, null));

        mockMvc.perform(get("/api/v1/review/queue"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].decisionId").value("M-1:v0"))
                .andExpect(jsonPath("$.hasMore").value(false));
    }

    @Test
    void getQueueItems_withFilters() throws Exception {
        when(reviewQueueService.getQueueItems(eq(ReviewStatus.PENDING), eq("C-1"), isNull(), eq(20), isNull()))
                .thenReturn(new PagedResponse<>(List.of(), false, null));

        mockMvc.perform(get("/api/v1/review/queue?status=pending&communityId=C-1&limit=20"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").isArray());
    }

    @Test
    void getQueueItems_unknownStatus_returns400() throws Exception {
        mockMvc.perform(get("/api/v1/review/queue?status=MAYBE"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unknown status: MAYBE"));
    }

    @Test
    void getQueueItemDetail_found() throws Exception {
        ReviewQueueDetail detail = ReviewQueueDetail.builder()
                .queueItem(TestDataFactory.createReviewQueueItem("M-1:v0", "A-1", ReviewStatus.PENDING))
                .decision(TestDataFactory.createDecision("M-1", "A-1", DetectionAction.REVIEW_QUEUE, 65))
                .authorActions(List.of())
                .build();
        when(reviewQueueService.getQueueItemDetail("M-1:v0")).thenReturn(detail);

        mockMvc.perform(get("/api/v1/review/queue/M-1:v0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.queueItem.decisionId").value("M-1:v0"))
                .andExpect(jsonPath("$.decision.netConfidence").value(65))
                .andExpect(jsonPath("$.authorActions").isArray());
    }

    @Test
    void getQueueItemDetail_notFound() throws Exception {
        when(reviewQueueService.getQueueItemDetail("MISSING")).thenReturn(null);

        mockMvc.perform(get("/api/v1/review/queue/MISSING"))
                .andExpect(status().isNotFound());
    }

    @Test
    void submitFeedback_success() throws Exception {
        ReviewQueueItem reviewed = TestDataFactory.createReviewQueueItem("M-1:v0", "A-1", ReviewStatus.CONFIRMED_SPAM);
        ActionOutcome banned = ActionOutcome.builder()
                .kind(ActionKind.BAN).accountId("A-1").status(OutcomeStatus.SUCCEEDED).chatsAffected(3).build();
        when(reviewQueueService.submitFeedback("M-1:v0", ReviewStatus.CONFIRMED_SPAM, "42", true))
                .thenReturn(new ReviewFeedbackResult(reviewed, true, banned));

        mockMvc.perform(post("/api/v1/review/queue/M-1:v0/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "status", "CONFIRMED_SPAM",
                                "reviewerId", "42",
                                "banAuthor", true))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.applied").value(true))
                .andExpect(jsonPath("$.item.status").value("CONFIRMED_SPAM"))
                .andExpect(jsonPath("$.enforcement.chatsAffected").value(3));
    }

    @Test
    void submitFeedback_alreadyReviewed_returns409() throws Exception {
        ReviewQueueItem reviewed = TestDataFactory.createReviewQueueItem("M-1:v0", "A-1", ReviewStatus.CONFIRMED_HAM);
        when(reviewQueueService.submitFeedback("M-1:v0", ReviewStatus.CONFIRMED_SPAM, "43", false))
                .thenReturn(new ReviewFeedbackResult(reviewed, false, null));

        mockMvc.perform(post("/api/v1/review/queue/M-1:v0/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "status", "CONFIRMED_SPAM",
                                "reviewerId", "43"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.item.status").value("CONFIRMED_HAM"))
                .andExpect(jsonPath("$.enforcement").doesNotExist());
    }

    @Test
    void submitFeedback_unknownItem_returns404() throws Exception {
        when(reviewQueueService.submitFeedback("MISSING", ReviewStatus.CONFIRMED_HAM, "42", false))
                .thenReturn(new ReviewFeedbackResult(null, false, null));

        mockMvc.perform(post("/api/v1/review/queue/MISSING/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "status", "CONFIRMED_HAM",
                                "reviewerId", "42"))))
                .andExpect(status().isNotFound());
    }

    @Test
    void submitFeedback_missingStatus_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/review/queue/M-1:v0/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("reviewerId", "42"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("status is required"));
    }

    @Test
    void submitFeedback_pendingStatus_returns400() throws Exception {
        when(reviewQueueService.submitFeedback(eq("M-1:v0"), eq(ReviewStatus.PENDING), eq("42"), anyBoolean()))
                .thenThrow(new IllegalArgumentException("Feedback status must be CONFIRMED_SPAM or CONFIRMED_HAM"));

        mockMvc.perform(post("/api/v1/review/queue/M-1:v0/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "status", "PENDING",
                                "reviewerId", "42"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Feedback status must be CONFIRMED_SPAM or CONFIRMED_HAM"));
    }

    @Test
    void getStats_success() throws Exception {
        when(reviewQueueService.getQueueStats()).thenReturn(Map.of(
                "pending", 4, "confirmedSpam", 10, "confirmedHam", 2));

        mockMvc.perform(get("/api/v1/review/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pending").value(4))
                .andExpect(jsonPath("$.confirmedSpam").value(10));
    }
}
