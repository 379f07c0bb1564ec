package com.chatguard.moderation.service;

import com.chatguard.moderation.config.MetricsConfig;
import com.chatguard.moderation.model.*;
import com.chatguard.moderation.repository.ActionRecordRepository;
import com.chatguard.moderation.repository.DetectionDecisionRepository;
import com.chatguard.moderation.repository.ReviewQueueRepository;
import com.chatguard.moderation.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReviewQueueServiceTest {

    private static final long NOW = 1_700_000_500_000L;

    @Mock private ReviewQueueRepository reviewQueueRepo;
    @Mock private DetectionDecisionRepository decisionRepo;
    @Mock private ActionRecordRepository actionRecordRepo;
    @Mock private TrainingCorpusService corpusService;
    @Mock private ModerationOrchestrator orchestrator;
    @Mock private AuditService auditService;
    @Mock private MetricsConfig metricsConfig;

    private ReviewQueueService service;

    @BeforeEach
    void setUp() {
        service = new ReviewQueueService(reviewQueueRepo, decisionRepo, actionRecordRepo, corpusService,
                orchestrator, auditService, metricsConfig, Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC));
    }

    @Test
    void getQueueItems_delegatesToRepository() {
        PagedResponse<ReviewQueueItem> expected = new PagedResponse<>(List.of(
                TestDataFactory.createReviewQueueItem("M-1:v0", "A-1", ReviewStatus.PENDING)),
                false, null);
        when(reviewQueueRepo.findByFilters(ReviewStatus.PENDING, "C-1", null, 50, null)).thenReturn(expected);

        assertThat(service.getQueueItems(ReviewStatus.PENDING, "C-1", null, 50, null)).isEqualTo(expected);
    }

    @Test
    void getQueueItemDetail_found_assemblesDecisionAndAuthorHistory() {
        ReviewQueueItem item = TestDataFactory.createReviewQueueItem("M-1:v0", "A-1", ReviewStatus.PENDING);
        DetectionDecision decision = TestDataFactory.createDecision("M-1", "A-1", DetectionAction.REVIEW_QUEUE, 65);
        ActionRecord mute = TestDataFactory.createActionRecord("R-1", "A-1", ActionKind.MUTE, NOW - 10_000, NOW + 10_000);
        when(reviewQueueRepo.findByDecisionId("M-1:v0")).thenReturn(item);
        when(decisionRepo.findById("M-1:v0")).thenReturn(decision);
        when(actionRecordRepo.findByAccountId("A-1")).thenReturn(List.of(mute));

        ReviewQueueDetail detail = service.getQueueItemDetail("M-1:v0");

        assertThat(detail.getQueueItem()).isSameAs(item);
        assertThat(detail.getDecision().getNetConfidence()).isEqualTo(65);
        assertThat(detail.getAuthorActions()).containsExactly(mute);
    }

    @Test
    void getQueueItemDetail_notFound_returnsNull() {
        when(reviewQueueRepo.findByDecisionId("missing")).thenReturn(null);
        assertThat(service.getQueueItemDetail("missing")).isNull();
    }

    @Test
    void submitFeedback_pendingStatus_throwsException() {
        assertThatThrownBy(() -> service.submitFeedback("M-1:v0", ReviewStatus.PENDING, "42", false))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(reviewQueueRepo);
    }

    @Test
    void submitFeedback_confirmedHam_labelsHamWithoutBan() {
        ReviewQueueItem resolved = TestDataFactory.createReviewQueueItem("M-1:v0", "A-1", ReviewStatus.CONFIRMED_HAM);
        when(reviewQueueRepo.resolve("M-1:v0", ReviewStatus.CONFIRMED_HAM, "ADMIN:42", NOW)).thenReturn(true);
        when(reviewQueueRepo.findByDecisionId("M-1:v0")).thenReturn(resolved);

        ReviewFeedbackResult result = service.submitFeedback("M-1:v0", ReviewStatus.CONFIRMED_HAM, "42", true);

        assertThat(result.applied()).isTrue();
        assertThat(result.enforcement()).isNull();
        verify(corpusService).label("M-1:v0", "earn crypto profit now", TrainingLabel.HAM, "C-1", "ADMIN:42");
        verify(metricsConfig).recordFeedback("CONFIRMED_HAM");
        verifyNoInteractions(orchestrator);
    }

    @Test
    void submitFeedback_confirmedSpamWithBan_bansAuthor() {
        ReviewQueueItem resolved = TestDataFactory.createReviewQueueItem("M-1:v0", "A-1", ReviewStatus.CONFIRMED_SPAM);
        ActionOutcome banned = ActionOutcome.builder()
                .kind(ActionKind.BAN).accountId("A-1").status(OutcomeStatus.SUCCEEDED).chatsAffected(3).build();
        when(reviewQueueRepo.resolve("M-1:v0", ReviewStatus.CONFIRMED_SPAM, "ADMIN:42", NOW)).thenReturn(true);
        when(reviewQueueRepo.findByDecisionId("M-1:v0")).thenReturn(resolved);
        when(orchestrator.execute(any(EnforcementIntent.class))).thenReturn(banned);

        ReviewFeedbackResult result = service.submitFeedback("M-1:v0", ReviewStatus.CONFIRMED_SPAM, "42", true);

        assertThat(result.enforcement()).isSameAs(banned);
        ArgumentCaptor<EnforcementIntent> intent = ArgumentCaptor.forClass(EnforcementIntent.class);
        verify(orchestrator).execute(intent.capture());
        assertThat(intent.getValue().getKind()).isEqualTo(ActionKind.BAN);
        assertThat(intent.getValue().getTargetAccountId()).isEqualTo("A-1");
        assertThat(intent.getValue().getExecutor()).isEqualTo(Actor.admin("42"));
        assertThat(intent.getValue().getOriginCommunityId()).isEqualTo("C-1");
        verify(corpusService).label("M-1:v0", "earn crypto profit now", TrainingLabel.SPAM, "C-1", "ADMIN:42");
        verify(auditService).record(Actor.admin("42"), "A-1", AuditAction.REVIEW_FEEDBACK, "CONFIRMED_SPAM",
                "decision=M-1:v0", "C-1");
    }

    @Test
    void submitFeedback_alreadyReviewed_notApplied() {
        ReviewQueueItem reviewed = TestDataFactory.createReviewQueueItem("M-1:v0", "A-1", ReviewStatus.CONFIRMED_HAM);
        when(reviewQueueRepo.resolve(eq("M-1:v0"), eq(ReviewStatus.CONFIRMED_SPAM), anyString(), anyLong()))
                .thenReturn(false);
        when(reviewQueueRepo.findByDecisionId("M-1:v0")).thenReturn(reviewed);

        ReviewFeedbackResult result = service.submitFeedback("M-1:v0", ReviewStatus.CONFIRMED_SPAM, "43", true);

        assertThat(result.applied()).isFalse();
        assertThat(result.item().getStatus()).isEqualTo(ReviewStatus.CONFIRMED_HAM);
        verifyNoInteractions(corpusService, orchestrator, auditService);
    }

    @Test
    void getQueueStats_fillsMissingStatusesWithZero() {
        when(reviewQueueRepo.countByStatus()).thenReturn(Map.of(ReviewStatus.PENDING, 4));

        Map<String, Integer> stats = service.getQueueStats();

        assertThat(stats).containsEntry("pending", 4)
                .containsEntry("confirmedSpam", 0)
                .containsEntry("confirmedHam", 0);
    }
}
