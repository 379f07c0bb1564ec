package com.chatguard.moderation.service;

import com.chatguard.moderation.config.DetectionConfig;
import com.chatguard.moderation.config.MetricsConfig;
import com.chatguard.moderation.config.ModerationConfig;
import com.chatguard.moderation.engine.CheckContext;
import com.chatguard.moderation.engine.CheckEngine;
import com.chatguard.moderation.model.*;
import com.chatguard.moderation.platform.PlatformException;
import com.chatguard.moderation.platform.PlatformGateway;
import com.chatguard.moderation.repository.ActionRecordRepository;
import com.chatguard.moderation.repository.CheckConfigRepository;
import com.chatguard.moderation.repository.CommunityRepository;
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
import java.util.Collections;
import java.util.List;

import static com.chatguard.moderation.testutil.TestDataFactory.cleanResult;
import static com.chatguard.moderation.testutil.TestDataFactory.spamResult;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DetectionServiceTest {

    private static final long NOW = 1_700_000_000_000L;
    private static final String SPAM_TEXT = "Earn $500 a day from home, message me now";

    @Mock private CheckEngine checkEngine;
    @Mock private CheckConfigRepository checkConfigRepository;
    @Mock private DetectionDecisionRepository decisionRepository;
    @Mock private ActionRecordRepository actionRecordRepository;
    @Mock private CommunityRepository communityRepository;
    @Mock private ReviewQueueRepository reviewQueueRepository;
    @Mock private TrainingCorpusService corpusService;
    @Mock private ModerationOrchestrator orchestrator;
    @Mock private PlatformGateway platformGateway;
    @Mock private AdminAlertService adminAlertService;
    @Mock private AuditService auditService;
    @Mock private MetricsConfig metricsConfig;

    private DetectionConfig detectionConfig;
    private ModerationConfig moderationConfig;
    private DetectionService service;
    private final CheckConfigSnapshot snapshot =
            TestDataFactory.createSnapshot("C-1", Collections.emptyList(), Collections.emptyList());

    @BeforeEach
    void setUp() {
        detectionConfig = new DetectionConfig();
        moderationConfig = new ModerationConfig();
        service = new DetectionService(checkEngine, new DecisionScoringService(detectionConfig),
                checkConfigRepository, decisionRepository, actionRecordRepository, communityRepository,
                reviewQueueRepository, corpusService, orchestrator, platformGateway, adminAlertService,
                auditService, detectionConfig, moderationConfig, metricsConfig,
                Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC));
    }

    private void checksReturn(boolean trusted, CheckResult... results) {
        when(checkConfigRepository.snapshotFor("C-1")).thenReturn(snapshot);
        when(checkEngine.runChecks(any(CheckContext.class), eq(snapshot), eq(trusted))).thenReturn(List.of(results));
    }

    private static ActionOutcome outcome(OutcomeStatus status) {
        return ActionOutcome.builder().kind(ActionKind.BAN).accountId("A-1").status(status).chatsAffected(2).build();
    }

    // ── actions ──

    @Test
    void evaluate_highConfidence_bansAuthorAndDeletesMessage() {
        checksReturn(false, spamResult(CheckName.STOP_WORDS, 90), cleanResult(CheckName.SPACING));
        when(decisionRepository.save(any(DetectionDecision.class))).thenReturn(true);
        ActionOutcome banned = outcome(OutcomeStatus.SUCCEEDED);
        when(orchestrator.execute(any(EnforcementIntent.class))).thenReturn(banned);

        DetectionDecision decision = service.evaluate(TestDataFactory.createMessage("M-1", "C-1", "A-1", SPAM_TEXT));

        assertThat(decision.getAction()).isEqualTo(DetectionAction.AUTO_BAN);
        assertThat(decision.getEvaluatedAt()).isEqualTo(NOW);
        assertThat(decision.getEnforcement()).isSameAs(banned);
        assertThat(banned.isMessageDeleted()).isTrue();

        ArgumentCaptor<EnforcementIntent> intent = ArgumentCaptor.forClass(EnforcementIntent.class);
        verify(orchestrator).execute(intent.capture());
        assertThat(intent.getValue().getKind()).isEqualTo(ActionKind.BAN);
        assertThat(intent.getValue().getExecutor().getType()).isEqualTo(ActorType.AUTO_DETECTION);
        assertThat(intent.getValue().getOriginMessageId()).isEqualTo("M-1");
        assertThat(intent.getValue().getOriginCommunityId()).isEqualTo("C-1");

        verify(platformGateway).deleteMessage("C-1", "M-1");
        verify(adminAlertService).alertAutoBan(decision, banned);
        verifyNoInteractions(reviewQueueRepository);
    }

    @Test
    void evaluate_banRejected_messageKeptAndNoAlert() {
        checksReturn(false, spamResult(CheckName.STOP_WORDS, 90));
        when(decisionRepository.save(any(DetectionDecision.class))).thenReturn(true);
        when(orchestrator.execute(any(EnforcementIntent.class))).thenReturn(outcome(OutcomeStatus.REJECTED));

        DetectionDecision decision = service.evaluate(TestDataFactory.createMessage("M-1", "C-1", "A-1", SPAM_TEXT));

        assertThat(decision.getEnforcement().getStatus()).isEqualTo(OutcomeStatus.REJECTED);
        verifyNoInteractions(platformGateway, adminAlertService);
    }

    @Test
    void evaluate_deleteFails_banStillReported() {
        checksReturn(false, spamResult(CheckName.STOP_WORDS, 90));
        when(decisionRepository.save(any(DetectionDecision.class))).thenReturn(true);
        ActionOutcome banned = outcome(OutcomeStatus.PARTIALLY_SUCCEEDED);
        when(orchestrator.execute(any(EnforcementIntent.class))).thenReturn(banned);
        doThrow(new PlatformException("C-1", "message to delete not found"))
                .when(platformGateway).deleteMessage("C-1", "M-1");

        DetectionDecision decision = service.evaluate(TestDataFactory.createMessage("M-1", "C-1", "A-1", SPAM_TEXT));

        assertThat(decision.getEnforcement().isMessageDeleted()).isFalse();
        verify(adminAlertService).alertAutoBan(decision, banned);
    }

    @Test
    void evaluate_reviewBand_enqueuesPendingItem() {
        checksReturn(false, spamResult(CheckName.BAYES, 65), cleanResult(CheckName.STOP_WORDS));
        when(decisionRepository.save(any(DetectionDecision.class))).thenReturn(true);

        DetectionDecision decision = service.evaluate(TestDataFactory.createMessage("M-1", "C-1", "A-1", SPAM_TEXT));

        assertThat(decision.getAction()).isEqualTo(DetectionAction.REVIEW_QUEUE);
        ArgumentCaptor<ReviewQueueItem> captor = ArgumentCaptor.forClass(ReviewQueueItem.class);
        verify(reviewQueueRepository).save(captor.capture());
        ReviewQueueItem item = captor.getValue();
        assertThat(item.getDecisionId()).isEqualTo("M-1:v0");
        assertThat(item.getStatus()).isEqualTo(ReviewStatus.PENDING);
        assertThat(item.getSpamChecks()).containsExactly("BAYES");
        assertThat(item.getNetConfidence()).isEqualTo(65);
        verifyNoInteractions(orchestrator);
    }

    @Test
    void evaluate_shortMessageAboveAutoBan_vetoedToReview() {
        checksReturn(false, spamResult(CheckName.STOP_WORDS, 90));
        when(decisionRepository.save(any(DetectionDecision.class))).thenReturn(true);

        DetectionDecision decision = service.evaluate(TestDataFactory.createMessage("M-1", "C-1", "A-1", "buy now"));

        assertThat(decision.getAction()).isEqualTo(DetectionAction.REVIEW_QUEUE);
        assertThat(decision.isVetoed()).isTrue();
        verify(reviewQueueRepository).save(any(ReviewQueueItem.class));
        verifyNoInteractions(orchestrator);
    }

    @Test
    void evaluate_clean_allowedAndAudited() {
        checksReturn(false, cleanResult(CheckName.STOP_WORDS), cleanResult(CheckName.SPACING));
        when(decisionRepository.save(any(DetectionDecision.class))).thenReturn(true);

        DetectionDecision decision = service.evaluate(
                TestDataFactory.createMessage("M-1", "C-1", "A-1", "see you at the meetup tomorrow"));

        assertThat(decision.getAction()).isEqualTo(DetectionAction.ALLOW);
        assertThat(decision.getVerdict()).isEqualTo(Verdict.CLEAN);
        verify(auditService).record(eq(Actor.autoDetection()), eq("A-1"), eq(AuditAction.DETECTION_DECISION),
                eq("ALLOW"), contains("verdict=CLEAN"), eq("C-1"));
        verify(corpusService).record(decision, "see you at the meetup tomorrow");
        verifyNoInteractions(orchestrator, reviewQueueRepository);
    }

    // ── training mode ──

    @Test
    void evaluate_globalTrainingMode_recordsWithoutActing() {
        detectionConfig.setTrainingMode(true);
        checksReturn(false, spamResult(CheckName.STOP_WORDS, 95));
        when(decisionRepository.save(any(DetectionDecision.class))).thenReturn(true);

        DetectionDecision decision = service.evaluate(TestDataFactory.createMessage("M-1", "C-1", "A-1", SPAM_TEXT));

        assertThat(decision.getAction()).isEqualTo(DetectionAction.AUTO_BAN);
        assertThat(decision.isTrainingMode()).isTrue();
        assertThat(decision.getEnforcement()).isNull();
        verify(corpusService).record(decision, SPAM_TEXT);
        verifyNoInteractions(orchestrator, reviewQueueRepository, platformGateway);
    }

    @Test
    void evaluate_communityTrainingMode_recordsWithoutActing() {
        checksReturn(false, spamResult(CheckName.STOP_WORDS, 60));
        when(communityRepository.isTrainingMode("C-1")).thenReturn(true);
        when(decisionRepository.save(any(DetectionDecision.class))).thenReturn(true);

        DetectionDecision decision = service.evaluate(TestDataFactory.createMessage("M-1", "C-1", "A-1", SPAM_TEXT));

        assertThat(decision.getAction()).isEqualTo(DetectionAction.REVIEW_QUEUE);
        assertThat(decision.isTrainingMode()).isTrue();
        verifyNoInteractions(orchestrator, reviewQueueRepository);
    }

    // ── versions and trust ──

    @Test
    void evaluate_olderEditVersion_supersededAndNotActedOn() {
        checksReturn(false, spamResult(CheckName.STOP_WORDS, 90));
        when(decisionRepository.save(any(DetectionDecision.class))).thenReturn(false);

        DetectionDecision decision = service.evaluate(TestDataFactory.createMessage("M-1", "C-1", "A-1", SPAM_TEXT));

        assertThat(decision.isSuperseded()).isTrue();
        verifyNoInteractions(orchestrator, reviewQueueRepository);
        verify(auditService).record(eq(Actor.autoDetection()), eq("A-1"), eq(AuditAction.DETECTION_DECISION),
                eq("SUPERSEDED"), contains("message=M-1"), eq("C-1"));
        verify(corpusService, never()).record(any(), any());
    }

    @Test
    void evaluate_trustedAuthor_runsEngineInTrustedMode() {
        when(actionRecordRepository.findActive(eq("A-1"), eq(List.of(ActionKind.TRUST)), eq(NOW)))
                .thenReturn(List.of(TestDataFactory.createActionRecord("T-1", "A-1", ActionKind.TRUST, NOW - 1000, 0)));
        checksReturn(true);
        when(decisionRepository.save(any(DetectionDecision.class))).thenReturn(true);

        DetectionDecision decision = service.evaluate(TestDataFactory.createMessage("M-1", "C-1", "A-1", SPAM_TEXT));

        assertThat(decision.getAction()).isEqualTo(DetectionAction.ALLOW);
        assertThat(decision.getCheckResults()).isEmpty();
    }

    @Test
    void evaluate_confidentDecision_markedTrainingEligible() {
        checksReturn(false, cleanResult(CheckName.STOP_WORDS));
        when(decisionRepository.save(any(DetectionDecision.class))).thenReturn(true);
        when(corpusService.isAutomaticallyEligible(any(DetectionDecision.class), eq("see you at the meetup tomorrow")))
                .thenReturn(true);

        DetectionDecision decision = service.evaluate(
                TestDataFactory.createMessage("M-1", "C-1", "A-1", "see you at the meetup tomorrow"));

        assertThat(decision.isTrainingEligible()).isTrue();
    }
}
