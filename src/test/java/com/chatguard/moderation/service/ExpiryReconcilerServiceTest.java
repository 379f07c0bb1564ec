package com.chatguard.moderation.service;

import com.chatguard.moderation.config.MetricsConfig;
import com.chatguard.moderation.config.ModerationConfig;
import com.chatguard.moderation.model.ActionKind;
import com.chatguard.moderation.model.ActionRecord;
import com.chatguard.moderation.model.AuditAction;
import com.chatguard.moderation.platform.PlatformException;
import com.chatguard.moderation.platform.PlatformGateway;
import com.chatguard.moderation.repository.MembershipRepository;
import com.chatguard.moderation.testutil.InMemoryActionRecordRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.chatguard.moderation.testutil.TestDataFactory.createActionRecord;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ExpiryReconcilerServiceTest {

    private static final long T = 1_700_000_000_000L;
    private static final long MINUTE = 60_000L;

    @Mock
    private MembershipRepository membershipRepository;

    @Mock
    private PlatformGateway platformGateway;

    @Mock
    private NotificationDeliveryService notificationService;

    @Mock
    private AuditService auditService;

    private InMemoryActionRecordRepository actionRecordRepository;
    private ThreadPoolTaskExecutor executor;
    private ModerationConfig config;
    private final AccountLocks accountLocks = new AccountLocks();

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(4);
        executor.initialize();

        config = new ModerationConfig();
        config.setCommunityCallTimeoutMs(2000);
        config.getExpiry().setClaimLeaseSeconds(300);
        actionRecordRepository = new InMemoryActionRecordRepository();
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private ExpiryReconcilerService reconcilerAt(long now) {
        return new ExpiryReconcilerService(actionRecordRepository, membershipRepository, platformGateway,
                new CommunityFanoutExecutor(executor, config), notificationService, auditService, accountLocks, config,
                new MetricsConfig(new SimpleMeterRegistry()), Clock.fixed(Instant.ofEpochMilli(now), ZoneOffset.UTC));
    }

    @Test
    void sweep_expiredMute_liftedOnceAndNotified() {
        actionRecordRepository.save(createActionRecord("mute-1", "A-1", ActionKind.MUTE, T, T + 5 * MINUTE));
        when(membershipRepository.findCommunityIds("A-1")).thenReturn(List.of("C-1", "C-2"));
        ExpiryReconcilerService reconciler = reconcilerAt(T + 6 * MINUTE);

        assertThat(reconciler.sweep()).isEqualTo(1);
        assertThat(reconciler.sweep()).isZero();

        verify(platformGateway, times(1)).unrestrictMember("C-1", "A-1");
        verify(platformGateway, times(1)).unrestrictMember("C-2", "A-1");
        ActionRecord record = actionRecordRepository.findById("mute-1");
        assertThat(record.getReversedAt()).isEqualTo(T + 6 * MINUTE);
        assertThat(record.getReversedBy()).isEqualTo("SYSTEM:expiry-reconciler");
        verify(notificationService).deliver(eq("A-1"), eq("C-1"), isNull(), anyString());
        verify(auditService).record(eq(ExpiryReconcilerService.RECONCILER), eq("A-1"),
                eq(AuditAction.EXPIRY_REVERSAL), eq("SUCCEEDED"), anyString(), isNull());
    }

    @Test
    void sweep_expiredTempBanUnderNewerBan_closedWithoutUnban() {
        actionRecordRepository.save(createActionRecord("tb-1", "A-1", ActionKind.TEMP_BAN, T, T + 5 * MINUTE));
        actionRecordRepository.save(createActionRecord("ban-2", "A-1", ActionKind.BAN, T + 6 * MINUTE, 0));

        assertThat(reconcilerAt(T + 7 * MINUTE).sweep()).isEqualTo(1);

        verify(platformGateway, never()).unbanMember(anyString(), anyString());
        verifyNoInteractions(membershipRepository, notificationService);
        assertThat(actionRecordRepository.findById("tb-1").getReversedAt()).isEqualTo(T + 7 * MINUTE);
        assertThat(actionRecordRepository.findById("ban-2").getReversedAt()).isZero();
        verify(auditService).record(eq(ExpiryReconcilerService.RECONCILER), eq("A-1"),
                eq(AuditAction.EXPIRY_REVERSAL), eq("SUPERSEDED"), anyString(), isNull());
    }

    @Test
    void sweep_expiredMuteUnderNewerMute_closedWithoutUnrestrict() {
        actionRecordRepository.save(createActionRecord("mute-1", "A-1", ActionKind.MUTE, T, T + 5 * MINUTE));
        actionRecordRepository.save(createActionRecord("mute-2", "A-1", ActionKind.MUTE, T + 6 * MINUTE, T + 60 * MINUTE));

        assertThat(reconcilerAt(T + 7 * MINUTE).sweep()).isEqualTo(1);

        verifyNoInteractions(platformGateway, notificationService);
        assertThat(actionRecordRepository.findById("mute-1").getReversedAt()).isEqualTo(T + 7 * MINUTE);
    }

    @Test
    void sweep_expiredMuteWithActiveBan_stillUnrestricted() {
        config.getExpiry().setNotifyAccount(false);
        actionRecordRepository.save(createActionRecord("mute-1", "A-1", ActionKind.MUTE, T, T + 5 * MINUTE));
        actionRecordRepository.save(createActionRecord("ban-2", "A-1", ActionKind.BAN, T + MINUTE, 0));
        when(membershipRepository.findCommunityIds("A-1")).thenReturn(List.of("C-1"));

        assertThat(reconcilerAt(T + 7 * MINUTE).sweep()).isEqualTo(1);

        verify(platformGateway).unrestrictMember("C-1", "A-1");
        verify(platformGateway, never()).unbanMember(anyString(), anyString());
    }

    @Test
    void sweep_muteNotYetDue_untouched() {
        actionRecordRepository.save(createActionRecord("mute-1", "A-1", ActionKind.MUTE, T, T + 10 * MINUTE));

        assertThat(reconcilerAt(T + 6 * MINUTE).sweep()).isZero();

        verifyNoInteractions(platformGateway, membershipRepository);
    }

    @Test
    void sweep_expiredTempBan_unbans() {
        config.getExpiry().setNotifyAccount(false);
        actionRecordRepository.save(createActionRecord("tb-1", "A-1", ActionKind.TEMP_BAN, T, T + MINUTE));
        when(membershipRepository.findCommunityIds("A-1")).thenReturn(List.of("C-1"));

        assertThat(reconcilerAt(T + 2 * MINUTE).sweep()).isEqualTo(1);

        verify(platformGateway).unbanMember("C-1", "A-1");
        verifyNoInteractions(notificationService);
    }

    @Test
    void sweep_recordClaimedByAnotherInstance_skipped() {
        ActionRecord record = createActionRecord("mute-1", "A-1", ActionKind.MUTE, T, T + 5 * MINUTE);
        record.setClaimedBy("other-instance");
        record.setClaimedAt(T + 5 * MINUTE + 30_000);
        actionRecordRepository.save(record);

        assertThat(reconcilerAt(T + 6 * MINUTE).sweep()).isZero();

        verifyNoInteractions(platformGateway);
        assertThat(actionRecordRepository.findById("mute-1").getReversedAt()).isZero();
    }

    @Test
    void sweep_staleClaim_takenOver() {
        config.getExpiry().setNotifyAccount(false);
        ActionRecord record = createActionRecord("mute-1", "A-1", ActionKind.MUTE, T, T + 5 * MINUTE);
        record.setClaimedBy("crashed-instance");
        record.setClaimedAt(T + 5 * MINUTE);
        actionRecordRepository.save(record);
        when(membershipRepository.findCommunityIds("A-1")).thenReturn(List.of("C-1"));

        assertThat(reconcilerAt(T + 11 * MINUTE).sweep()).isEqualTo(1);

        verify(platformGateway).unrestrictMember("C-1", "A-1");
    }

    @Test
    void sweep_liftFailsEverywhere_retriedAfterLease() {
        config.getExpiry().setNotifyAccount(false);
        actionRecordRepository.save(createActionRecord("mute-1", "A-1", ActionKind.MUTE, T, T + 5 * MINUTE));
        when(membershipRepository.findCommunityIds("A-1")).thenReturn(List.of("C-1"));
        doThrow(new PlatformException("C-1", "too many requests"))
                .doNothing()
                .when(platformGateway).unrestrictMember("C-1", "A-1");

        assertThat(reconcilerAt(T + 6 * MINUTE).sweep()).isZero();
        assertThat(actionRecordRepository.findById("mute-1").getReversedAt()).isZero();

        // claim still held inside the lease
        assertThat(reconcilerAt(T + 7 * MINUTE).sweep()).isZero();

        assertThat(reconcilerAt(T + 12 * MINUTE).sweep()).isEqualTo(1);
        assertThat(actionRecordRepository.findById("mute-1").getReversedAt()).isEqualTo(T + 12 * MINUTE);
        verify(platformGateway, times(2)).unrestrictMember("C-1", "A-1");
    }

    @Test
    void sweep_concurrentInstances_liftEachRecordOnce() throws Exception {
        config.getExpiry().setNotifyAccount(false);
        for (int i = 0; i < 5; i++) {
            actionRecordRepository.save(createActionRecord("mute-" + i, "A-" + i, ActionKind.MUTE, T, T + MINUTE));
        }
        when(membershipRepository.findCommunityIds(anyString())).thenReturn(List.of("C-1"));
        ExpiryReconcilerService first = reconcilerAt(T + 2 * MINUTE);
        ExpiryReconcilerService second = reconcilerAt(T + 2 * MINUTE);

        Thread other = new Thread(second::sweep);
        other.start();
        first.sweep();
        other.join(5000);

        verify(platformGateway, times(5)).unrestrictMember(eq("C-1"), anyString());
        assertThat(actionRecordRepository.findExpiredUnreversed(T + 2 * MINUTE)).isEmpty();
    }

    @Test
    void sweep_permanentAndTrustRecords_ignored() {
        actionRecordRepository.save(createActionRecord("ban-1", "A-1", ActionKind.BAN, T, 0));
        actionRecordRepository.save(createActionRecord("trust-1", "A-2", ActionKind.TRUST, T, 0));

        assertThat(reconcilerAt(T + 60 * MINUTE).sweep()).isZero();

        verifyNoInteractions(platformGateway);
        verify(auditService, never()).record(any(), anyString(), any(), anyString(), anyString(), any());
    }
}
