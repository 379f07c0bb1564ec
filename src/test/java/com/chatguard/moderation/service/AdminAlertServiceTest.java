package com.chatguard.moderation.service;

import com.chatguard.moderation.config.MetricsConfig;
import com.chatguard.moderation.config.TwilioNotificationConfig;
import com.chatguard.moderation.model.*;
import com.chatguard.moderation.platform.PlatformException;
import com.chatguard.moderation.platform.PlatformGateway;
import com.chatguard.moderation.repository.CommunityRepository;
import com.chatguard.moderation.repository.MembershipRepository;
import com.chatguard.moderation.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AdminAlertServiceTest {

    @Mock private PlatformGateway platformGateway;
    @Mock private CommunityRepository communityRepository;
    @Mock private MembershipRepository membershipRepository;

    private SimpleMeterRegistry registry;
    private AdminAlertService service;

    private final DetectionDecision decision =
            TestDataFactory.createDecision("M-1", "A-1", DetectionAction.AUTO_BAN, 97);
    private final ActionOutcome outcome = ActionOutcome.builder()
            .kind(ActionKind.BAN).accountId("A-1").status(OutcomeStatus.PARTIALLY_SUCCEEDED)
            .chatsAffected(2).chatsFailed(1).build();

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        service = new AdminAlertService(new TwilioNotificationConfig(), platformGateway,
                communityRepository, membershipRepository, new MetricsConfig(registry));
    }

    private void alertsEnabled(boolean enabled) {
        CommunitySettings settings = new CommunitySettings();
        settings.setCommunityId("C-1");
        settings.setAdminAlerts(enabled);
        when(communityRepository.findById("C-1")).thenReturn(settings);
    }

    @Test
    void alertAutoBan_messagesEveryAdminWithSummary() {
        alertsEnabled(true);
        when(membershipRepository.findAdmins("C-1")).thenReturn(List.of("42", "43"));

        service.alertAutoBan(decision, outcome);

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(platformGateway).sendPrivateMessage(eq("42"), body.capture());
        verify(platformGateway).sendPrivateMessage(eq("43"), anyString());
        assertThat(body.getValue())
                .contains("Account: A-1")
                .contains("Confidence: 97%")
                .contains("Communities affected: 2 (failed: 1)");
        assertThat(registry.get("notification.sent.count")
                .tag("channel", "ADMIN_PRIVATE_MESSAGE").tag("status", "success").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    void alertAutoBan_oneAdminUnreachable_othersStillAlerted() {
        alertsEnabled(true);
        when(membershipRepository.findAdmins("C-1")).thenReturn(List.of("42", "43"));
        doThrow(new PlatformException(null, "bot was blocked by the user"))
                .when(platformGateway).sendPrivateMessage(eq("42"), anyString());

        service.alertAutoBan(decision, outcome);

        verify(platformGateway).sendPrivateMessage(eq("43"), anyString());
        assertThat(registry.get("notification.sent.count")
                .tag("status", "error").counter().count()).isEqualTo(1.0);
    }

    @Test
    void alertAutoBan_alertsDisabled_noMessages() {
        alertsEnabled(false);

        service.alertAutoBan(decision, outcome);

        verifyNoInteractions(platformGateway, membershipRepository);
    }
}
