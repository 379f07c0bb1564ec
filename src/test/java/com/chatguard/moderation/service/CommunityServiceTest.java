package com.chatguard.moderation.service;

import com.chatguard.moderation.model.AccountMembership;
import com.chatguard.moderation.model.CommunitySettings;
import com.chatguard.moderation.model.MemberRole;
import com.chatguard.moderation.repository.CommunityRepository;
import com.chatguard.moderation.repository.MembershipRepository;
import com.chatguard.moderation.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CommunityServiceTest {

    private static final long NOW = 1_700_000_000_000L;

    @Mock private MembershipRepository membershipRepository;
    @Mock private CommunityRepository communityRepository;

    private CommunityService service;

    @BeforeEach
    void setUp() {
        service = new CommunityService(membershipRepository, communityRepository,
                Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC));
    }

    @Test
    void recordPresence_stampsCurrentTime() {
        AccountMembership membership = TestDataFactory.createMembership("A-1", Map.of("C-1", MemberRole.ADMIN));
        when(membershipRepository.recordPresence("A-1", "C-1", MemberRole.ADMIN, NOW)).thenReturn(membership);

        assertThat(service.recordPresence("A-1", "C-1", MemberRole.ADMIN)).isSameAs(membership);
    }

    @Test
    void recordDeparture_stampsCurrentTime() {
        service.recordDeparture("A-1", "C-1");

        verify(membershipRepository).recordDeparture("A-1", "C-1", NOW);
    }

    @Test
    void markPrivateChatOpen_stampsCurrentTime() {
        service.markPrivateChatOpen("A-1");

        verify(membershipRepository).markPrivateChatOpen("A-1", NOW);
    }

    @Test
    void saveSettings_setsUpdatedAtAndPersists() {
        CommunitySettings settings = new CommunitySettings();
        settings.setCommunityId("C-1");
        settings.setTrainingMode(true);

        CommunitySettings saved = service.saveSettings(settings);

        assertThat(saved.getUpdatedAt()).isEqualTo(NOW);
        verify(communityRepository).save(settings);
    }
}
