package com.chatguard.moderation.service;

import com.chatguard.moderation.model.AccountMembership;
import com.chatguard.moderation.model.CommunitySettings;
import com.chatguard.moderation.model.MemberRole;
import com.chatguard.moderation.repository.CommunityRepository;
import com.chatguard.moderation.repository.MembershipRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * What the platform adapter reports about communities and their members:
 * joins, leaves, role changes, private chats opened, per-community settings.
 */
@Service
public class CommunityService {

    private static final Logger log = LoggerFactory.getLogger(CommunityService.class);

    private final MembershipRepository membershipRepository;
    private final CommunityRepository communityRepository;
    private final Clock clock;

    public CommunityService(MembershipRepository membershipRepository,
                            CommunityRepository communityRepository,
                            Clock clock) {
        this.membershipRepository = membershipRepository;
        this.communityRepository = communityRepository;
        this.clock = clock;
    }

    public AccountMembership getMembership(String accountId) {
        return membershipRepository.findByAccountId(accountId);
    }

    public AccountMembership recordPresence(String accountId, String communityId, MemberRole role) {
        log.debug("Account {} present in {} as {}", accountId, communityId, role);
        return membershipRepository.recordPresence(accountId, communityId, role, clock.millis());
    }

    public AccountMembership recordDeparture(String accountId, String communityId) {
        log.debug("Account {} left {}", accountId, communityId);
        return membershipRepository.recordDeparture(accountId, communityId, clock.millis());
    }

    public AccountMembership markPrivateChatOpen(String accountId) {
        return membershipRepository.markPrivateChatOpen(accountId, clock.millis());
    }

    public List<CommunitySettings> getAllSettings() {
        return communityRepository.findAll();
    }

    public CommunitySettings getSettings(String communityId) {
        return communityRepository.findById(communityId);
    }

    public CommunitySettings saveSettings(CommunitySettings settings) {
        settings.setUpdatedAt(clock.millis());
        communityRepository.save(settings);
        log.info("Community {} settings saved: trainingMode={}, adminAlerts={}",
                settings.getCommunityId(), settings.isTrainingMode(), settings.isAdminAlerts());
        return settings;
    }
}
