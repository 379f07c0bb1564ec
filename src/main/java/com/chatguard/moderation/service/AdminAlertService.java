package com.chatguard.moderation.service;

import com.chatguard.moderation.config.MetricsConfig;
import com.chatguard.moderation.config.TwilioNotificationConfig;
import com.chatguard.moderation.model.ActionOutcome;
import com.chatguard.moderation.model.CheckResult;
import com.chatguard.moderation.model.CommunitySettings;
import com.chatguard.moderation.model.DetectionDecision;
import com.chatguard.moderation.platform.PlatformGateway;
import com.chatguard.moderation.repository.CommunityRepository;
import com.chatguard.moderation.repository.MembershipRepository;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.Comparator;

/**
 * Tells community admins about automatic bans: a private platform message to
 * each admin of the community when its settings ask for it, and an SMS (or
 * WhatsApp) message through Twilio to the on-call numbers when enabled.
 */
@Service
public class AdminAlertService {

    private static final Logger log = LoggerFactory.getLogger(AdminAlertService.class);

    private final TwilioNotificationConfig twilioConfig;
    private final PlatformGateway platformGateway;
    private final CommunityRepository communityRepository;
    private final MembershipRepository membershipRepository;
    private final MetricsConfig metricsConfig;

    public AdminAlertService(TwilioNotificationConfig twilioConfig,
                             PlatformGateway platformGateway,
                             CommunityRepository communityRepository,
                             MembershipRepository membershipRepository,
                             MetricsConfig metricsConfig) {
        this.twilioConfig = twilioConfig;
        this.platformGateway = platformGateway;
        this.communityRepository = communityRepository;
        this.membershipRepository = membershipRepository;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (twilioConfig.isEnabled()) {
            Twilio.init(twilioConfig.getAccountSid(), twilioConfig.getAuthToken());
            log.info("Twilio admin alerts initialized. Channel: {}", twilioConfig.getChannel());
        } else {
            log.info("Twilio admin alerts are DISABLED.");
        }
    }

    @Async
    @Observed(name = "notification.admin_alert", contextualName = "send-admin-alert")
    public void alertAutoBan(DetectionDecision decision, ActionOutcome outcome) {
        String body = buildMessageBody(decision, outcome);

        CommunitySettings settings = communityRepository.findById(decision.getCommunityId());
        if (settings != null && settings.isAdminAlerts()) {
            for (String adminId : membershipRepository.findAdmins(decision.getCommunityId())) {
                try {
                    platformGateway.sendPrivateMessage(adminId, body);
                    metricsConfig.recordNotification("ADMIN_PRIVATE_MESSAGE", "success");
                } catch (Exception e) {
                    metricsConfig.recordNotification("ADMIN_PRIVATE_MESSAGE", "error");
                    log.warn("Failed to alert admin {} of community {}: {}",
                            adminId, decision.getCommunityId(), e.getMessage());
                }
            }
        }

        if (!twilioConfig.isEnabled()) {
            return;
        }
        String from = resolveNumber(twilioConfig.getFromNumber());
        for (String number : twilioConfig.getAdminNumbers()) {
            try {
                Message message = Message.creator(
                        new PhoneNumber(resolveNumber(number)),
                        new PhoneNumber(from),
                        body
                ).create();

                metricsConfig.recordNotification(twilioConfig.getChannel(), "success");
                log.info("Auto-ban alert sent for account={}, sid={}", decision.getAccountId(), message.getSid());
            } catch (Exception e) {
                metricsConfig.recordNotification(twilioConfig.getChannel(), "error");
                log.error("Failed to send auto-ban alert for account={}: {}",
                        decision.getAccountId(), e.getMessage(), e);
            }
        }
    }

    private String buildMessageBody(DetectionDecision decision, ActionOutcome outcome) {
        String topCheck = decision.getCheckResults().stream()
                .filter(CheckResult::votesSpam)
                .max(Comparator.comparingInt(CheckResult::getConfidence))
                .map(r -> r.getCheckName().getDisplayName())
                .orElse("N/A");

        return String.format(
                "[SPAM ALERT] Account banned automatically\n" +
                "Account: %s\n" +
                "Community: %s\n" +
                "Message: %s\n" +
                "Confidence: %d%%\n" +
                "Top check: %s\n" +
                "Communities affected: %d (failed: %d)",
                decision.getAccountId(),
                decision.getCommunityId(),
                decision.getMessageId(),
                decision.getNetConfidence(),
                topCheck,
                outcome.getChatsAffected(),
                outcome.getChatsFailed()
        );
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(twilioConfig.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
