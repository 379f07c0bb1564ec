package com.chatguard.moderation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "notification.twilio")
public class TwilioNotificationConfig {

    private String accountSid;
    private String authToken;
    private String fromNumber;
    private List<String> adminNumbers = new ArrayList<>();
    private boolean enabled = false;
    private String channel = "sms";  // "sms" or "whatsapp"
}
