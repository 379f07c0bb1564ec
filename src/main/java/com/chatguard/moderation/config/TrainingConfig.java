package com.chatguard.moderation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "training")
public class TrainingConfig {
    private int maxImplicitSamples = 500;                // most recent automatic samples kept per label
    private int minTextLength = 10;
    private int autoLabelMinConfidence = 95;             // automatic SPAM decisions at or above this become samples
    private int modelRefreshMinutes = 30;
}
