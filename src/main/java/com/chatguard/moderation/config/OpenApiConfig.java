package com.chatguard.moderation.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI chatModerationOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Chat Moderation API")
                        .version("1.0.0")
                        .description(
                                "Spam detection and cross-community enforcement for federated chat communities.\n\n" +
                                "**Detection Pipeline:**\n" +
                                "1. Receive a message via `POST /messages/evaluate`\n" +
                                "2. Resolve effective per-check configuration (global default or community override)\n" +
                                "3. Run the enabled content checks in parallel, each with its own timeout\n" +
                                "4. Aggregate into a net confidence (0-100)\n" +
                                "5. Classify: **AUTO_BAN** (>= auto-ban threshold, unless vetoed), " +
                                "**REVIEW_QUEUE** (>= review threshold), otherwise **ALLOW**\n\n" +
                                "**Checks:**\n" +
                                "- `STOP_WORDS`: configured spam vocabulary\n" +
                                "- `SPACING`: letter-spaced obfuscation (\"f r e e  m o n e y\")\n" +
                                "- `INVISIBLE_CHARS`: zero-width and bidi control characters\n" +
                                "- `SIMILARITY`: near-duplicates of known spam\n" +
                                "- `BAYES`: naive Bayes trained from the training corpus\n" +
                                "- `URL_REPUTATION`: external URL reputation (rate limited, fails open)\n\n" +
                                "**Moderation:** ban, mute, tempban, trust, untrust and unban apply to every " +
                                "community the account is known to be in. Timed actions are lifted by the expiry reconciler.")
                        .contact(new Contact().name("Moderation Team")));
    }
}
