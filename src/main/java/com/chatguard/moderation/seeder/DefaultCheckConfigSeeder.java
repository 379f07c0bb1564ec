package com.chatguard.moderation.seeder;

import com.chatguard.moderation.engine.ContentCheck;
import com.chatguard.moderation.model.CheckConfig;
import com.chatguard.moderation.model.CheckName;
import com.chatguard.moderation.repository.CheckConfigRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;

/**
 * Creates the global configuration record of every registered check that
 * has none yet. Existing records are never touched.
 */
@Component
@Profile("!test")
@Order(1)
public class DefaultCheckConfigSeeder implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DefaultCheckConfigSeeder.class);

    private final CheckConfigRepository repository;
    private final List<ContentCheck> checks;
    private final Clock clock;

    public DefaultCheckConfigSeeder(CheckConfigRepository repository, List<ContentCheck> checks, Clock clock) {
        this.repository = repository;
        this.checks = checks;
        this.clock = clock;
    }

    @Override
    public void run(String... args) {
        int created = 0;
        for (ContentCheck check : checks) {
            CheckName name = check.getCheckName();
            if (repository.findById(name, null) != null) {
                continue;
            }
            repository.save(defaultFor(name));
            created++;
        }
        log.info("Check config seeding done: {} global records created, {} checks registered", created, checks.size());
    }

    CheckConfig defaultFor(CheckName name) {
        // the external lookup is opt-in; everything else votes from the start
        boolean enabled = name != CheckName.URL_REPUTATION;
        return CheckConfig.builder()
                .checkName(name)
                .communityId(null)
                .enabled(enabled)
                .useGlobal(false)
                .confidenceThreshold(defaultThreshold(name))
                .alwaysRun(false)
                .weight(1.0)
                .timeoutMs(name == CheckName.URL_REPUTATION ? 4000 : 0)
                .params(new HashMap<>())
                .modifiedBy("SYSTEM:seeder")
                .modifiedAt(clock.millis())
                .build();
    }

    private static int defaultThreshold(CheckName name) {
        switch (name) {
            case STOP_WORDS:
                return 30;
            case SIMILARITY:
            case BAYES:
                return 60;
            default:
                return 40;
        }
    }
}
