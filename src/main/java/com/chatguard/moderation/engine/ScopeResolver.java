package com.chatguard.moderation.engine;

import com.chatguard.moderation.model.CheckConfig;
import com.chatguard.moderation.model.CheckConfigSnapshot;
import com.chatguard.moderation.model.CheckName;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Picks the configuration that applies to one check in one community.
 *
 * A community override wins unless it is absent or marked use-global, in which
 * case the global record is returned unchanged. Fields are never mixed between
 * the two levels. No record at either level means the check is disabled.
 */
@Component
public class ScopeResolver {

    public Optional<CheckConfig> resolve(CheckName checkName, CheckConfigSnapshot snapshot) {
        CheckConfig override = snapshot.overrides().get(checkName);
        if (override != null && !override.isUseGlobal()) {
            return Optional.of(override);
        }
        return Optional.ofNullable(snapshot.globals().get(checkName));
    }
}
