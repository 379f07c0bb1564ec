package com.chatguard.moderation.model;

import java.util.Map;

/**
 * The two configuration levels that apply to one evaluation: the global
 * records and the overrides stored for the evaluated community.
 * Built once per evaluation and passed through the engine.
 */
public record CheckConfigSnapshot(String communityId,
                                  Map<CheckName, CheckConfig> globals,
                                  Map<CheckName, CheckConfig> overrides) {

    public CheckConfigSnapshot {
        globals = Map.copyOf(globals);
        overrides = Map.copyOf(overrides);
    }
}
