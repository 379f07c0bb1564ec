package com.chatguard.moderation.engine;

import com.chatguard.moderation.model.CheckConfig;
import com.chatguard.moderation.model.CheckConfigSnapshot;
import com.chatguard.moderation.model.CheckName;
import com.chatguard.moderation.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static com.chatguard.moderation.testutil.TestDataFactory.createCheckConfig;
import static org.assertj.core.api.Assertions.assertThat;

class ScopeResolverTest {

    private final ScopeResolver resolver = new ScopeResolver();

    @Test
    void resolve_overridePresent_winsWholesale() {
        CheckConfig global = createCheckConfig(CheckName.STOP_WORDS, null, true, 50);
        global.setWeight(2.0);
        CheckConfig override = createCheckConfig(CheckName.STOP_WORDS, "C-1", false, 70);
        CheckConfigSnapshot snapshot = TestDataFactory.createSnapshot("C-1", List.of(global), List.of(override));

        Optional<CheckConfig> resolved = resolver.resolve(CheckName.STOP_WORDS, snapshot);

        assertThat(resolved).contains(override);
        // no field merging with the global record
        assertThat(resolved.get().getWeight()).isEqualTo(1.0);
        assertThat(resolved.get().isEnabled()).isFalse();
    }

    @Test
    void resolve_overrideMarkedUseGlobal_returnsGlobal() {
        CheckConfig global = createCheckConfig(CheckName.STOP_WORDS, null, true, 50);
        CheckConfig override = createCheckConfig(CheckName.STOP_WORDS, "C-1", false, 70);
        override.setUseGlobal(true);
        CheckConfigSnapshot snapshot = TestDataFactory.createSnapshot("C-1", List.of(global), List.of(override));

        assertThat(resolver.resolve(CheckName.STOP_WORDS, snapshot)).contains(global);
    }

    @Test
    void resolve_noOverride_returnsGlobal() {
        CheckConfig global = createCheckConfig(CheckName.SPACING, null, true, 40);
        CheckConfigSnapshot snapshot = TestDataFactory.createSnapshot("C-1", List.of(global), Collections.emptyList());

        assertThat(resolver.resolve(CheckName.SPACING, snapshot)).contains(global);
    }

    @Test
    void resolve_noRecordAtEitherLevel_isEmpty() {
        CheckConfigSnapshot snapshot = TestDataFactory.createSnapshot("C-1",
                Collections.emptyList(), Collections.emptyList());

        assertThat(resolver.resolve(CheckName.BAYES, snapshot)).isEmpty();
    }
}
