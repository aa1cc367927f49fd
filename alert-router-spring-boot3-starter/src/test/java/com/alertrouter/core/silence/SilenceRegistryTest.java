package com.alertrouter.core.silence;

import static com.alertrouter.support.Alerts.alert;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.alertrouter.core.serializer.JacksonPayloadSerializer;
import com.alertrouter.core.store.InMemoryStateStore;
import com.alertrouter.exception.ValidationException;
import com.alertrouter.model.Silence;
import com.alertrouter.model.enums.StateNamespace;
import com.alertrouter.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SilenceRegistryTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private MutableClock clock;
    private InMemoryStateStore store;
    private SilenceRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new InMemoryStateStore();
        registry = new SilenceRegistry(store, new JacksonPayloadSerializer(), clock);
    }

    @Test
    void shouldDefaultIdToLabelAndRegex() {
        // when
        String id = registry.create("severity", "^critical$", T0.plus(Duration.ofHours(1)));

        // then
        assertThat(id).isEqualTo("severity:^critical$");
        assertThat(store.get(StateNamespace.SILENCE, id)).isPresent();
    }

    @Test
    void shouldSilenceMatchingAlert() {
        // given
        registry.create("severity", "^critical$", T0.plus(Duration.ofHours(1)));

        // when/then
        assertThat(registry.isSilenced(alert("severity", "critical", "instance", "db1"))).isTrue();
        assertThat(registry.isSilenced(alert("severity", "warning"))).isFalse();
        assertThat(registry.isSilenced(alert("instance", "db1"))).isFalse();
    }

    @Test
    void shouldUseSubstringSearchSemantics() {
        // given
        registry.create("instance", "db", T0.plus(Duration.ofHours(1)));

        // when/then
        assertThat(registry.isSilenced(alert("instance", "mysql-db-3"))).isTrue();
    }

    @Test
    void shouldIgnoreExpiredSilence() {
        // given
        registry.create("severity", "^critical$", T0.plus(Duration.ofMinutes(5)));

        // when
        clock.advance(Duration.ofMinutes(6));

        // then
        assertThat(registry.isSilenced(alert("severity", "critical"))).isFalse();
    }

    @Test
    void shouldStillSilenceAtExactExpiry() {
        // given
        registry.create("severity", "^critical$", T0.plus(Duration.ofMinutes(5)));

        // when
        clock.advance(Duration.ofMinutes(5));

        // then
        assertThat(registry.isSilenced(alert("severity", "critical"))).isTrue();
    }

    @Test
    void shouldRejectInvalidRegex() {
        assertThatThrownBy(() -> registry.create("severity", "([", T0.plusSeconds(60)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("invalid silence regex");
        assertThat(store.scan(StateNamespace.SILENCE)).isEmpty();
    }

    @Test
    void shouldRejectMissingFields() {
        assertThatThrownBy(() -> registry.create(" ", "x", T0))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> registry.create("severity", "", T0))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> registry.create("severity", "x", null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldListOnlyActiveByDefault() {
        // given
        registry.create("b", "x", T0.plus(Duration.ofMinutes(1)));
        registry.create("a", "y", T0.plus(Duration.ofHours(1)));
        clock.advance(Duration.ofMinutes(2));

        // when
        List<Silence> active = registry.list(false);
        List<Silence> all = registry.list(true);

        // then
        assertThat(active).extracting(Silence::getId).containsExactly("a:y");
        assertThat(all).extracting(Silence::getId).containsExactly("a:y", "b:x");
    }

    @Test
    void shouldReplaceSilenceWithSameId() {
        // given
        registry.create("maint", "severity", "^critical$", T0.plus(Duration.ofMinutes(1)));

        // when
        registry.create("maint", "severity", "^critical$", T0.plus(Duration.ofHours(2)));

        // then
        assertThat(registry.list(true)).singleElement()
                .extracting(Silence::getExpiresAt)
                .isEqualTo(T0.plus(Duration.ofHours(2)));
    }

    @Test
    void shouldDeleteById() {
        // given
        String id = registry.create("severity", "^critical$", T0.plus(Duration.ofHours(1)));

        // when/then
        assertThat(registry.delete(id)).isTrue();
        assertThat(registry.delete(id)).isFalse();
        assertThat(registry.isSilenced(alert("severity", "critical"))).isFalse();
    }

    @Test
    void shouldSkipUndecodableEntries() {
        // given
        store.set(StateNamespace.SILENCE, "broken", "{not json");
        registry.create("severity", "^critical$", T0.plus(Duration.ofHours(1)));

        // when/then
        assertThat(registry.isSilenced(alert("severity", "critical"))).isTrue();
        assertThat(registry.list(true)).hasSize(1);
    }

    @Test
    void shouldCacheOnePatternPerSilenceAndEvictOnDelete() {
        // given
        for (int i = 0; i < 20; i++) {
            String id = registry.create("instance", "^host" + i + "$", T0.plus(Duration.ofHours(1)));
            registry.delete(id);
        }
        String kept = registry.create("instance", "^db1$", T0.plus(Duration.ofHours(1)));

        // when
        registry.isSilenced(alert("instance", "db1"));

        // then
        assertThat(registry.cachedPatternCount()).isEqualTo(1);
        registry.delete(kept);
        assertThat(registry.cachedPatternCount()).isZero();
    }

    @Test
    void shouldRecompileWhenStoredRegexChangesUnderSameId() {
        // given
        registry.create("mute", "severity", "^critical$", T0.plus(Duration.ofHours(1)));
        assertThat(registry.isSilenced(alert("severity", "critical"))).isTrue();
        Silence rewritten = Silence.builder()
                .id("mute").label("severity").regex("^warning$").expiresAt(T0.plus(Duration.ofHours(1))).build();
        store.set(StateNamespace.SILENCE, "mute", new JacksonPayloadSerializer().serialize(rewritten));

        // when/then
        assertThat(registry.isSilenced(alert("severity", "critical"))).isFalse();
        assertThat(registry.isSilenced(alert("severity", "warning"))).isTrue();
        assertThat(registry.cachedPatternCount()).isEqualTo(1);
    }
}
