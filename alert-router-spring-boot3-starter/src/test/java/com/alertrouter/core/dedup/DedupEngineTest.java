package com.alertrouter.core.dedup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.alertrouter.core.store.InMemoryStateStore;
import com.alertrouter.exception.StoreException;
import com.alertrouter.model.enums.StateNamespace;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DedupEngineTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
    private static final Duration WINDOW = Duration.ofMinutes(2);

    private InMemoryStateStore store;
    private DedupEngine dedup;

    @BeforeEach
    void setUp() {
        store = new InMemoryStateStore();
        dedup = new DedupEngine(store);
    }

    @Test
    void shouldAdmitFirstSighting() {
        assertThat(dedup.shouldSuppress("fp", WINDOW, T0)).isFalse();
    }

    @Test
    void shouldSuppressWithinWindow() {
        // given
        dedup.markSeen("fp", T0);

        // when/then
        assertThat(dedup.shouldSuppress("fp", WINDOW, T0.plusSeconds(1))).isTrue();
        assertThat(dedup.shouldSuppress("fp", WINDOW, T0.plus(WINDOW).minusMillis(1))).isTrue();
    }

    @Test
    void shouldAdmitOnceWindowElapsed() {
        // given
        dedup.markSeen("fp", T0);

        // when/then
        assertThat(dedup.shouldSuppress("fp", WINDOW, T0.plus(WINDOW))).isFalse();
    }

    @Test
    void shouldNotExtendWindowOnSuppressedOccurrence() {
        // given
        dedup.markSeen("fp", T0);

        // when
        boolean suppressed = dedup.shouldSuppress("fp", WINDOW, T0.plusSeconds(90));

        // then
        assertThat(suppressed).isTrue();
        assertThat(dedup.lastSeen("fp")).contains(T0);
        assertThat(dedup.shouldSuppress("fp", WINDOW, T0.plusSeconds(121))).isFalse();
    }

    @Test
    void shouldNeverMoveLastSeenBackwards() {
        // given
        dedup.markSeen("fp", T0.plusSeconds(60));

        // when
        dedup.markSeen("fp", T0);

        // then
        assertThat(dedup.lastSeen("fp")).contains(T0.plusSeconds(60));
    }

    @Test
    void shouldKeepFingerprintsIndependent() {
        // given
        dedup.markSeen("a", T0);

        // when/then
        assertThat(dedup.shouldSuppress("b", WINDOW, T0)).isFalse();
    }

    @Test
    void shouldAdmitThenSuppressThenAdmitAfterWindow() {
        // when
        boolean first = dedup.tryAdmit("fp", WINDOW, T0);
        boolean repeat = dedup.tryAdmit("fp", WINDOW, T0.plusSeconds(30));
        boolean later = dedup.tryAdmit("fp", WINDOW, T0.plus(WINDOW));

        // then
        assertThat(first).isTrue();
        assertThat(repeat).isFalse();
        assertThat(later).isTrue();
        assertThat(dedup.lastSeen("fp")).contains(T0.plus(WINDOW));
    }

    @Test
    void shouldAdmitExactlyOneOfConcurrentSightings() throws Exception {
        // given
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            results.add(pool.submit(() -> {
                go.await();
                return dedup.tryAdmit("fp", WINDOW, T0);
            }));
        }

        // when
        go.countDown();
        int admitted = 0;
        for (Future<Boolean> f : results) {
            if (f.get(5, TimeUnit.SECONDS)) {
                admitted++;
            }
        }
        pool.shutdown();

        // then
        assertThat(admitted).isEqualTo(1);
    }

    @Test
    void shouldReportCorruptRecordAsStoreFailure() {
        // given
        store.set(StateNamespace.DEDUPE, "fp", "garbage");

        // when/then
        assertThatThrownBy(() -> dedup.tryAdmit("fp", WINDOW, T0))
                .isInstanceOf(StoreException.class)
                .hasMessageContaining("fp=fp")
                .hasCauseInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> dedup.shouldSuppress("fp", WINDOW, T0))
                .isInstanceOf(StoreException.class);
    }
}
