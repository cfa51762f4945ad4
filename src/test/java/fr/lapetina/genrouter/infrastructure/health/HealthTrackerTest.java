package fr.lapetina.genrouter.infrastructure.health;

import fr.lapetina.genrouter.domain.model.CircuitState;
import fr.lapetina.genrouter.domain.model.FailureKind;
import fr.lapetina.genrouter.domain.model.HealthState;
import fr.lapetina.genrouter.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class HealthTrackerTest {

    private MutableClock clock;
    private HealthTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        tracker = new HealthTracker(
                new ProviderCircuitBreaker.Settings(3, Duration.ofSeconds(60), 2.0, Duration.ofMinutes(10)),
                clock
        );
        tracker.register(List.of("provider-a", "provider-c"));
    }

    private void failC(int times) {
        for (int i = 0; i < times; i++) {
            tracker.recordOutcome("provider-c", false, FailureKind.PROVIDER_ERROR);
        }
    }

    @Test
    @DisplayName("should start every registered provider CLOSED")
    void shouldStartClosed() {
        Map<String, HealthState> snapshot = tracker.snapshot();

        assertThat(snapshot).containsOnlyKeys("provider-a", "provider-c");
        assertThat(snapshot.values()).allMatch(s -> s.status() == CircuitState.CLOSED);
    }

    @Test
    @DisplayName("should exclude a provider after threshold failures until the cooldown ends")
    void shouldExcludeUntilCooldownEnds() {
        failC(3);

        assertThat(tracker.isEligible("provider-c")).isFalse();
        assertThat(tracker.isEligible("provider-a")).isTrue();

        clock.advance(Duration.ofSeconds(59));
        assertThat(tracker.isEligible("provider-c")).isFalse();

        clock.advance(Duration.ofSeconds(1));
        assertThat(tracker.isEligible("provider-c")).isTrue();
        assertThat(tracker.acquire("provider-c")).isEqualTo(Admission.TRIAL);
    }

    @Test
    @DisplayName("should not hold cancellations against the provider")
    void shouldIgnoreNonProviderFailures() {
        tracker.recordOutcome("provider-c", false, FailureKind.CANCELLED);
        tracker.recordOutcome("provider-c", false, FailureKind.CANCELLED);
        tracker.recordOutcome("provider-c", false, FailureKind.CANCELLED);

        assertThat(tracker.getState("provider-c").consecutiveFailures()).isZero();
        assertThat(tracker.isEligible("provider-c")).isTrue();
    }

    @Test
    @DisplayName("should count timeouts and rate limits against the provider")
    void shouldCountTimeoutsAndRateLimits() {
        tracker.recordOutcome("provider-c", false, FailureKind.PROVIDER_TIMEOUT);
        tracker.recordOutcome("provider-c", false, FailureKind.PROVIDER_RATE_LIMITED);

        assertThat(tracker.getState("provider-c").consecutiveFailures()).isEqualTo(2);
    }

    @Test
    @DisplayName("should let exactly one concurrent request take the half-open trial")
    void shouldGrantOneTrialUnderContention() throws Exception {
        failC(3);
        clock.advance(Duration.ofSeconds(61));

        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Admission>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return tracker.acquire("provider-c");
                }));
            }
            start.countDown();

            int trials = 0;
            for (Future<Admission> result : results) {
                if (result.get(5, TimeUnit.SECONDS) == Admission.TRIAL) {
                    trials++;
                }
            }
            assertThat(trials).isEqualTo(1);
            assertThat(tracker.isEligible("provider-c")).isFalse();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("should keep history for providers registered again")
    void shouldKeepStateOnReRegister() {
        failC(2);

        tracker.register(List.of("provider-c"));

        assertThat(tracker.getState("provider-c").consecutiveFailures()).isEqualTo(2);
    }

    @Test
    @DisplayName("should reset one provider or all of them")
    void shouldReset() {
        failC(3);
        tracker.forceOpen("provider-a");

        tracker.reset("provider-c");
        assertThat(tracker.isEligible("provider-c")).isTrue();
        assertThat(tracker.isEligible("provider-a")).isFalse();

        tracker.reset();
        assertThat(tracker.isEligible("provider-a")).isTrue();
    }
}
