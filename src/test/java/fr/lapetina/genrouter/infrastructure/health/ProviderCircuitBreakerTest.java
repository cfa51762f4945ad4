package fr.lapetina.genrouter.infrastructure.health;

import fr.lapetina.genrouter.domain.model.CircuitState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderCircuitBreakerTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private ProviderCircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        // 3 failures, 60s base cooldown doubling up to 5 minutes
        breaker = new ProviderCircuitBreaker("provider-c", new ProviderCircuitBreaker.Settings(
                3, Duration.ofSeconds(60), 2.0, Duration.ofMinutes(5)));
    }

    private void fail(int times, Instant at) {
        for (int i = 0; i < times; i++) {
            breaker.recordFailure(at);
        }
    }

    @Test
    @DisplayName("should start in CLOSED state")
    void shouldStartClosed() {
        assertThat(breaker.getState().status()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.isEligible(T0)).isTrue();
        assertThat(breaker.acquire(T0)).isEqualTo(Admission.ADMITTED);
    }

    @Nested
    @DisplayName("while CLOSED")
    class Closed {

        @Test
        @DisplayName("should open exactly at the failure threshold")
        void shouldOpenAtThreshold() {
            fail(2, T0);
            assertThat(breaker.getState().status()).isEqualTo(CircuitState.CLOSED);
            assertThat(breaker.getState().consecutiveFailures()).isEqualTo(2);

            breaker.recordFailure(T0);

            assertThat(breaker.getState().status()).isEqualTo(CircuitState.OPEN);
            assertThat(breaker.getState().cooldownUntil()).isEqualTo(T0.plusSeconds(60));
            assertThat(breaker.isEligible(T0.plusSeconds(59))).isFalse();
        }

        @Test
        @DisplayName("should reset the failure counter on a single success")
        void shouldResetCounterOnSuccess() {
            fail(2, T0);

            breaker.recordSuccess(T0);

            assertThat(breaker.getState().consecutiveFailures()).isZero();
            fail(2, T0);
            assertThat(breaker.getState().status()).isEqualTo(CircuitState.CLOSED);
        }
    }

    @Nested
    @DisplayName("after the cooldown")
    class HalfOpen {

        @BeforeEach
        void trip() {
            fail(3, T0);
        }

        @Test
        @DisplayName("should report HALF_OPEN once the cooldown has passed")
        void shouldReadAsHalfOpen() {
            assertThat(breaker.snapshot(T0.plusSeconds(30)).status()).isEqualTo(CircuitState.OPEN);
            assertThat(breaker.snapshot(T0.plusSeconds(60)).status()).isEqualTo(CircuitState.HALF_OPEN);
            assertThat(breaker.isEligible(T0.plusSeconds(60))).isTrue();
        }

        @Test
        @DisplayName("should grant a single trial slot")
        void shouldGrantSingleTrial() {
            Instant later = T0.plusSeconds(61);

            assertThat(breaker.acquire(later)).isEqualTo(Admission.TRIAL);
            assertThat(breaker.acquire(later)).isEqualTo(Admission.REJECTED);
            assertThat(breaker.isEligible(later)).isFalse();
        }

        @Test
        @DisplayName("should close when the trial succeeds")
        void shouldCloseOnTrialSuccess() {
            Instant later = T0.plusSeconds(61);
            breaker.acquire(later);

            breaker.recordSuccess(later);

            assertThat(breaker.getState().status()).isEqualTo(CircuitState.CLOSED);
            assertThat(breaker.getState().tripCount()).isZero();
            assertThat(breaker.getState().trialInFlight()).isFalse();
        }

        @Test
        @DisplayName("should reopen with a doubled cooldown when the trial fails")
        void shouldReopenWithBackoff() {
            Instant later = T0.plusSeconds(61);
            breaker.acquire(later);

            breaker.recordFailure(later);

            assertThat(breaker.getState().status()).isEqualTo(CircuitState.OPEN);
            assertThat(breaker.getState().tripCount()).isEqualTo(2);
            assertThat(breaker.getState().cooldownUntil()).isEqualTo(later.plusSeconds(120));
        }

        @Test
        @DisplayName("should let another request try after a trial slot is released")
        void shouldReleaseTrial() {
            Instant later = T0.plusSeconds(61);
            breaker.acquire(later);

            breaker.releaseTrial();

            assertThat(breaker.getState().status()).isEqualTo(CircuitState.HALF_OPEN);
            assertThat(breaker.acquire(later)).isEqualTo(Admission.TRIAL);
        }
    }

    @Test
    @DisplayName("should cap the cooldown at the configured maximum")
    void shouldCapCooldown() {
        assertThat(breaker.cooldownForTrip(1)).isEqualTo(Duration.ofSeconds(60));
        assertThat(breaker.cooldownForTrip(2)).isEqualTo(Duration.ofSeconds(120));
        assertThat(breaker.cooldownForTrip(3)).isEqualTo(Duration.ofSeconds(240));
        assertThat(breaker.cooldownForTrip(4)).isEqualTo(Duration.ofMinutes(5));
        assertThat(breaker.cooldownForTrip(10)).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    @DisplayName("should support forced transitions and reset")
    void shouldSupportAdminTransitions() {
        breaker.forceOpen(T0);
        assertThat(breaker.isEligible(T0)).isFalse();

        breaker.forceClose(T0);
        assertThat(breaker.isEligible(T0)).isTrue();

        fail(3, T0);
        breaker.reset();
        assertThat(breaker.getState().status()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.getState().consecutiveFailures()).isZero();
    }

    @Test
    @DisplayName("should reject invalid settings")
    void shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> new ProviderCircuitBreaker.Settings(0, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(5)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ProviderCircuitBreaker.Settings(3, Duration.ofSeconds(1), 0.5, Duration.ofSeconds(5)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
