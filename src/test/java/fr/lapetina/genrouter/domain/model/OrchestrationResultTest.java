package fr.lapetina.genrouter.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrchestrationResultTest {

    private final GenerationRequest request = GenerationRequest.text("pro", "hello");

    @Test
    @DisplayName("should bill a success from the provider's unit price and credit weight")
    void shouldBillSuccess() {
        ProviderDescriptor provider = ProviderDescriptor.builder()
                .id("provider-a").modality(Modality.TEXT).unitPrice("0.001").creditWeight(2).build();

        OrchestrationResult result = OrchestrationResult.success(
                request, provider, GenerationOutput.text("hi", 100), Duration.ofMillis(10));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.billedUnits()).isEqualTo(100);
        assertThat(result.cost()).isEqualByComparingTo("0.1");
        assertThat(result.creditsCharged()).isEqualTo(200);
    }

    @Test
    @DisplayName("should never bill a failure")
    void shouldNotBillFailure() {
        OrchestrationResult result = new OrchestrationResult(
                request.requestId(), request.correlationId(), null, null,
                50, BigDecimal.TEN, 50, FailureKind.ALL_PROVIDERS_EXHAUSTED, "all failed",
                List.of(new AttemptFailure("provider-a", FailureKind.PROVIDER_ERROR, "boom")),
                Duration.ZERO, false);

        assertThat(result.billedUnits()).isZero();
        assertThat(result.cost()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(result.creditsCharged()).isZero();
    }

    @Test
    @DisplayName("should only accept terminal kinds for a failure")
    void shouldRejectPerAttemptKind() {
        assertThatThrownBy(() -> OrchestrationResult.rejected(request, FailureKind.PROVIDER_TIMEOUT, "x"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should default the correlation id to the request id")
    void shouldDefaultCorrelationId() {
        assertThat(request.correlationId()).isEqualTo(request.requestId());
    }

    @Test
    @DisplayName("should clamp remaining time at zero once the deadline has passed")
    void shouldClampRemaining() {
        Instant now = Instant.parse("2024-01-01T00:00:00Z");
        GenerationRequest withDeadline = GenerationRequest.builder()
                .modality(Modality.TEXT).tier("pro").prompt("x").deadline(now.plusSeconds(5)).build();

        assertThat(withDeadline.remaining(now)).isEqualTo(Duration.ofSeconds(5));
        assertThat(withDeadline.remaining(now.plusSeconds(9))).isEqualTo(Duration.ZERO);
        assertThat(request.remaining(now)).isNull();
    }

    @Test
    @DisplayName("should zero billed units on a failed attempt record")
    void shouldZeroUnitsOnFailedAttempt() {
        AttemptRecord attempt = new AttemptRecord(Instant.now(), "cid", 0, "provider-a", Modality.TEXT, "pro",
                AttemptRecord.Outcome.FAILURE, FailureKind.PROVIDER_ERROR, Duration.ZERO, 42);

        assertThat(attempt.billedUnits()).isZero();
    }
}
