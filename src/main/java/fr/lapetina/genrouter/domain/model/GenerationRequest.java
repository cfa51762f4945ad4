package fr.lapetina.genrouter.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A request to generate content for a caller of a given subscription tier.
 * Immutable and thread-safe.
 *
 * The correlation id identifies the caller's logical request: resubmitting with
 * the same correlation id never produces a second billed generation. The
 * deadline, when present, bounds the whole failover ladder.
 */
public record GenerationRequest(
        String requestId,
        String correlationId,
        Modality modality,
        String tier,
        GenerationPayload payload,
        Instant createdAt,
        Instant deadline
) {
    public GenerationRequest {
        Objects.requireNonNull(modality, "Modality is required");
        Objects.requireNonNull(tier, "Tier is required");
        Objects.requireNonNull(payload, "Payload is required");
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        if (correlationId == null) {
            correlationId = requestId;
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public static GenerationRequest text(String tier, String prompt) {
        return new GenerationRequest(
                null, null, Modality.TEXT, tier, GenerationPayload.ofPrompt(prompt), null, null
        );
    }

    public static GenerationRequest chat(String tier, List<GenerationPayload.Message> messages) {
        return new GenerationRequest(
                null, null, Modality.TEXT, tier, GenerationPayload.ofChat(messages), null, null
        );
    }

    public static GenerationRequest image(String tier, String prompt) {
        return new GenerationRequest(
                null, null, Modality.IMAGE, tier, GenerationPayload.ofPrompt(prompt), null, null
        );
    }

    public boolean hasDeadline() {
        return deadline != null;
    }

    /**
     * Time left before the deadline, or {@code null} when the request has none.
     */
    public Duration remaining(Instant now) {
        if (deadline == null) {
            return null;
        }
        Duration remaining = Duration.between(now, deadline);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String requestId;
        private String correlationId;
        private Modality modality;
        private String tier;
        private GenerationPayload payload;
        private Instant createdAt;
        private Instant deadline;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder modality(Modality modality) {
            this.modality = modality;
            return this;
        }

        public Builder tier(String tier) {
            this.tier = tier;
            return this;
        }

        public Builder payload(GenerationPayload payload) {
            this.payload = payload;
            return this;
        }

        public Builder prompt(String prompt) {
            this.payload = GenerationPayload.ofPrompt(prompt);
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder deadline(Instant deadline) {
            this.deadline = deadline;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.deadline = Instant.now().plus(timeout);
            return this;
        }

        public GenerationRequest build() {
            return new GenerationRequest(
                    requestId, correlationId, modality, tier, payload, createdAt, deadline
            );
        }
    }
}
