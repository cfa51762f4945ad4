package fr.lapetina.genrouter.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.genrouter.domain.event.GenerationRequestEvent;
import fr.lapetina.genrouter.domain.model.GenerationPayload;
import fr.lapetina.genrouter.domain.model.GenerationRequest;
import fr.lapetina.genrouter.domain.model.Modality;
import fr.lapetina.genrouter.infrastructure.registry.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First stage handler: rejects requests that can never be routed.
 *
 * Validates:
 * - Request is not null
 * - Tier is known, as soon as the catalog declares any tier
 * - Prompt or messages are present; image requests need a prompt
 * - Content size is within limits
 */
public final class ValidationHandler implements EventHandler<GenerationRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(ValidationHandler.class);

    private final ProviderRegistry registry;
    private final int maxPromptLength;

    public ValidationHandler(ProviderRegistry registry, int maxPromptLength) {
        this.registry = registry;
        this.maxPromptLength = maxPromptLength;
    }

    @Override
    public void onEvent(GenerationRequestEvent event, long sequence, boolean endOfBatch) {
        event.setSequence(sequence);
        if (event.shouldSkip()) {
            return;
        }

        GenerationRequest request = event.getRequest();
        try {
            validate(request);
            event.markValidated();

            log.debug("Request validated: requestId={}, tier={}, modality={}, sequence={}",
                    request.requestId(), request.tier(), request.modality(), sequence);

        } catch (ValidationException e) {
            event.markValidationFailed(e.getMessage());

            log.warn("Validation failed: requestId={}, tier={}, reason={}, sequence={}",
                    request != null ? request.requestId() : "null",
                    request != null ? request.tier() : "null",
                    e.getMessage(),
                    sequence);
        }
    }

    void validate(GenerationRequest request) throws ValidationException {
        if (request == null) {
            throw new ValidationException("Request is null");
        }

        String tier = request.tier();
        if (tier.isBlank()) {
            throw new ValidationException("Tier is required");
        }
        if (!registry.knownTiers().isEmpty() && !registry.isKnownTier(tier)) {
            throw new ValidationException("Unknown tier: " + tier);
        }

        GenerationPayload payload = request.payload();
        if (!payload.hasContent()) {
            throw new ValidationException("Either prompt or messages must be provided");
        }
        if (request.modality() == Modality.IMAGE && (payload.prompt() == null || payload.prompt().isBlank())) {
            throw new ValidationException("Image generation requires a prompt");
        }

        for (GenerationPayload.Message message : payload.messages()) {
            if (message.role().isBlank()) {
                throw new ValidationException("Message role is required");
            }
        }

        if (payload.length() > maxPromptLength) {
            throw new ValidationException("Content exceeds maximum length of " + maxPromptLength);
        }
    }

    static final class ValidationException extends Exception {
        ValidationException(String message) {
            super(message);
        }
    }
}
