package fr.lapetina.genrouter.domain.model;

import java.util.Map;
import java.util.Objects;

/**
 * What a provider adapter hands back on success.
 *
 * @param content     generated text, or an image reference (URL or base64 data)
 * @param mimeType    content type of {@code content}
 * @param billedUnits metered quantity charged by the provider (tokens or images)
 * @param metadata    adapter-specific extras (model name, finish reason, ...)
 */
public record GenerationOutput(
        String content,
        String mimeType,
        long billedUnits,
        Map<String, Object> metadata
) {
    public GenerationOutput {
        Objects.requireNonNull(content, "Content is required");
        if (billedUnits < 0) {
            throw new IllegalArgumentException("Billed units must not be negative");
        }
        if (mimeType == null) {
            mimeType = "text/plain";
        }
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static GenerationOutput text(String content, long tokens) {
        return new GenerationOutput(content, "text/plain", tokens, null);
    }

    public static GenerationOutput image(String reference, String mimeType, long images) {
        return new GenerationOutput(reference, mimeType, images, null);
    }
}
