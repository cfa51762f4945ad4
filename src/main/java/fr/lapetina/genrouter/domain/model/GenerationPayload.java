package fr.lapetina.genrouter.domain.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Provider-agnostic generation input. The orchestrator passes it through untouched;
 * adapters translate it to their provider's wire format.
 */
public record GenerationPayload(
        String prompt,
        List<Message> messages,
        List<String> images,
        Map<String, Object> options
) {
    public GenerationPayload {
        messages = messages != null ? List.copyOf(messages) : List.of();
        images = images != null ? List.copyOf(images) : List.of();
        options = options != null ? Map.copyOf(options) : Map.of();
    }

    /**
     * Chat message for conversation-style requests.
     */
    public record Message(String role, String content) {
        public Message {
            Objects.requireNonNull(role, "Role is required");
            Objects.requireNonNull(content, "Content is required");
        }
    }

    public static GenerationPayload ofPrompt(String prompt) {
        return new GenerationPayload(prompt, null, null, null);
    }

    public static GenerationPayload ofPrompt(String prompt, Map<String, Object> options) {
        return new GenerationPayload(prompt, null, null, options);
    }

    public static GenerationPayload ofChat(List<Message> messages) {
        return new GenerationPayload(null, messages, null, null);
    }

    public boolean isChat() {
        return !messages.isEmpty();
    }

    public boolean hasContent() {
        return (prompt != null && !prompt.isBlank()) || !messages.isEmpty();
    }

    /**
     * Total characters across the prompt and every message.
     */
    public int length() {
        int length = prompt != null ? prompt.length() : 0;
        for (Message message : messages) {
            length += message.content().length();
        }
        return length;
    }
}
