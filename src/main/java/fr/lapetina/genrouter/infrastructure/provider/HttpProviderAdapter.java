package fr.lapetina.genrouter.infrastructure.provider;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.genrouter.domain.model.FailureKind;
import fr.lapetina.genrouter.domain.model.GenerationOutput;
import fr.lapetina.genrouter.domain.model.GenerationPayload;
import fr.lapetina.genrouter.domain.model.Modality;
import fr.lapetina.genrouter.infrastructure.config.RouterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Generic JSON-over-HTTP provider adapter.
 *
 * Sends the payload as a JSON body with a bearer credential read from an environment
 * variable, and maps the provider's answer back to a {@link GenerationOutput}:
 * - 2xx: content is looked up in the usual places (content, response, choices, data)
 * - 429: rate limited, honouring Retry-After
 * - other 4xx: provider error, not retried
 * - 5xx and I/O errors: provider error, retried with backoff
 * - request timeout: provider timeout
 *
 * Raw provider bodies are never copied into exception messages.
 */
public class HttpProviderAdapter implements ProviderAdapter {

    private static final Logger log = LoggerFactory.getLogger(HttpProviderAdapter.class);

    private static final List<String> TEXT_CONTENT_PATHS = List.of(
            "/content", "/response", "/output", "/message/content", "/choices/0/message/content", "/choices/0/text"
    );
    private static final List<String> IMAGE_CONTENT_PATHS = List.of(
            "/data/0/url", "/data/0/b64_json", "/url", "/image"
    );

    private final String providerId;
    private final Modality modality;
    private final URI endpoint;
    private final String model;
    private final String credentialEnv;
    private final String usagePointer;
    private final RetryPolicy retryPolicy;
    private final Function<String, String> environment;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private HttpProviderAdapter(Builder builder) {
        this.providerId = Objects.requireNonNull(builder.providerId, "Provider ID is required");
        this.modality = Objects.requireNonNull(builder.modality, "Modality is required");
        this.endpoint = Objects.requireNonNull(builder.endpoint, "Endpoint is required");
        this.model = builder.model;
        this.credentialEnv = builder.credentialEnv;
        this.usagePointer = toPointer(builder.usageField != null
                ? builder.usageField
                : modality == Modality.TEXT ? "usage.total_tokens" : null);
        this.retryPolicy = builder.retryPolicy;
        this.environment = builder.environment;

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(builder.connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public String providerId() {
        return providerId;
    }

    @Override
    public boolean isAvailable() {
        return hasCredential();
    }

    /**
     * Whether the credential variable, if one is configured, holds a value.
     */
    public boolean hasCredential() {
        if (credentialEnv == null || credentialEnv.isBlank()) {
            return true;
        }
        String value = environment.apply(credentialEnv);
        return value != null && !value.isBlank();
    }

    @Override
    public CompletableFuture<GenerationOutput> invoke(GenerationPayload payload, Duration timeout) {
        CompletableFuture<GenerationOutput> result = new CompletableFuture<>();
        String body;
        try {
            body = buildRequestBody(payload);
        } catch (JsonProcessingException e) {
            result.completeExceptionally(ProviderException.error("Failed to encode request", false, e));
            return result;
        }
        attempt(body, Instant.now().plus(timeout), 0, result);
        return result;
    }

    private void attempt(String body, Instant deadline, int retries, CompletableFuture<GenerationOutput> result) {
        if (result.isDone()) {
            return;
        }
        Duration remaining = Duration.between(Instant.now(), deadline);
        if (remaining.isNegative() || remaining.isZero()) {
            result.completeExceptionally(ProviderException.timeout("Provider timeout budget exhausted", null));
            return;
        }

        HttpRequest request = buildHttpRequest(body, remaining);
        Instant startTime = Instant.now();
        log.debug("Sending request: providerId={}, endpoint={}, retry={}, timeoutMs={}",
                providerId, endpoint, retries, remaining.toMillis());

        CompletableFuture<HttpResponse<String>> call =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        result.whenComplete((output, throwable) -> {
            if (result.isCancelled()) {
                call.cancel(true);
            }
        });

        call.whenComplete((response, throwable) -> {
            long latencyMs = Duration.between(startTime, Instant.now()).toMillis();
            ProviderException failure;
            if (throwable != null) {
                failure = classifyException(throwable);
            } else if (response.statusCode() >= 200 && response.statusCode() < 300) {
                try {
                    GenerationOutput output = parseSuccessResponse(response.body());
                    log.debug("Request successful: providerId={}, status={}, latencyMs={}, billedUnits={}",
                            providerId, response.statusCode(), latencyMs, output.billedUnits());
                    result.complete(output);
                    return;
                } catch (ProviderException e) {
                    failure = e;
                }
            } else {
                failure = classifyStatus(response);
            }

            if (result.isCancelled() || failure.getKind() == FailureKind.CANCELLED) {
                log.debug("Provider call cancelled: providerId={}, latencyMs={}", providerId, latencyMs);
                result.completeExceptionally(failure);
                return;
            }

            if (retryPolicy.allowsRetry(retries, failure)) {
                Duration delay = retryPolicy.delayFor(retries + 1, failure.getRetryAfter());
                if (Instant.now().plus(delay).isBefore(deadline)) {
                    log.warn("Retrying provider call: providerId={}, kind={}, retry={}/{}, delayMs={}",
                            providerId, failure.getKind(), retries + 1, retryPolicy.maxRetries(), delay.toMillis());
                    CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS)
                            .execute(() -> attempt(body, deadline, retries + 1, result));
                    return;
                }
            }

            log.warn("Provider call failed: providerId={}, kind={}, message={}, latencyMs={}",
                    providerId, failure.getKind(), failure.getMessage(), latencyMs);
            result.completeExceptionally(failure);
        });
    }

    private HttpRequest buildHttpRequest(String body, Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));

        if (credentialEnv != null && !credentialEnv.isBlank()) {
            String credential = environment.apply(credentialEnv);
            if (credential != null && !credential.isBlank()) {
                builder.header("Authorization", "Bearer " + credential);
            }
        }
        return builder.build();
    }

    private String buildRequestBody(GenerationPayload payload) throws JsonProcessingException {
        Map<String, Object> body = new LinkedHashMap<>();
        if (model != null) {
            body.put("model", model);
        }

        if (payload.isChat()) {
            List<Map<String, String>> messages = payload.messages().stream()
                    .map(m -> Map.of("role", m.role(), "content", m.content()))
                    .toList();
            body.put("messages", messages);
        } else {
            body.put("prompt", payload.prompt());
        }

        if (!payload.images().isEmpty()) {
            body.put("images", payload.images());
        }
        if (!payload.options().isEmpty()) {
            body.put("options", payload.options());
        }

        return objectMapper.writeValueAsString(body);
    }

    private GenerationOutput parseSuccessResponse(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw ProviderException.error("Provider returned malformed JSON", false, e);
        }

        List<String> contentPaths = modality == Modality.TEXT ? TEXT_CONTENT_PATHS : IMAGE_CONTENT_PATHS;
        String contentPath = null;
        String content = null;
        for (String path : contentPaths) {
            JsonNode node = root.at(path);
            if (node.isTextual()) {
                contentPath = path;
                content = node.asText();
                break;
            }
        }
        if (content == null) {
            throw ProviderException.error("Provider response carried no content", false, null);
        }

        long billedUnits = billedUnits(root);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("provider", providerId);
        if (root.hasNonNull("model")) {
            metadata.put("model", root.get("model").asText());
        }

        if (modality == Modality.TEXT) {
            return new GenerationOutput(content, "text/plain", billedUnits, metadata);
        }
        String mimeType = contentPath.endsWith("b64_json") ? "image/png;base64" : "text/uri-list";
        return new GenerationOutput(content, mimeType, billedUnits, metadata);
    }

    private long billedUnits(JsonNode root) {
        if (usagePointer != null) {
            JsonNode usage = root.at(usagePointer);
            if (usage.canConvertToLong()) {
                return Math.max(0, usage.asLong());
            }
            log.debug("Usage field missing from response: providerId={}, field={}", providerId, usagePointer);
        }
        if (modality == Modality.IMAGE) {
            JsonNode data = root.path("data");
            return data.isArray() && data.size() > 0 ? data.size() : 1;
        }
        return 0;
    }

    private ProviderException classifyStatus(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status == 429) {
            return ProviderException.rateLimited(parseRetryAfter(response));
        }
        if (status >= 500) {
            return ProviderException.error("Provider returned HTTP " + status, true, null);
        }
        return ProviderException.error("Provider rejected request with HTTP " + status, false, null);
    }

    private static Duration parseRetryAfter(HttpResponse<String> response) {
        return response.headers().firstValue("Retry-After")
                .map(value -> {
                    try {
                        return Duration.ofSeconds(Long.parseLong(value.trim()));
                    } catch (NumberFormatException e) {
                        log.debug("Ignoring non-numeric Retry-After: {}", value);
                        return null;
                    }
                })
                .orElse(null);
    }

    static ProviderException classifyException(Throwable throwable) {
        Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null
                ? throwable.getCause()
                : throwable;

        if (cause instanceof CancellationException) {
            return new ProviderException(FailureKind.CANCELLED, "Provider call cancelled", false, null, cause);
        }
        if (cause instanceof HttpConnectTimeoutException) {
            return ProviderException.error("Connection to provider timed out", true, cause);
        }
        if (cause instanceof HttpTimeoutException) {
            return ProviderException.timeout("Provider did not answer in time", cause);
        }
        if (cause instanceof IOException) {
            return ProviderException.error("I/O error talking to provider: " + cause.getClass().getSimpleName(), true, cause);
        }
        return ProviderException.error("Unexpected failure calling provider: " + cause.getClass().getSimpleName(), false, cause);
    }

    /**
     * {@code usage.total_tokens} becomes {@code /usage/total_tokens}.
     */
    static String toPointer(String field) {
        if (field == null || field.isBlank()) {
            return null;
        }
        return field.startsWith("/") ? field : "/" + field.replace('.', '/');
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String providerId;
        private Modality modality;
        private URI endpoint;
        private String model;
        private String credentialEnv;
        private String usageField;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private RetryPolicy retryPolicy = RetryPolicy.NONE;
        private Function<String, String> environment = System::getenv;

        /**
         * Copies provider settings; connect timeout and retry come from the global sections.
         */
        public Builder fromConfig(RouterConfig.ProviderConfig provider, RouterConfig config) {
            RouterConfig.RetryConfig retry = config.getRetry();
            this.providerId = provider.getId();
            this.modality = Modality.fromString(provider.getModality());
            this.endpoint = URI.create(provider.getEndpoint());
            this.model = provider.getModel();
            this.credentialEnv = provider.getCredentialEnv();
            this.usageField = provider.getUsageField();
            this.connectTimeout = Duration.ofMillis(config.getTimeouts().getConnectTimeoutMs());
            this.retryPolicy = new RetryPolicy(
                    retry.getMaxRetries(),
                    Duration.ofMillis(retry.getInitialBackoffMs()),
                    Duration.ofMillis(retry.getMaxBackoffMs()),
                    retry.getBackoffMultiplier()
            );
            return this;
        }

        public Builder providerId(String providerId) {
            this.providerId = providerId;
            return this;
        }

        public Builder modality(Modality modality) {
            this.modality = modality;
            return this;
        }

        public Builder endpoint(URI endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder credentialEnv(String credentialEnv) {
            this.credentialEnv = credentialEnv;
            return this;
        }

        public Builder usageField(String usageField) {
            this.usageField = usageField;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder environment(Function<String, String> environment) {
            this.environment = environment;
            return this;
        }

        public HttpProviderAdapter build() {
            return new HttpProviderAdapter(this);
        }
    }
}
