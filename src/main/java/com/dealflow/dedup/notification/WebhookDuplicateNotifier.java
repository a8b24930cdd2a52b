package com.dealflow.dedup.notification;

import com.dealflow.dedup.metrics.MetricsService;
import com.dealflow.dedup.metrics.NoOpMetricsService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Posts each event as JSON to a webhook endpoint.
 *
 * <p>The body is an envelope {@code {id, eventType, payload, timestamp}}; the event type,
 * id and timestamp are repeated in {@code X-Webhook-*} headers. When a secret is configured
 * the body is signed with HMAC-SHA256 in {@code X-Webhook-Signature}.</p>
 *
 * <p>Delivery is asynchronous. Failures, including non-2xx responses, are logged and
 * counted; they never reach the caller.</p>
 *
 * <pre>
 * DuplicateNotifier notifier = WebhookDuplicateNotifier.builder()
 *     .url("https://hooks.example.com/duplicates")
 *     .secret(System.getenv("WEBHOOK_SECRET"))
 *     .build();
 * </pre>
 */
public class WebhookDuplicateNotifier implements DuplicateNotifier {
    private static final Logger log = LoggerFactory.getLogger(WebhookDuplicateNotifier.class);

    static final String SIDE_EFFECT = "webhook";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final URI endpoint;
    private final String secret;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final MetricsService metricsService;

    private WebhookDuplicateNotifier(Builder builder) {
        this.endpoint = URI.create(Objects.requireNonNull(builder.url, "url is required"));
        this.secret = builder.secret;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = builder.httpClient != null
                ? builder.httpClient
                : HttpClient.newBuilder().connectTimeout(timeout).build();
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
    }

    @Override
    public void notifyDuplicate(DuplicateDetectedEvent event) {
        send(event);
    }

    /**
     * Sends the event and returns the pending delivery. The future completes
     * with {@code true} on a 2xx response and {@code false} on any failure.
     */
    public CompletableFuture<Boolean> send(DuplicateDetectedEvent event) {
        WebhookEnvelope envelope = WebhookEnvelope.wrap(event);
        String body;
        try {
            body = objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize {} event {}: {}", envelope.eventType(), envelope.id(), e.getMessage());
            metricsService.incrementSideEffectFailure(SIDE_EFFECT);
            return CompletableFuture.completedFuture(false);
        }

        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("X-Webhook-Event", envelope.eventType())
                .header("X-Webhook-ID", envelope.id())
                .header("X-Webhook-Timestamp", envelope.timestamp().toString())
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (secret != null && !secret.isEmpty()) {
            try {
                request.header("X-Webhook-Signature", sign(body));
            } catch (GeneralSecurityException e) {
                log.warn("Failed to sign webhook event {}: {}", envelope.id(), e.getMessage());
                metricsService.incrementSideEffectFailure(SIDE_EFFECT);
                return CompletableFuture.completedFuture(false);
            }
        }

        log.debug("Sending {} event {} to {}", envelope.eventType(), envelope.id(), endpoint);
        return httpClient.sendAsync(request.build(), HttpResponse.BodyHandlers.ofString())
                .handle((response, error) -> {
                    if (error != null) {
                        log.warn("Webhook delivery of {} to {} failed: {}", envelope.id(), endpoint, error.getMessage());
                        metricsService.incrementSideEffectFailure(SIDE_EFFECT);
                        return false;
                    }
                    if (response.statusCode() / 100 != 2) {
                        log.warn("Webhook {} returned status {} for event {}",
                                endpoint, response.statusCode(), envelope.id());
                        metricsService.incrementSideEffectFailure(SIDE_EFFECT);
                        return false;
                    }
                    log.debug("Webhook event {} delivered", envelope.id());
                    return true;
                });
    }

    String sign(String body) throws GeneralSecurityException {
        Mac mac = Mac.getInstance(HMAC_ALGORITHM);
        mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
        return HexFormat.of().formatHex(mac.doFinal(body.getBytes(StandardCharsets.UTF_8)));
    }

    public URI getEndpoint() {
        return endpoint;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * JSON body posted to the endpoint.
     */
    public record WebhookEnvelope(String id, String eventType, DuplicateDetectedEvent payload, Instant timestamp) {

        static WebhookEnvelope wrap(DuplicateDetectedEvent event) {
            return new WebhookEnvelope(UUID.randomUUID().toString(), DuplicateDetectedEvent.EVENT_TYPE, event,
                    Instant.now());
        }
    }

    public static class Builder {
        private String url;
        private String secret;
        private Duration timeout;
        private HttpClient httpClient;
        private MetricsService metricsService;

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder secret(String secret) {
            this.secret = secret;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public WebhookDuplicateNotifier build() {
            return new WebhookDuplicateNotifier(this);
        }
    }
}
