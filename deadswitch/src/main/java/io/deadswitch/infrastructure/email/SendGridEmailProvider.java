package io.deadswitch.infrastructure.email;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * SendGrid v3 mail/send adapter.
 *
 * Status mapping:
 * - 2xx: delivered, message id from X-Message-Id
 * - 401/403: AUTHENTICATION, never retried
 * - 400/413: INVALID_REQUEST, never retried
 * - 429: RATE_LIMITED with Retry-After and X-RateLimit-* quota
 * - 5xx: SERVICE_UNAVAILABLE
 */
public final class SendGridEmailProvider implements EmailProvider {
    private static final Logger log = LoggerFactory.getLogger(SendGridEmailProvider.class);

    public static final String NAME = "sendgrid";
    public static final URI DEFAULT_ENDPOINT = URI.create("https://api.sendgrid.com/v3/mail/send");

    private static final int DEFAULT_RETRY_AFTER_SECONDS = 60;
    private static final int DEFAULT_RATE_LIMIT = 100;

    private final HttpClient httpClient;
    private final URI endpoint;
    private final String apiKey;
    private final Duration requestTimeout;
    private final ObjectMapper mapper;

    public SendGridEmailProvider(HttpClient httpClient, URI endpoint, String apiKey,
                                 Duration requestTimeout, ObjectMapper mapper) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("SendGrid API key is required");
        }
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.requestTimeout = requestTimeout;
        this.mapper = mapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean supportsTracking() {
        return true;
    }

    @Override
    public String send(EmailData email) {
        String body = buildPayload(email);
        HttpRequest request = HttpRequest.newBuilder(endpoint)
            .timeout(requestTimeout)
            .header("Authorization", "Bearer " + apiKey)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new EmailSendException(EmailSendException.Kind.TIMEOUT, "SendGrid request timeout", e);
        } catch (IOException e) {
            throw new EmailSendException(EmailSendException.Kind.NETWORK, "Network error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmailSendException(EmailSendException.Kind.NETWORK, "SendGrid request interrupted", e);
        }

        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            String messageId = response.headers().firstValue("X-Message-Id")
                .orElse("sendgrid-" + Instant.now().toEpochMilli());
            log.debug("[EMAIL SENDGRID] Accepted with status {} id={}", status, messageId);
            return messageId;
        }

        String detail = errorDetail(response.body());
        if (status == 401 || status == 403) {
            throw new EmailSendException(EmailSendException.Kind.AUTHENTICATION,
                "Authentication failed (" + status + "): " + detail);
        }
        if (status == 429) {
            int retryAfter = headerInt(response, "Retry-After").orElse(DEFAULT_RETRY_AFTER_SECONDS);
            RateLimitInfo info = new RateLimitInfo(
                headerInt(response, "X-RateLimit-Limit").orElse(DEFAULT_RATE_LIMIT),
                headerInt(response, "X-RateLimit-Remaining").orElse(0),
                Instant.now().plusSeconds(retryAfter));
            throw EmailSendException.rateLimited("Rate limit exceeded: " + detail, retryAfter, info);
        }
        if (status == 400 || status == 413) {
            throw new EmailSendException(EmailSendException.Kind.INVALID_REQUEST,
                "Invalid request (" + status + "): " + detail);
        }
        if (status >= 500) {
            throw new EmailSendException(EmailSendException.Kind.SERVICE_UNAVAILABLE,
                "SendGrid unavailable (" + status + "): " + detail);
        }
        throw new EmailSendException(EmailSendException.Kind.UNKNOWN, "SendGrid error " + status + ": " + detail);
    }

    String buildPayload(EmailData email) {
        ObjectNode root = mapper.createObjectNode();

        ObjectNode personalization = root.putArray("personalizations").addObject();
        personalization.putArray("to").addObject().put("email", email.to());

        ObjectNode from = root.putObject("from");
        from.put("email", email.from());
        if (email.fromName() != null) {
            from.put("name", email.fromName());
        }
        if (email.replyTo() != null) {
            root.putObject("reply_to").put("email", email.replyTo());
        }
        root.put("subject", email.subject());

        // text/plain must precede text/html
        ArrayNode content = root.putArray("content");
        if (email.text() != null && !email.text().isEmpty()) {
            content.addObject().put("type", "text/plain").put("value", email.text());
        }
        if (email.html() != null && !email.html().isEmpty()) {
            content.addObject().put("type", "text/html").put("value", email.html());
        }

        Map<String, String> headers = email.effectiveHeaders();
        if (!headers.isEmpty()) {
            ObjectNode headerNode = root.putObject("headers");
            headers.forEach(headerNode::put);
        }

        ObjectNode tracking = root.putObject("tracking_settings");
        tracking.putObject("click_tracking").put("enable", email.trackDelivery());
        tracking.putObject("open_tracking").put("enable", email.trackDelivery());

        try {
            return mapper.writeValueAsString(root);
        } catch (IOException e) {
            throw new EmailSendException(EmailSendException.Kind.INVALID_REQUEST, "Failed to encode payload", e);
        }
    }

    private String errorDetail(String body) {
        if (body == null || body.isBlank()) {
            return "no details";
        }
        try {
            JsonNode errors = mapper.readTree(body).path("errors");
            if (errors.isArray() && errors.size() > 0) {
                return errors.get(0).path("message").asText("no details");
            }
        } catch (IOException e) {
            log.debug("[EMAIL SENDGRID] Unparseable error body: {}", e.getMessage());
        }
        return body.length() > 200 ? body.substring(0, 200) : body;
    }

    private static Optional<Integer> headerInt(HttpResponse<?> response, String name) {
        return response.headers().firstValue(name).flatMap(value -> {
            try {
                return Optional.of(Integer.parseInt(value.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        });
    }
}
