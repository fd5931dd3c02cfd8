package io.deadswitch.transport.http;

import io.deadswitch.application.port.output.EmailFailureRepository;
import io.deadswitch.application.service.FailureEscalationService;
import io.deadswitch.application.service.FailureNotFoundException;
import io.deadswitch.application.service.FailureRetryResult;
import io.deadswitch.domain.model.EmailType;
import io.deadswitch.security.BearerAuthenticator;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator API for logged email failures. Requires Authorization: Bearer &lt;ADMIN_TOKEN&gt;.
 *
 * - GET /api/admin/email-failures - list, or stats with ?stats=true
 * - POST /api/admin/email-failures/{id}/resolve - mark resolved
 * - POST /api/admin/email-failures/{id}/retry - resend one failure
 * - POST /api/admin/email-failures/retry?emailType=reminder - resend unresolved failures of a type
 * - POST /api/admin/email-failures/cleanup?days=30 - purge old resolved failures
 */
public final class EmailFailureAdminHandler {
    private static final Logger log = LoggerFactory.getLogger(EmailFailureAdminHandler.class);

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 500;

    private final FailureEscalationService escalationService;
    private final BearerAuthenticator authenticator;
    private final int defaultRetentionDays;

    public EmailFailureAdminHandler(FailureEscalationService escalationService,
                                    BearerAuthenticator authenticator,
                                    int defaultRetentionDays) {
        this.escalationService = escalationService;
        this.authenticator = authenticator;
        this.defaultRetentionDays = defaultRetentionDays;
    }

    public void list(HttpServerExchange exchange) {
        if (!authenticator.isAuthorized(HttpResponses.authorization(exchange))) {
            HttpResponses.sendUnauthorized(exchange);
            return;
        }
        try {
            if ("true".equalsIgnoreCase(HttpResponses.param(exchange, "stats"))) {
                HttpResponses.sendJson(exchange, StatusCodes.OK, escalationService.stats());
                return;
            }

            EmailFailureRepository.Query query = parseQuery(exchange);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("failures", escalationService.list(query));
            body.put("limit", query.limit());
            body.put("offset", query.offset());
            HttpResponses.sendJson(exchange, StatusCodes.OK, body);

        } catch (IllegalArgumentException e) {
            HttpResponses.sendError(exchange, StatusCodes.BAD_REQUEST, e.getMessage());
        } catch (Exception e) {
            log.error("[ADMIN] Failed to list email failures: {}", e.getMessage(), e);
            HttpResponses.sendInternalError(exchange);
        }
    }

    public void resolve(HttpServerExchange exchange) {
        if (!authenticator.isAuthorized(HttpResponses.authorization(exchange))) {
            HttpResponses.sendUnauthorized(exchange);
            return;
        }
        long id;
        try {
            id = Long.parseLong(HttpResponses.param(exchange, "id"));
        } catch (NumberFormatException e) {
            HttpResponses.sendError(exchange, StatusCodes.BAD_REQUEST, "Invalid failure id");
            return;
        }
        try {
            escalationService.resolve(id);
            HttpResponses.sendJson(exchange, StatusCodes.OK, Map.of("success", true, "id", id));
        } catch (FailureNotFoundException e) {
            HttpResponses.sendError(exchange, StatusCodes.NOT_FOUND, "Email failure not found");
        } catch (Exception e) {
            log.error("[ADMIN] Failed to resolve email failure {}: {}", id, e.getMessage(), e);
            HttpResponses.sendInternalError(exchange);
        }
    }

    public void retry(HttpServerExchange exchange) {
        if (!authenticator.isAuthorized(HttpResponses.authorization(exchange))) {
            HttpResponses.sendUnauthorized(exchange);
            return;
        }
        long id;
        try {
            id = Long.parseLong(HttpResponses.param(exchange, "id"));
        } catch (NumberFormatException e) {
            HttpResponses.sendError(exchange, StatusCodes.BAD_REQUEST, "Invalid failure id");
            return;
        }
        try {
            FailureRetryResult result = escalationService.retry(id);
            HttpResponses.sendJson(exchange, StatusCodes.OK, result);
        } catch (FailureNotFoundException e) {
            HttpResponses.sendError(exchange, StatusCodes.NOT_FOUND, "Email failure not found");
        } catch (Exception e) {
            log.error("[ADMIN] Failed to retry email failure {}: {}", id, e.getMessage(), e);
            HttpResponses.sendInternalError(exchange);
        }
    }

    public void retryAll(HttpServerExchange exchange) {
        if (!authenticator.isAuthorized(HttpResponses.authorization(exchange))) {
            HttpResponses.sendUnauthorized(exchange);
            return;
        }
        String type = HttpResponses.param(exchange, "emailType");
        if (type == null) {
            HttpResponses.sendError(exchange, StatusCodes.BAD_REQUEST, "emailType is required");
            return;
        }
        try {
            List<FailureRetryResult> results = escalationService.retryAll(EmailType.fromDb(type));
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("attempted", results.stream().filter(FailureRetryResult::attempted).count());
            body.put("delivered", results.stream()
                .filter(r -> r.outcome() == FailureRetryResult.Outcome.DELIVERED).count());
            body.put("results", results);
            HttpResponses.sendJson(exchange, StatusCodes.OK, body);
        } catch (IllegalArgumentException e) {
            HttpResponses.sendError(exchange, StatusCodes.BAD_REQUEST, e.getMessage());
        } catch (Exception e) {
            log.error("[ADMIN] Batch retry of {} failures failed: {}", type, e.getMessage(), e);
            HttpResponses.sendInternalError(exchange);
        }
    }

    public void cleanup(HttpServerExchange exchange) {
        if (!authenticator.isAuthorized(HttpResponses.authorization(exchange))) {
            HttpResponses.sendUnauthorized(exchange);
            return;
        }
        try {
            int days = intParam(exchange, "days", defaultRetentionDays);
            int deleted = escalationService.cleanup(days);
            HttpResponses.sendJson(exchange, StatusCodes.OK, Map.of("deleted", deleted, "retentionDays", days));
        } catch (IllegalArgumentException e) {
            HttpResponses.sendError(exchange, StatusCodes.BAD_REQUEST, e.getMessage());
        } catch (Exception e) {
            log.error("[ADMIN] Email failure cleanup failed: {}", e.getMessage(), e);
            HttpResponses.sendInternalError(exchange);
        }
    }

    static EmailFailureRepository.Query parseQuery(HttpServerExchange exchange) {
        String type = HttpResponses.param(exchange, "emailType");
        int limit = Math.min(intParam(exchange, "limit", DEFAULT_LIMIT), MAX_LIMIT);
        int offset = intParam(exchange, "offset", 0);
        if (limit <= 0 || offset < 0) {
            throw new IllegalArgumentException("limit must be positive and offset non-negative");
        }
        return new EmailFailureRepository.Query(
            type != null ? EmailType.fromDb(type) : null,
            HttpResponses.param(exchange, "provider"),
            HttpResponses.param(exchange, "recipient"),
            "true".equalsIgnoreCase(HttpResponses.param(exchange, "unresolvedOnly")),
            limit,
            offset);
    }

    private static int intParam(HttpServerExchange exchange, String name, int defaultValue) {
        String value = HttpResponses.param(exchange, name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + value);
        }
    }
}
