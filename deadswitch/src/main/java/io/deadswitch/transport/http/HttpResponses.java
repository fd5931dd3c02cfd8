package io.deadswitch.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.deadswitch.util.Json;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.Map;

/**
 * JSON response and request helpers shared by the handlers.
 */
final class HttpResponses {
    private static final Logger log = LoggerFactory.getLogger(HttpResponses.class);

    static final String JSON_ERROR = "error";
    static final String INTERNAL_ERROR = "Internal Server Error";

    static void sendJson(HttpServerExchange exchange, int statusCode, Object body) {
        String json;
        try {
            json = Json.mapper().writeValueAsString(body);
        } catch (JsonProcessingException e) {
            log.error("[HTTP] Failed to serialize response: {}", e.getMessage(), e);
            statusCode = StatusCodes.INTERNAL_SERVER_ERROR;
            json = "{\"error\":\"" + INTERNAL_ERROR + "\"}";
        }
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }

    static void sendError(HttpServerExchange exchange, int statusCode, String message) {
        sendJson(exchange, statusCode, Map.of(JSON_ERROR, message));
    }

    static void sendUnauthorized(HttpServerExchange exchange) {
        sendError(exchange, StatusCodes.UNAUTHORIZED, "Unauthorized");
    }

    static void sendInternalError(HttpServerExchange exchange) {
        sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, INTERNAL_ERROR);
    }

    /**
     * First value of a query or path parameter, or null.
     */
    static String param(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String value = values.peekFirst();
        return value == null || value.isEmpty() ? null : value;
    }

    static String authorization(HttpServerExchange exchange) {
        return exchange.getRequestHeaders().getFirst(Headers.AUTHORIZATION);
    }

    private HttpResponses() {}
}
