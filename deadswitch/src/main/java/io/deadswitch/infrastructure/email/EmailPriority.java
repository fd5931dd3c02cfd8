package io.deadswitch.infrastructure.email;

import java.util.Map;

/**
 * Message priority, expressed to mail clients through headers.
 */
public enum EmailPriority {
    HIGH(Map.of("X-Priority", "1", "X-MSMail-Priority", "High", "Importance", "high")),
    NORMAL(Map.of()),
    LOW(Map.of("X-Priority", "5", "X-MSMail-Priority", "Low", "Importance", "low"));

    private final Map<String, String> headers;

    EmailPriority(Map<String, String> headers) {
        this.headers = headers;
    }

    public Map<String, String> headers() {
        return headers;
    }
}
