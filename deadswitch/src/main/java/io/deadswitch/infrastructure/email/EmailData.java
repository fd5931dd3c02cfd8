package io.deadswitch.infrastructure.email;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outbound email.
 */
public record EmailData(
        String to,
        String subject,
        String html,
        String text,
        String from, // null = service default sender
        String fromName,
        String replyTo,
        EmailPriority priority,
        Map<String, String> headers,
        boolean trackDelivery
) {
    public EmailData {
        priority = priority == null ? EmailPriority.NORMAL : priority;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    /**
     * Priority headers merged with explicit ones. Explicit headers win.
     */
    public Map<String, String> effectiveHeaders() {
        Map<String, String> merged = new LinkedHashMap<>(priority.headers());
        merged.putAll(headers);
        return merged;
    }

    public EmailData withSender(String newFrom, String newFromName) {
        return new EmailData(to, subject, html, text, newFrom, newFromName, replyTo, priority, headers, trackDelivery);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String to;
        private String subject;
        private String html;
        private String text;
        private String from;
        private String fromName;
        private String replyTo;
        private EmailPriority priority = EmailPriority.NORMAL;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private boolean trackDelivery;

        public Builder to(String to) {
            this.to = to;
            return this;
        }

        public Builder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder html(String html) {
            this.html = html;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder from(String from, String fromName) {
            this.from = from;
            this.fromName = fromName;
            return this;
        }

        public Builder replyTo(String replyTo) {
            this.replyTo = replyTo;
            return this;
        }

        public Builder priority(EmailPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder header(String name, String value) {
            this.headers.put(name, value);
            return this;
        }

        public Builder trackDelivery(boolean trackDelivery) {
            this.trackDelivery = trackDelivery;
            return this;
        }

        public EmailData build() {
            return new EmailData(to, subject, html, text, from, fromName, replyTo, priority, headers, trackDelivery);
        }
    }
}
