package io.deadswitch.domain.model;

/**
 * Person who receives the secret on disclosure.
 * At least one of email or phone is set.
 */
public record Recipient(
        String name,
        String email, // null for phone-only recipients
        String phone
) {
    public boolean hasEmail() {
        return email != null && !email.isBlank();
    }
}
