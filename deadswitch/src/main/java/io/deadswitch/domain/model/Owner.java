package io.deadswitch.domain.model;

/**
 * Account holder that receives check-in reminders.
 */
public record Owner(
        String userId,
        String email,
        String name // May be null, falls back to email in messages
) {
    public String displayName() {
        return name != null && !name.isBlank() ? name : email;
    }
}
