package com.dealflow.dedup.core.model;

/**
 * A contact attached to a deal. Only the email takes part in matching.
 */
public record ContactRecord(
        String name,
        String email,
        String phone,
        String role
) {
    public static ContactRecord of(String name, String email) {
        return new ContactRecord(name, email, null, null);
    }

    public boolean hasEmail() {
        return email != null && !email.isBlank();
    }
}
