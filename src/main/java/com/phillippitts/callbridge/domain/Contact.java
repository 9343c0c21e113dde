package com.phillippitts.callbridge.domain;

/**
 * Known caller, keyed by phone number in the contacts file. Every field except
 * {@code name} is optional.
 */
public record Contact(
        String name,
        String company,
        String role,
        boolean vip,
        String notes,
        String preferredGreeting
) {
}
