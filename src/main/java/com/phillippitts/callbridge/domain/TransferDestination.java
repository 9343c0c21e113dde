package com.phillippitts.callbridge.domain;

/**
 * A configured transfer target.
 *
 * @param key         lookup key used by the AI (e.g. {@code "sales"})
 * @param name        display name
 * @param number      routing number, with or without a {@code tel:} prefix
 * @param description short description shown to the AI
 */
public record TransferDestination(String key, String name, String number, String description) {

    private static final String TEL_SCHEME = "tel:";

    /**
     * Routing address in {@code tel:} URI form.
     */
    public String targetUri() {
        return number.startsWith(TEL_SCHEME) ? number : TEL_SCHEME + number;
    }
}
