package com.payment.paylink.compliance;

/**
 * Renders provider credentials so they are safe to include in logs. Never log a
 * secret or publishable key in plain text; use these instead.
 */
public final class CredentialMasker {

    private static final String SET = "***set***";
    private static final String NOT_SET = "NOT SET";

    private CredentialMasker() {}

    /** "***set***" when the key has a value, "NOT SET" otherwise. */
    public static String presence(String key) {
        return isBlank(key) ? NOT_SET : SET;
    }

    /**
     * Keeps the key's environment prefix ("sk_live_", "onvo_test_") and hides the
     * rest. Only the first two underscore-separated parts are kept, since the
     * random part may itself contain underscores.
     */
    public static String mask(String key) {
        if (isBlank(key)) {
            return null;
        }
        int first = key.indexOf('_');
        int second = first > 0 ? key.indexOf('_', first + 1) : -1;
        if (second <= first + 1) {
            return "***";
        }
        return key.substring(0, second + 1) + "***";
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
