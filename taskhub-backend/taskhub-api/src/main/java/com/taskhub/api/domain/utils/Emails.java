package com.taskhub.api.domain.utils;

import java.util.Locale;

public final class Emails {

    private Emails() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }

    /**
     * Canonical form used for storage, lookups and uniqueness: trimmed and lower-cased.
     */
    public static String normalize(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
