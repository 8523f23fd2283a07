package com.herzen.lms.common;

/**
 * Partial-update helper: a null incoming value keeps the stored one.
 */
public final class Patch {
    private Patch() {
    }

    public static <T> T or(T incoming, T current) {
        return incoming != null ? incoming : current;
    }
}
