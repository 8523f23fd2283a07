package com.herzen.lms.common;

import java.util.UUID;

public final class Ids {
    public static final String UUID_REGEX = "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$";
    public static final String UUID_MESSAGE = "must be a valid UUID";

    private Ids() {
    }

    public static String newId() {
        return UUID.randomUUID().toString();
    }
}
