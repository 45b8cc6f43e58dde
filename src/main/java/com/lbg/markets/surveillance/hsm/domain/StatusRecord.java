package com.lbg.markets.surveillance.hsm.domain;

/**
 * Persisted online status of one datafile within a schema namespace.
 * The value is the string-encoded boolean {@code "True"} or {@code "False"}.
 */
public record StatusRecord(
        String namespace,
        long datafileId,
        String value
) {
    public static final String TRUE = "True";
    public static final String FALSE = "False";

    public StatusRecord {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace cannot be blank");
        }
        if (!TRUE.equals(value) && !FALSE.equals(value)) {
            throw new IllegalArgumentException("value must be True or False, got: " + value);
        }
    }

    public static StatusRecord of(String namespace, long datafileId, boolean online) {
        return new StatusRecord(namespace, datafileId, encode(online));
    }

    public static String encode(boolean online) {
        return online ? TRUE : FALSE;
    }

    public boolean online() {
        return TRUE.equals(value);
    }

    public StatusRecord withValue(boolean online) {
        return new StatusRecord(namespace, datafileId, encode(online));
    }
}
