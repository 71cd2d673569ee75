package com.jamra.offline.service.cleanup;

import com.google.gson.annotations.SerializedName;

import java.util.Arrays;

/**
 * Order in which stored manga are evicted when storage is over quota.
 */
public enum CleanupStrategy {
    /** Earliest {@code downloadedAt} first. */
    @SerializedName("oldest") OLDEST("oldest"),
    /** Biggest total chapter size first. */
    @SerializedName("largest") LARGEST("largest"),
    /** Earliest directory access time first. */
    @SerializedName("least-accessed") LEAST_ACCESSED("least-accessed");

    private final String value;

    CleanupStrategy(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static CleanupStrategy fromValue(String value) {
        return Arrays.stream(values())
                .filter(strategy -> strategy.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown cleanup strategy: " + value));
    }
}
