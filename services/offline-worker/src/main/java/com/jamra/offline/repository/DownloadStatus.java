package com.jamra.offline.repository;

import com.google.gson.annotations.SerializedName;

import java.util.Arrays;

public enum DownloadStatus {
    @SerializedName("queued") QUEUED("queued"),
    @SerializedName("downloading") DOWNLOADING("downloading"),
    @SerializedName("completed") COMPLETED("completed"),
    @SerializedName("failed") FAILED("failed"),
    @SerializedName("paused") PAUSED("paused");

    private final String value;

    DownloadStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static DownloadStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown download status: " + value));
    }
}
