package com.jamra.offline.service.storage;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Options for queueing. {@code chapterIds} only applies to whole-manga requests and limits
 * them to the listed chapters.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DownloadOptions {
    private int priority;
    private List<String> chapterIds;

    public static DownloadOptions defaults() {
        return new DownloadOptions(0, null);
    }
}
