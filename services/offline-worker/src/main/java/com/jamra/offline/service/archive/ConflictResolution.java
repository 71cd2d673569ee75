package com.jamra.offline.service.archive;

import com.google.gson.annotations.SerializedName;

/** What an import does when the manga is already stored offline. */
public enum ConflictResolution {
    /** Leave the stored copy alone and report the import as skipped. */
    @SerializedName("skip") SKIP,
    /** Remove the stored copy, then import. */
    @SerializedName("overwrite") OVERWRITE,
    /** Import under a timestamp-suffixed folder when another manga already holds the folder name. */
    @SerializedName("rename") RENAME
}
