package com.jamra.offline.service.storage;

/** Outcome of comparing a manga sidecar's chapter count with the relational rows. */
public record ChapterCountValidation(boolean valid, boolean rebuilt) {
}
