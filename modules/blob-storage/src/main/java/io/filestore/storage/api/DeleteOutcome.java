package io.filestore.storage.api;

public enum DeleteOutcome {
    DELETED,
    ALREADY_ABSENT
}
