package io.filestore.registry.domain;

import java.time.Instant;

/**
 * Metadata of one stored upload. Records are immutable: replacing content means deleting
 * the record and uploading again.
 */
public record FileRecord(
        String id,
        String name, // original client supplied name, untrusted
        long size,
        String storageKey, // where the blob lives in the storage, never shown to clients
        String type, // client declared MIME type, advisory only
        Instant uploadDate
) {}
