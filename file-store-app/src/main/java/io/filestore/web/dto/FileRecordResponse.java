package io.filestore.web.dto;

import io.filestore.registry.domain.FileRecord;

import java.time.Instant;

/**
 * Public view of a file record. The storage key stays on the server.
 */
public record FileRecordResponse(
        String id,
        String name,
        long size,
        Instant uploadDate,
        String type
) {
    public static FileRecordResponse from(FileRecord record) {
        return new FileRecordResponse(record.id(), record.name(), record.size(), record.uploadDate(), record.type());
    }
}
