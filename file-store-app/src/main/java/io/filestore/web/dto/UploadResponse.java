package io.filestore.web.dto;

public record UploadResponse(
        String message,
        FileRecordResponse file,
        int totalFiles
) {}
