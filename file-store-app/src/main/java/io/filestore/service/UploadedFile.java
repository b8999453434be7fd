package io.filestore.service;

import io.filestore.registry.domain.FileRecord;

public record UploadedFile(
        FileRecord record,
        int totalFiles
) {}
