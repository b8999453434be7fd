package io.filestore.storage.api;

public record UploadResult(
        String fileKey,
        long size // number of bytes actually written
) {}
