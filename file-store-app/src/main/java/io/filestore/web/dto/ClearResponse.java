package io.filestore.web.dto;

public record ClearResponse(
        String message,
        int deletedCount
) {}
