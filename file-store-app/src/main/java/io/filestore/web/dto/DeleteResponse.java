package io.filestore.web.dto;

public record DeleteResponse(
        String message,
        String deletedFile
) {}
