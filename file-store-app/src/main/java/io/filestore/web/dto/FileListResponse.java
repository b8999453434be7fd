package io.filestore.web.dto;

import java.util.List;

public record FileListResponse(
        List<FileRecordResponse> files,
        int count
) {}
