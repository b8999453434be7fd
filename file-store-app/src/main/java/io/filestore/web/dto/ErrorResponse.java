package io.filestore.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.filestore.error.ErrorCode;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String error,
        ErrorCode code,
        String id,
        String path,
        List<String> availableEndpoints,
        Long maxSize
) {
    public static ErrorResponse of(String error, ErrorCode code) {
        return new ErrorResponse(error, code, null, null, null, null);
    }

    public static ErrorResponse forFile(String error, ErrorCode code, String id) {
        return new ErrorResponse(error, code, id, null, null, null);
    }

    public static ErrorResponse tooLarge(String error, long maxSize) {
        return new ErrorResponse(error, ErrorCode.FILE_TOO_LARGE, null, null, null, maxSize);
    }

    public static ErrorResponse endpointNotFound(String path, List<String> availableEndpoints) {
        return new ErrorResponse("API endpoint not found", ErrorCode.NOT_FOUND, null, path, availableEndpoints, null);
    }
}
