package io.filestore.web;

import io.filestore.web.dto.ErrorResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Answers every {@code /api} request no other mapping claims, listing the endpoints that do
 * exist. Mappings with a concrete path always win over this catch-all pattern.
 */
@RestController
public class ApiFallbackController {

    static final List<String> AVAILABLE_ENDPOINTS = List.of(
            "GET /api/health",
            "POST /api/upload",
            "GET /api/files",
            "GET /api/files/:id",
            "DELETE /api/files/:id",
            "DELETE /api/files"
    );

    @RequestMapping("/api/**")
    public Mono<ResponseEntity<ErrorResponse>> unknownEndpoint(ServerHttpRequest request) {
        return Mono.just(ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorResponse.endpointNotFound(request.getPath().value(), AVAILABLE_ENDPOINTS)));
    }
}
