package io.filestore.web;

import io.filestore.web.dto.HealthResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Instant;

@RestController
public class HealthController {

    @GetMapping("/api/health")
    public Mono<HealthResponse> health() {
        return Mono.fromSupplier(() -> new HealthResponse("OK", "File Store API is running", Instant.now()));
    }
}
