package io.filestore.storage.api;

import org.springframework.core.io.buffer.DataBuffer;
import reactor.core.publisher.Flux;

public record StoredBlob(
        String fileKey,
        long size,
        Flux<DataBuffer> content
) {}
