package io.filestore.service;

import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.MediaType;
import reactor.core.publisher.Flux;

public record DownloadableFile(
        String fileName,
        MediaType contentType,
        long size,
        Flux<DataBuffer> content
) {}
