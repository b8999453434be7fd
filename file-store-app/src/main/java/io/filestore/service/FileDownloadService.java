package io.filestore.service;

import io.filestore.error.FileMissingException;
import io.filestore.registry.domain.FileRecord;
import io.filestore.registry.service.FileRegistryService;
import io.filestore.storage.api.FileStorage;
import io.filestore.storage.api.exception.BlobNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

@Slf4j
@Service
public class FileDownloadService {
    private final FileRegistryService registryService;
    private final FileStorage fileStorage;

    public FileDownloadService(FileRegistryService registryService, FileStorage fileStorage) {
        this.registryService = registryService;
        this.fileStorage = fileStorage;
    }

    /**
     * Looks up the record and opens its blob. Fails with FileRecordNotFoundException for an
     * unknown id and with FileMissingException when the record exists but its blob does not.
     */
    public Mono<DownloadableFile> downloadFile(String id) {
        return registryService.findById(id)
                .flatMap(record -> fileStorage.open(record.storageKey())
                        .onErrorMap(BlobNotFoundException.class, e -> new FileMissingException(record.id(), e))
                        .map(blob -> new DownloadableFile(
                                record.name(),
                                contentTypeOf(record),
                                blob.size(),
                                blob.content()
                                        .doOnError(error -> log.error("Error streaming file {}: {}", record.id(), error.getMessage()))
                        )));
    }

    // The declared type came from the client, so the name decides what we send back.
    private MediaType contentTypeOf(FileRecord record) {
        return MediaTypeFactory.getMediaType(record.name())
                .orElse(MediaType.APPLICATION_OCTET_STREAM);
    }
}
