package io.filestore.service;

import io.filestore.registry.domain.FileRecord;
import io.filestore.registry.service.FileRegistryService;
import io.filestore.storage.api.FileStorage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Deletes blobs and records. The registry decides whether a file exists for clients, so a
 * record is removed even when removing its blob fails; the stray blob is only logged.
 */
@Slf4j
@Service
public class FileDeletionService {
    private final FileRegistryService registryService;
    private final FileStorage fileStorage;

    public FileDeletionService(FileRegistryService registryService, FileStorage fileStorage) {
        this.registryService = registryService;
        this.fileStorage = fileStorage;
    }

    /**
     * @return A Mono with the removed record, or a FileRecordNotFoundException.
     */
    public Mono<FileRecord> deleteFile(String id) {
        return registryService.findById(id)
                .flatMap(record -> deleteBlob(record)
                        .then(registryService.remove(record.id())))
                .doOnSuccess(record -> log.info("Deleted file '{}' ({})", record.name(), record.id()));
    }

    /**
     * Deletes every file registered at the time of the call. Files uploaded while this runs
     * are left alone.
     *
     * @return A Mono with the number of records removed.
     */
    public Mono<Integer> deleteAll() {
        return registryService.findAll()
                .collectList()
                .flatMap(records -> Flux.fromIterable(records)
                        .concatMap(this::deleteBlob)
                        .then(registryService.removeAll(ids(records))))
                .doOnSuccess(count -> log.info("Deleted all files ({} removed)", count));
    }

    private Mono<Void> deleteBlob(FileRecord record) {
        return fileStorage.delete(record.storageKey())
                .doOnError(error -> log.warn("Could not delete blob of file {} ({}), removing the record anyway: {}",
                        record.id(), record.storageKey(), error.getMessage()))
                .onErrorResume(error -> Mono.empty())
                .then();
    }

    private List<String> ids(List<FileRecord> records) {
        return records.stream().map(FileRecord::id).toList();
    }
}
