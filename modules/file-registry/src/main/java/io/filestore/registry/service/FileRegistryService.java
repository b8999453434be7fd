package io.filestore.registry.service;

import io.filestore.registry.domain.FileRecord;
import io.filestore.registry.exception.FileRecordNotFoundException;
import io.filestore.registry.id.FileIdGenerator;
import io.filestore.registry.persistence.FileRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Collection;


@Slf4j
@Service
public class FileRegistryService {

    private final FileRecordRepository fileRecordRepository;
    private final FileIdGenerator fileIdGenerator;

    public FileRegistryService(FileRecordRepository fileRecordRepository, FileIdGenerator fileIdGenerator) {
        this.fileRecordRepository = fileRecordRepository;
        this.fileIdGenerator = fileIdGenerator;
    }

    /**
     * Registers a blob that has already been written completely. Must only be called after
     * the storage confirmed the write.
     *
     * @param name The original file name as sent by the client.
     * @param size The number of bytes written to the storage.
     * @param storageKey The key under which the storage keeps the blob.
     * @param type The client declared MIME type.
     * @return A Mono containing the new record with a freshly generated id.
     */
    public Mono<FileRecord> register(String name, long size, String storageKey, String type) {
        return Mono.fromCallable(() -> {
            FileRecord record = new FileRecord(
                    fileIdGenerator.nextId(),
                    name,
                    size,
                    storageKey,
                    type,
                    Instant.now()
            );
            fileRecordRepository.insert(record);
            log.debug("Registered file {} as {}", name, record.id());
            return record;
        });
    }

    public Mono<FileRecord> findById(String id) {
        return Mono.defer(() -> Mono.justOrEmpty(fileRecordRepository.findById(id)))
                .switchIfEmpty(Mono.error(() -> new FileRecordNotFoundException(id)));
    }

    public Flux<FileRecord> findAll() {
        return Mono.fromCallable(fileRecordRepository::findAll)
                .flatMapIterable(records -> records);
    }

    public Mono<Integer> count() {
        return Mono.fromCallable(fileRecordRepository::count);
    }

    public Mono<FileRecord> remove(String id) {
        return Mono.defer(() -> Mono.justOrEmpty(fileRecordRepository.remove(id)))
                .switchIfEmpty(Mono.error(() -> new FileRecordNotFoundException(id)));
    }

    /**
     * Removes the given records. Ids that are already gone are skipped.
     *
     * @return A Mono with the number of records actually removed.
     */
    public Mono<Integer> removeAll(Collection<String> ids) {
        return Mono.fromCallable(() -> fileRecordRepository.removeAll(ids).size());
    }

    public Mono<Integer> clear() {
        return Mono.fromCallable(fileRecordRepository::clear)
                .doOnNext(count -> log.info("Cleared {} file records", count));
    }
}
