package io.filestore.storage.local;

import io.filestore.storage.api.DeleteOutcome;
import io.filestore.storage.api.FileStorage;
import io.filestore.storage.api.StoredBlob;
import io.filestore.storage.api.UploadResult;
import io.filestore.storage.api.exception.BlobNotFoundException;
import io.filestore.storage.api.exception.SizeLimitExceededException;
import io.filestore.storage.api.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferFactory;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Stores every blob as a single file directly under the storage root. Content is first
 * streamed into {@code <key>.part} and only renamed to {@code <key>} once it was written
 * completely, so a blob that is visible under its key is always whole.
 */
@Slf4j
public class LocalDiskStorageAdapter implements FileStorage {
    static final String PART_SUFFIX = ".part";
    private static final int READ_BUFFER_SIZE = 8192;

    private final Path rootDir;
    private final DataBufferFactory bufferFactory;

    public LocalDiskStorageAdapter(Path rootDir) {
        this(rootDir, DefaultDataBufferFactory.sharedInstance);
    }

    public LocalDiskStorageAdapter(Path rootDir, DataBufferFactory bufferFactory) {
        this.rootDir = rootDir.toAbsolutePath().normalize();
        this.bufferFactory = bufferFactory;
    }

    public Path getRootDir() {
        return rootDir;
    }

    /**
     * Creates the storage root if it does not exist yet.
     */
    public void initialize() {
        try {
            Files.createDirectories(rootDir);
        } catch (IOException e) {
            throw new StorageException("Could not create storage directory " + rootDir, e);
        }
    }

    @Override
    public Mono<UploadResult> upload(String originalName, Flux<DataBuffer> fileContent, long sizeLimit) {
        String key = StorageKeys.newKey(originalName);

        return Mono.fromCallable(() -> {
                    Files.createDirectories(rootDir);
                    return resolve(key + PART_SUFFIX);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(partFile -> {
                    AtomicLong written = new AtomicLong(0);

                    Flux<DataBuffer> limited = fileContent.<DataBuffer>handle((dataBuffer, sink) -> {
                        if (written.addAndGet(dataBuffer.readableByteCount()) > sizeLimit) {
                            DataBufferUtils.release(dataBuffer);
                            sink.error(new SizeLimitExceededException(sizeLimit));
                        } else {
                            sink.next(dataBuffer);
                        }
                    });

                    return DataBufferUtils.write(limited, partFile, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)
                            .then(Mono.fromCallable(() -> commit(partFile, key, written.get()))
                                    .subscribeOn(Schedulers.boundedElastic()))
                            .doOnCancel(() -> Schedulers.boundedElastic().schedule(() -> discard(partFile)))
                            .onErrorResume(error -> Mono.fromRunnable(() -> discard(partFile))
                                    .subscribeOn(Schedulers.boundedElastic())
                                    .then(Mono.<UploadResult>error(toStorageException(error, key))));
                })
                .doOnSuccess(result -> log.info("Stored blob {} ({} bytes)", result.fileKey(), result.size()));
    }

    @Override
    public Mono<StoredBlob> open(String fileKey) {
        return Mono.fromCallable(() -> {
                    Path file = resolve(fileKey);
                    if (!Files.isRegularFile(file)) {
                        throw new BlobNotFoundException(fileKey);
                    }
                    long size = Files.size(file);
                    Flux<DataBuffer> content = DataBufferUtils.read(file, bufferFactory, READ_BUFFER_SIZE);
                    return new StoredBlob(fileKey, size, content);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(IOException.class, e -> new StorageException("Could not open blob " + fileKey, e));
    }

    @Override
    public Mono<DeleteOutcome> delete(String fileKey) {
        return Mono.fromCallable(() -> Files.deleteIfExists(resolve(fileKey))
                        ? DeleteOutcome.DELETED
                        : DeleteOutcome.ALREADY_ABSENT)
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(outcome -> {
                    if (outcome == DeleteOutcome.ALREADY_ABSENT) {
                        log.warn("Blob {} was already absent when deleting it", fileKey);
                    } else {
                        log.debug("Deleted blob {}", fileKey);
                    }
                })
                .onErrorMap(IOException.class, e -> new StorageException("Could not delete blob " + fileKey, e));
    }

    @Override
    public Mono<Boolean> exists(String fileKey) {
        return Mono.fromCallable(() -> Files.isRegularFile(resolve(fileKey)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Removes {@code *.part} files left over by uploads that never finished, e.g. because the
     * process died in the middle of one.
     *
     * @return The number of files removed.
     */
    public long purgePartialUploads() {
        if (!Files.isDirectory(rootDir)) {
            return 0;
        }
        try (Stream<Path> files = Files.list(rootDir)) {
            return files
                    .filter(path -> path.getFileName().toString().endsWith(PART_SUFFIX))
                    .filter(this::discard)
                    .count();
        } catch (IOException e) {
            throw new StorageException("Could not list storage directory " + rootDir, e);
        }
    }

    /**
     * Resolves a file name against the storage root and refuses anything that would end up
     * outside of it.
     */
    Path resolve(String fileName) {
        Path candidate = rootDir.resolve(fileName).normalize();
        if (!candidate.startsWith(rootDir) || candidate.equals(rootDir)) {
            throw new StorageException("Storage key resolves outside of the storage directory: " + fileName);
        }
        return candidate;
    }

    private UploadResult commit(Path partFile, String key, long size) throws IOException {
        // Same directory, so this is a plain rename. Fails instead of overwriting an existing blob.
        Files.move(partFile, resolve(key));
        return new UploadResult(key, size);
    }

    private boolean discard(Path file) {
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not remove partial upload {}: {}", file.getFileName(), e.getMessage());
            return false;
        }
    }

    private StorageException toStorageException(Throwable error, String key) {
        if (error instanceof StorageException storageException) {
            return storageException;
        }
        return new StorageException("Failed to store blob " + key, error);
    }
}
