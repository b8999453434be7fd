package io.filestore.storage.api;

import org.springframework.core.io.buffer.DataBuffer;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface FileStorage {
    /**
     * Streams file content into the storage under a freshly generated storage key.
     * Nothing is left behind in the storage when the upload fails.
     * @param originalName The client supplied file name, used (sanitized) as part of the key.
     * @param fileContent The reactive stream of the file's content.
     * @param sizeLimit Maximum number of bytes accepted.
     * @return A Mono containing the result of the upload, or a SizeLimitExceededException.
     */
    Mono<UploadResult> upload(String originalName, Flux<DataBuffer> fileContent, long sizeLimit);

    /**
     * Opens a stored blob for reading.
     * @param fileKey The storage key returned by {@link #upload}.
     * @return A Mono with the blob, or a BlobNotFoundException if it does not exist.
     */
    Mono<StoredBlob> open(String fileKey);

    /**
     * Removes a stored blob. Removing a blob that is already gone is not an error.
     * @param fileKey The storage key returned by {@link #upload}.
     * @return What actually happened to the blob.
     */
    Mono<DeleteOutcome> delete(String fileKey);

    Mono<Boolean> exists(String fileKey);
}
