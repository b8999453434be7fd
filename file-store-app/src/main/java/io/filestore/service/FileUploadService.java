package io.filestore.service;

import io.filestore.config.StorageProperties;
import io.filestore.error.ErrorCode;
import io.filestore.error.FileValidationException;
import io.filestore.registry.domain.FileRecord;
import io.filestore.registry.service.FileRegistryService;
import io.filestore.storage.api.FileStorage;
import io.filestore.storage.api.UploadResult;
import io.filestore.storage.api.exception.SizeLimitExceededException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.DecodingException;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.MediaType;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.http.codec.multipart.Part;
import org.springframework.stereotype.Service;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.util.List;

@Slf4j
@Service
public class FileUploadService {
    public static final String FILE_PART_NAME = "file";

    private final FileStorage fileStorage;
    private final FileRegistryService registryService;
    private final long maxFileSize;

    public FileUploadService(FileStorage fileStorage,
                             FileRegistryService registryService,
                             StorageProperties storageProperties) {
        this.fileStorage = fileStorage;
        this.registryService = registryService;
        this.maxFileSize = storageProperties.getMaxFileSize();
    }

    /**
     * Stores the single file part named {@code file} and registers it. The blob is written
     * completely before the record is inserted, so a listed file always has its content.
     *
     * @param multipartData The parsed multipart body of the request.
     * @return A Mono with the new record and the number of files registered afterwards.
     */
    public Mono<UploadedFile> upload(Mono<MultiValueMap<String, Part>> multipartData) {
        return multipartData
                .map(this::singleFilePart)
                .flatMap(this::store)
                .onErrorMap(DataBufferLimitException.class, e -> new SizeLimitExceededException(maxFileSize))
                .onErrorMap(DecodingException.class,
                        e -> new FileValidationException(ErrorCode.INVALID_UPLOAD, "Malformed multipart request"));
    }

    private Mono<UploadedFile> store(FilePart filePart) {
        String fileName = filePart.filename();
        String contentType = contentTypeOf(filePart);

        return fileStorage.upload(fileName, filePart.content(), maxFileSize)
                .flatMap(uploadResult -> registryService
                        .register(fileName, uploadResult.size(), uploadResult.fileKey(), contentType)
                        // the blob must not outlive a failed registration
                        .onErrorResume(error -> discardBlob(uploadResult).then(Mono.<FileRecord>error(error))))
                .flatMap(record -> registryService.count().map(total -> new UploadedFile(record, total)))
                .doOnSuccess(uploaded -> log.info("Uploaded file '{}' ({} bytes) as {}",
                        fileName, uploaded.record().size(), uploaded.record().id()));
    }

    private FilePart singleFilePart(MultiValueMap<String, Part> parts) {
        List<FilePart> fileParts = parts.getOrDefault(FILE_PART_NAME, List.of()).stream()
                .filter(FilePart.class::isInstance)
                .map(FilePart.class::cast)
                .filter(part -> StringUtils.hasLength(part.filename()))
                .toList();

        if (fileParts.isEmpty()) {
            throw new FileValidationException(ErrorCode.NO_FILE, "No file uploaded");
        }
        if (fileParts.size() > 1) {
            throw new FileValidationException(ErrorCode.UNEXPECTED_FILE, "Only one file can be uploaded per request");
        }
        return fileParts.get(0);
    }

    private String contentTypeOf(FilePart filePart) {
        MediaType contentType = filePart.headers().getContentType();
        return contentType != null ? contentType.toString() : MediaType.APPLICATION_OCTET_STREAM_VALUE;
    }

    private Mono<Void> discardBlob(UploadResult uploadResult) {
        return fileStorage.delete(uploadResult.fileKey())
                .doOnError(error -> log.warn("Could not remove blob {} after failed registration: {}",
                        uploadResult.fileKey(), error.getMessage()))
                .onErrorResume(error -> Mono.empty())
                .then();
    }
}
