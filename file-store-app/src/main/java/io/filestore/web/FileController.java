package io.filestore.web;

import io.filestore.error.ApiOperationException;
import io.filestore.error.ErrorCode;
import io.filestore.registry.service.FileRegistryService;
import io.filestore.service.FileDeletionService;
import io.filestore.service.FileDownloadService;
import io.filestore.service.FileUploadService;
import io.filestore.web.dto.ClearResponse;
import io.filestore.web.dto.DeleteResponse;
import io.filestore.web.dto.FileListResponse;
import io.filestore.web.dto.FileRecordResponse;
import io.filestore.web.dto.UploadResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

@Slf4j
@RestController
@RequestMapping("/api")
public class FileController {

    private final FileUploadService fileUploadService;
    private final FileDownloadService fileDownloadService;
    private final FileDeletionService fileDeletionService;
    private final FileRegistryService fileRegistryService;

    public FileController(FileUploadService fileUploadService,
                          FileDownloadService fileDownloadService,
                          FileDeletionService fileDeletionService,
                          FileRegistryService fileRegistryService) {
        this.fileUploadService = fileUploadService;
        this.fileDownloadService = fileDownloadService;
        this.fileDeletionService = fileDeletionService;
        this.fileRegistryService = fileRegistryService;
    }

    /**
     * Accepts a multipart upload with a single part named {@code file}.
     */
    @PostMapping("/upload")
    public Mono<ResponseEntity<UploadResponse>> upload(ServerWebExchange exchange) {
        return fileUploadService.upload(exchange.getMultipartData())
                .map(uploaded -> ResponseEntity.status(HttpStatus.CREATED)
                        .body(new UploadResponse(
                                "File uploaded successfully",
                                FileRecordResponse.from(uploaded.record()),
                                uploaded.totalFiles())))
                .onErrorMap(ApiOperationException::isUnexpected, error -> new ApiOperationException(ErrorCode.UPLOAD_ERROR, error));
    }

    @GetMapping("/files")
    public Mono<FileListResponse> listFiles() {
        return fileRegistryService.findAll()
                .map(FileRecordResponse::from)
                .collectList()
                .map(files -> new FileListResponse(files, files.size()))
                .onErrorMap(ApiOperationException::isUnexpected, error -> new ApiOperationException(ErrorCode.FILES_ERROR, error));
    }

    /**
     * Streams a file back with its original name as the suggested save name.
     *
     * @param id The public id of the file.
     * @return The file content, or a 404 if the id is unknown or the content is gone.
     */
    @GetMapping("/files/{id}")
    public Mono<ResponseEntity<Flux<DataBuffer>>> downloadFile(@PathVariable String id) {
        return fileDownloadService.downloadFile(id)
                .map(file -> ResponseEntity.ok()
                        .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                                .filename(file.fileName(), StandardCharsets.UTF_8)
                                .build()
                                .toString())
                        .contentType(file.contentType())
                        .contentLength(file.size())
                        .body(file.content()))
                .onErrorMap(ApiOperationException::isUnexpected, error -> new ApiOperationException(ErrorCode.DOWNLOAD_ERROR, error));
    }

    @DeleteMapping("/files/{id}")
    public Mono<DeleteResponse> deleteFile(@PathVariable String id) {
        return fileDeletionService.deleteFile(id)
                .map(record -> new DeleteResponse("File deleted successfully", record.name()))
                .onErrorMap(ApiOperationException::isUnexpected, error -> new ApiOperationException(ErrorCode.DELETE_ERROR, error));
    }

    @DeleteMapping("/files")
    public Mono<ClearResponse> deleteAllFiles() {
        return fileDeletionService.deleteAll()
                .map(count -> new ClearResponse("All files deleted successfully", count))
                .onErrorMap(ApiOperationException::isUnexpected, error -> new ApiOperationException(ErrorCode.CLEAR_ERROR, error));
    }
}
