package io.filestore.service;

import io.filestore.registry.domain.FileRecord;
import io.filestore.registry.exception.FileRecordNotFoundException;
import io.filestore.registry.id.FileIdGenerator;
import io.filestore.registry.persistence.FileRecordRepository;
import io.filestore.registry.service.FileRegistryService;
import io.filestore.storage.api.DeleteOutcome;
import io.filestore.storage.api.FileStorage;
import io.filestore.storage.api.exception.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FileDeletionServiceTest {

    @Mock
    private FileStorage fileStorage;

    private FileRecordRepository repository;
    private FileDeletionService fileDeletionService;

    @BeforeEach
    void setUp() {
        repository = new FileRecordRepository();
        FileRegistryService registryService = new FileRegistryService(repository, new FileIdGenerator());
        fileDeletionService = new FileDeletionService(registryService, fileStorage);
    }

    private FileRecord stored(String id) {
        FileRecord record = new FileRecord(id, id + ".txt", 4, "key-" + id, "text/plain", Instant.now());
        repository.insert(record);
        return record;
    }

    @Test
    void deleteFile_shouldRemoveBlobAndRecord() {
        stored("1");
        when(fileStorage.delete("key-1")).thenReturn(Mono.just(DeleteOutcome.DELETED));

        StepVerifier.create(fileDeletionService.deleteFile("1").map(FileRecord::name))
                .expectNext("1.txt")
                .verifyComplete();

        verify(fileStorage).delete("key-1");
        assertThat(repository.findById("1")).isEmpty();
    }

    @Test
    void deleteFile_whenBlobAlreadyGone_shouldStillSucceed() {
        stored("1");
        when(fileStorage.delete("key-1")).thenReturn(Mono.just(DeleteOutcome.ALREADY_ABSENT));

        StepVerifier.create(fileDeletionService.deleteFile("1"))
                .expectNextCount(1)
                .verifyComplete();

        assertThat(repository.count()).isZero();
    }

    @Test
    void deleteFile_whenBlobDeletionFails_shouldStillRemoveRecord() {
        stored("1");
        when(fileStorage.delete("key-1")).thenReturn(Mono.error(new StorageException("disk on fire")));

        StepVerifier.create(fileDeletionService.deleteFile("1"))
                .expectNextCount(1)
                .verifyComplete();

        assertThat(repository.findById("1")).isEmpty();
    }

    @Test
    void deleteFile_unknownId_shouldFailWithoutTouchingStorage() {
        StepVerifier.create(fileDeletionService.deleteFile("missing"))
                .expectError(FileRecordNotFoundException.class)
                .verify();

        verify(fileStorage, never()).delete(any());
    }

    @Test
    void deleteAll_shouldRemoveEverythingEvenIfOneBlobFails() {
        stored("1");
        stored("2");
        stored("3");
        when(fileStorage.delete("key-1")).thenReturn(Mono.just(DeleteOutcome.DELETED));
        when(fileStorage.delete("key-2")).thenReturn(Mono.error(new StorageException("permission denied")));
        when(fileStorage.delete("key-3")).thenReturn(Mono.just(DeleteOutcome.ALREADY_ABSENT));

        StepVerifier.create(fileDeletionService.deleteAll())
                .expectNext(3)
                .verifyComplete();

        assertThat(repository.count()).isZero();
    }

    @Test
    void deleteAll_twice_shouldReportZeroTheSecondTime() {
        stored("1");
        when(fileStorage.delete("key-1")).thenReturn(Mono.just(DeleteOutcome.DELETED));

        StepVerifier.create(fileDeletionService.deleteAll())
                .expectNext(1)
                .verifyComplete();
        StepVerifier.create(fileDeletionService.deleteAll())
                .expectNext(0)
                .verifyComplete();
    }

    @Test
    void deleteAll_shouldKeepRecordsRegisteredAfterItStarted() {
        stored("1");
        when(fileStorage.delete("key-1")).thenAnswer(invocation -> {
            // an upload finishing while the blobs are being removed
            stored("late");
            return Mono.just(DeleteOutcome.DELETED);
        });

        StepVerifier.create(fileDeletionService.deleteAll())
                .expectNext(1)
                .verifyComplete();

        assertThat(repository.findById("late")).isPresent();
    }
}
