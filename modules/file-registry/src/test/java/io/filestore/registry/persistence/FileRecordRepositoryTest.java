package io.filestore.registry.persistence;

import io.filestore.registry.domain.FileRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileRecordRepositoryTest {

    private FileRecordRepository repository;

    @BeforeEach
    void setUp() {
        repository = new FileRecordRepository();
    }

    private FileRecord record(String id) {
        return new FileRecord(id, id + ".txt", 5, "key-" + id, "text/plain", Instant.now());
    }

    @Test
    void findAll_shouldReturnRecordsInInsertionOrder() {
        repository.insert(record("c"));
        repository.insert(record("a"));
        repository.insert(record("b"));

        assertThat(repository.findAll())
                .extracting(FileRecord::id)
                .containsExactly("c", "a", "b");
    }

    @Test
    void insert_withDuplicateId_shouldFail() {
        repository.insert(record("same"));

        assertThatThrownBy(() -> repository.insert(record("same")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("same");
        assertThat(repository.count()).isEqualTo(1);
    }

    @Test
    void findAll_shouldReturnSnapshotUnaffectedByLaterChanges() {
        repository.insert(record("a"));
        List<FileRecord> snapshot = repository.findAll();

        repository.insert(record("b"));
        repository.remove("a");

        assertThat(snapshot).extracting(FileRecord::id).containsExactly("a");
    }

    @Test
    void remove_shouldReturnPriorRecordOnce() {
        FileRecord record = record("a");
        repository.insert(record);

        assertThat(repository.remove("a")).contains(record);
        assertThat(repository.remove("a")).isEmpty();
        assertThat(repository.findById("a")).isEmpty();
    }

    @Test
    void removeAll_shouldSkipIdsThatAreGone() {
        repository.insert(record("a"));
        repository.insert(record("b"));
        repository.insert(record("c"));

        List<FileRecord> removed = repository.removeAll(List.of("a", "missing", "c"));

        assertThat(removed).extracting(FileRecord::id).containsExactly("a", "c");
        assertThat(repository.findAll()).extracting(FileRecord::id).containsExactly("b");
    }

    @Test
    void clear_shouldReturnCountAndBeRepeatable() {
        repository.insert(record("a"));
        repository.insert(record("b"));

        assertThat(repository.clear()).isEqualTo(2);
        assertThat(repository.clear()).isZero();
        assertThat(repository.findAll()).isEmpty();
    }

    @Test
    void concurrentInsertsAndReads_shouldNeverCorruptTheRegistry() throws Exception {
        int writers = 4;
        int perWriter = 500;
        ExecutorService executor = Executors.newFixedThreadPool(writers + 1);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int w = 0; w < writers; w++) {
                int writer = w;
                executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perWriter; i++) {
                        repository.insert(record(writer + "-" + i));
                    }
                    return null;
                });
            }
            Future<Boolean> reader = executor.submit(() -> {
                start.await();
                for (int i = 0; i < 200; i++) {
                    List<FileRecord> snapshot = repository.findAll();
                    if (snapshot.stream().anyMatch(r -> r == null)) {
                        return false;
                    }
                }
                return true;
            });

            start.countDown();
            assertThat(reader.get(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            executor.shutdown();
            assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(repository.count()).isEqualTo(writers * perWriter);
    }
}
