package io.filestore.registry.persistence;

import io.filestore.registry.domain.FileRecord;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-lifetime store of file records, kept in insertion order. Every operation runs
 * under the same lock, so readers never see a half applied change.
 */
@Repository
public class FileRecordRepository {

    private final Map<String, FileRecord> records = new LinkedHashMap<>();
    private final Lock lock = new ReentrantLock();

    /**
     * @throws IllegalStateException if a record with the same id is already present
     */
    public void insert(FileRecord record) {
        lock.lock();
        try {
            if (records.putIfAbsent(record.id(), record) != null) {
                throw new IllegalStateException("Duplicate file id: " + record.id());
            }
        } finally {
            lock.unlock();
        }
    }

    public Optional<FileRecord> findById(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(records.get(id));
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return A copy of all records, oldest upload first.
     */
    public List<FileRecord> findAll() {
        lock.lock();
        try {
            return List.copyOf(records.values());
        } finally {
            lock.unlock();
        }
    }

    public Optional<FileRecord> remove(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(records.remove(id));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the given records, ignoring ids that are no longer present.
     *
     * @return The records that were actually removed.
     */
    public List<FileRecord> removeAll(Collection<String> ids) {
        lock.lock();
        try {
            List<FileRecord> removed = new ArrayList<>();
            for (String id : ids) {
                FileRecord record = records.remove(id);
                if (record != null) {
                    removed.add(record);
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return How many records were removed.
     */
    public int clear() {
        lock.lock();
        try {
            int count = records.size();
            records.clear();
            return count;
        } finally {
            lock.unlock();
        }
    }

    public int count() {
        lock.lock();
        try {
            return records.size();
        } finally {
            lock.unlock();
        }
    }
}
