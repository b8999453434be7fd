package io.filestore.config;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

@Data
@Builder
public class StorageProperties {
    public static final long DEFAULT_MAX_FILE_SIZE = 10L * 1024 * 1024; // 10 MiB

    @Builder.Default
    private String storageDir = "uploads";
    @Builder.Default
    private long maxFileSize = DEFAULT_MAX_FILE_SIZE;
    @Builder.Default
    private boolean purgePartialOnStartup = true;

    public Path getStoragePath() {
        return Path.of(storageDir);
    }
}
