package io.filestore.config;

import io.filestore.storage.local.LocalDiskStorageAdapter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class StorageConfig {

    @Bean
    StorageProperties storageProperties(@Value("${file-store.storage-dir:uploads}") String storageDir,
                                        @Value("${file-store.max-file-size:10485760}") Long maxFileSize,
                                        @Value("${file-store.purge-partial-on-startup:true}") Boolean purgePartialOnStartup) {
        return StorageProperties.builder()
                .storageDir(storageDir)
                .maxFileSize(maxFileSize)
                .purgePartialOnStartup(purgePartialOnStartup)
                .build();
    }

    @Bean
    public LocalDiskStorageAdapter localDiskStorageAdapter(StorageProperties storageProperties) {
        LocalDiskStorageAdapter adapter = new LocalDiskStorageAdapter(storageProperties.getStoragePath());
        adapter.initialize();
        log.info("Upload directory: {} (max file size {} bytes)", adapter.getRootDir(), storageProperties.getMaxFileSize());

        if (storageProperties.isPurgePartialOnStartup()) {
            long purged = adapter.purgePartialUploads();
            if (purged > 0) {
                log.info("Removed {} partial uploads left over from a previous run", purged);
            }
        }
        return adapter;
    }
}
