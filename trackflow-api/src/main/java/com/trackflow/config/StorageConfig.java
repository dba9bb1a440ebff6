package com.trackflow.config;

import com.trackflow.storage.BlobStore;
import com.trackflow.storage.FileSystemBlobStore;
import com.trackflow.storage.MediaUrls;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;

/**
 * Blob areas owned by this environment.
 */
@Configuration
@Slf4j
public class StorageConfig {

    public static final String UPLOAD_STORE = "uploadBlobStore";
    public static final String MEDIA_STORE = "mediaBlobStore";

    @Bean(name = UPLOAD_STORE)
    public BlobStore uploadBlobStore(PipelineProperties properties) {
        PipelineProperties.Storage storage = properties.storage();
        log.info("Upload area '{}' at {}", storage.uploadArea(), storage.uploadDir().toAbsolutePath());
        return new FileSystemBlobStore(storage.uploadArea(), storage.uploadDir());
    }

    @Bean(name = MEDIA_STORE)
    @Primary
    public BlobStore mediaBlobStore(PipelineProperties properties) {
        PipelineProperties.Storage storage = properties.storage();
        log.info("Media area '{}' at {}", storage.mediaArea(), storage.mediaDir().toAbsolutePath());
        return new FileSystemBlobStore(storage.mediaArea(), storage.mediaDir());
    }

    @Bean
    public MediaUrls mediaUrls(PipelineProperties properties) {
        return new MediaUrls(properties.storage().mediaBaseUrl());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
