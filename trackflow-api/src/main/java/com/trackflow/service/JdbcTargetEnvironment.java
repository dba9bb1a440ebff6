package com.trackflow.service;

import com.trackflow.repository.TrackStore;
import com.trackflow.storage.BlobStore;
import com.trackflow.storage.MediaUrls;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

/**
 * Target reached over its own JDBC pool and media directory. Owns the pool.
 */
@Slf4j
public class JdbcTargetEnvironment implements TargetEnvironment, AutoCloseable {

    private final String name;
    private final HikariDataSource dataSource;
    private final TrackStore tracks;
    private final BlobStore media;
    private final MediaUrls mediaUrls;

    public JdbcTargetEnvironment(String name, HikariDataSource dataSource, TrackStore tracks, BlobStore media,
                                 MediaUrls mediaUrls) {
        this.name = name;
        this.dataSource = dataSource;
        this.tracks = tracks;
        this.media = media;
        this.mediaUrls = mediaUrls;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public TrackStore tracks() {
        return tracks;
    }

    @Override
    public BlobStore media() {
        return media;
    }

    @Override
    public MediaUrls mediaUrls() {
        return mediaUrls;
    }

    @Override
    public void close() {
        log.info("Closing connection pool of target environment {}", name);
        dataSource.close();
    }
}
