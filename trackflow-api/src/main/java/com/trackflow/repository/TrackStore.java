package com.trackflow.repository;

import com.trackflow.model.TrackRecord;
import com.trackflow.model.TrackStatus;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Metadata store of one environment.
 *
 * <p>Records are keyed by {@code (id, createdDate)} but {@code id} alone is unique,
 * so lookups take the id only. Implementations must treat {@link #save} as an
 * upsert so that repeating a write converges on the same row.</p>
 */
public interface TrackStore {

    Optional<TrackRecord> findById(String id);

    /**
     * Status index scan.
     *
     * @return matching records, oldest {@code createdDate} first
     */
    List<TrackRecord> findByStatusIn(Collection<TrackStatus> statuses);

    TrackRecord save(TrackRecord record);

    /**
     * Replaces the stored record only while its status is still one of
     * {@code expected}. The check and the write happen atomically.
     *
     * @return {@code false} if the record is gone or its status has moved on
     */
    boolean saveIfStatusIn(TrackRecord record, Collection<TrackStatus> expected);

    /**
     * @return {@code true} if a record was removed
     */
    boolean deleteById(String id);
}
