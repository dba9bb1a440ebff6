package com.trackflow.support;

import com.trackflow.model.TrackRecord;
import com.trackflow.model.TrackStatus;
import com.trackflow.repository.TrackStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Map backed store. Hands out copies so tests observe only what was saved.
 */
public class InMemoryTrackStore implements TrackStore {

    private final Map<String, TrackRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<TrackRecord> findById(String id) {
        return Optional.ofNullable(records.get(id)).map(InMemoryTrackStore::copy);
    }

    @Override
    public List<TrackRecord> findByStatusIn(Collection<TrackStatus> statuses) {
        return records.values().stream()
                .filter(r -> statuses.contains(r.getStatus()))
                .sorted(Comparator.comparing(TrackRecord::getCreatedDate))
                .map(InMemoryTrackStore::copy)
                .toList();
    }

    @Override
    public TrackRecord save(TrackRecord record) {
        records.put(record.getId(), copy(record));
        return record;
    }

    @Override
    public boolean saveIfStatusIn(TrackRecord record, Collection<TrackStatus> expected) {
        AtomicBoolean saved = new AtomicBoolean();
        records.computeIfPresent(record.getId(), (id, current) -> {
            if (!expected.contains(current.getStatus())) {
                return current;
            }
            saved.set(true);
            return copy(record);
        });
        return saved.get();
    }

    @Override
    public boolean deleteById(String id) {
        return records.remove(id) != null;
    }

    public int size() {
        return records.size();
    }

    private static TrackRecord copy(TrackRecord record) {
        return record.toBuilder()
                .tags(record.getTags() == null ? null : new ArrayList<>(record.getTags()))
                .build();
    }
}
