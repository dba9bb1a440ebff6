package com.trackflow.repository;

import com.trackflow.model.TrackRecord;
import com.trackflow.model.TrackStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * The owning environment's store, backed by {@link TrackRepository}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaTrackStore implements TrackStore {

    private final TrackRepository trackRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<TrackRecord> findById(String id) {
        return trackRepository.findFirstById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public List<TrackRecord> findByStatusIn(Collection<TrackStatus> statuses) {
        return trackRepository.findByStatusInOrderByCreatedDateAsc(statuses);
    }

    @Override
    @Transactional
    public TrackRecord save(TrackRecord record) {
        log.debug("Saving track {} with status {}", record.getId(), record.getStatus());
        return trackRepository.save(record);
    }

    @Override
    @Transactional
    public boolean saveIfStatusIn(TrackRecord record, Collection<TrackStatus> expected) {
        Optional<TrackRecord> current = trackRepository.findByIdForUpdate(record.getId());
        if (current.isEmpty() || !expected.contains(current.get().getStatus())) {
            log.info("Not saving track {}: stored status is {}", record.getId(),
                    current.map(r -> r.getStatus().value()).orElse("missing"));
            return false;
        }
        trackRepository.save(record);
        return true;
    }

    @Override
    @Transactional
    public boolean deleteById(String id) {
        return trackRepository.findFirstById(id)
                .map(record -> {
                    trackRepository.delete(record);
                    log.info("Deleted track {}", id);
                    return true;
                })
                .orElse(false);
    }
}
