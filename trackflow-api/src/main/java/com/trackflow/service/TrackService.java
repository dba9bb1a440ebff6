package com.trackflow.service;

import com.trackflow.dto.TrackDTO;
import com.trackflow.error.InvalidRequestException;
import com.trackflow.error.TrackNotFoundException;
import com.trackflow.model.TrackRecord;
import com.trackflow.model.TrackStatus;
import com.trackflow.repository.TrackRepository;
import com.trackflow.repository.TrackStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class TrackService {

    private final TrackRepository trackRepository;
    private final TrackStore trackStore;

    @Transactional(readOnly = true)
    public Page<TrackDTO> getTracks(TrackStatus status, String genre, Pageable pageable) {
        log.debug("Fetching tracks status={} genre={} page={}", status, genre, pageable);
        Page<TrackRecord> page;
        if (status != null) {
            page = trackRepository.findByStatusOrderByCreatedDateDesc(status, pageable);
        } else if (genre != null && !genre.isBlank()) {
            page = trackRepository.findByGenreIgnoreCaseOrderByCreatedDateDesc(genre, pageable);
        } else {
            page = trackRepository.findAllByOrderByCreatedDateDesc(pageable);
        }
        return page.map(TrackService::convertToDTO);
    }

    public Optional<TrackDTO> getTrack(String id) {
        return trackStore.findById(id).map(TrackService::convertToDTO);
    }

    /**
     * Takes a track out of the pipeline for good. Promoted tracks cannot be
     * rejected; rejecting twice is a no-op.
     */
    public TrackDTO reject(String id, String reason) {
        TrackRecord record = trackStore.findById(id).orElseThrow(() -> new TrackNotFoundException(id));
        if (!record.getStatus().isTerminal()) {
            TrackRecord rejected = record.toBuilder().status(TrackStatus.REJECTED).build();
            if (trackStore.saveIfStatusIn(rejected, TrackStatus.PROMOTABLE)) {
                log.warn("Track {} rejected by operator: {}", id, reason == null ? "no reason given" : reason);
                return convertToDTO(rejected);
            }
            // Lost a race with a promotion or another reject
            record = trackStore.findById(id).orElseThrow(() -> new TrackNotFoundException(id));
        }
        if (record.getStatus() == TrackStatus.PROMOTED) {
            throw new InvalidRequestException("Track " + id + " is already promoted", "TRACK_PROMOTED");
        }
        return convertToDTO(record);
    }

    static TrackDTO convertToDTO(TrackRecord record) {
        TrackDTO dto = new TrackDTO();
        dto.setId(record.getId());
        dto.setCreatedDate(record.getCreatedDate());
        dto.setTitle(record.getTitle());
        dto.setArtist(record.getArtist());
        dto.setAlbum(record.getAlbum());
        dto.setGenre(record.getGenre());
        dto.setDescription(record.getDescription());
        dto.setTags(record.getTags() == null ? new ArrayList<>() : new ArrayList<>(record.getTags()));
        dto.setFilename(record.getFilename());
        dto.setFileUrl(record.getFileUrl());
        dto.setFileSize(record.getFileSize());
        dto.setDuration(record.getDuration());
        dto.setBitrate(record.getBitrate());
        dto.setStatus(record.getStatus());
        dto.setThumbnailUrl(record.getThumbnailUrl());
        dto.setPromotionDate(record.getPromotionDate());
        return dto;
    }
}
