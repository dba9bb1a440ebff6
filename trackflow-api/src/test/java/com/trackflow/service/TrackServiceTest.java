package com.trackflow.service;

import com.trackflow.dto.TrackDTO;
import com.trackflow.error.InvalidRequestException;
import com.trackflow.error.TrackNotFoundException;
import com.trackflow.model.TrackRecord;
import com.trackflow.model.TrackStatus;
import com.trackflow.repository.TrackRepository;
import com.trackflow.support.InMemoryTrackStore;
import com.trackflow.support.PipelineFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

import java.util.Collection;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

class TrackServiceTest {

    private TrackRepository trackRepository;
    private InMemoryTrackStore trackStore;
    private TrackService trackService;

    @BeforeEach
    void setUp() {
        trackRepository = mock(TrackRepository.class);
        trackStore = new InMemoryTrackStore();
        trackService = new TrackService(trackRepository, trackStore);
    }

    @Test
    @DisplayName("rejecting a track takes it out of the pipeline")
    void reject() {
        trackStore.save(PipelineFixtures.track("t1", PipelineFixtures.NOW));

        TrackDTO dto = trackService.reject("t1", "copyright claim");

        assertThat(dto.getStatus()).isEqualTo(TrackStatus.REJECTED);
        assertThat(trackStore.findById("t1").orElseThrow().getStatus()).isEqualTo(TrackStatus.REJECTED);
    }

    @Test
    @DisplayName("rejecting twice is a no-op")
    void rejectTwice() {
        trackStore.save(PipelineFixtures.track("t1", PipelineFixtures.NOW));
        trackService.reject("t1", null);

        TrackDTO dto = trackService.reject("t1", "again");

        assertThat(dto.getStatus()).isEqualTo(TrackStatus.REJECTED);
    }

    @Test
    @DisplayName("promoted tracks cannot be rejected")
    void rejectPromoted() {
        TrackRecord promoted = PipelineFixtures.track("t1", PipelineFixtures.NOW);
        promoted.setStatus(TrackStatus.PROMOTED);
        trackStore.save(promoted);

        assertThatThrownBy(() -> trackService.reject("t1", "too late"))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("already promoted");
        assertThat(trackStore.findById("t1").orElseThrow().getStatus()).isEqualTo(TrackStatus.PROMOTED);
    }

    @Test
    @DisplayName("a reject that loses the race with a promotion reports the track as promoted")
    void rejectRacingPromotion() {
        // given: the promotion commits between the read and the guarded write
        InMemoryTrackStore racing = new InMemoryTrackStore() {
            @Override
            public boolean saveIfStatusIn(TrackRecord record, Collection<TrackStatus> expected) {
                TrackRecord promoted = findById(record.getId()).orElseThrow();
                promoted.setStatus(TrackStatus.PROMOTED);
                save(promoted);
                return super.saveIfStatusIn(record, expected);
            }
        };
        racing.save(PipelineFixtures.track("t1", PipelineFixtures.NOW));
        TrackService service = new TrackService(trackRepository, racing);

        // when / then
        assertThatThrownBy(() -> service.reject("t1", "late"))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("already promoted");
        assertThat(racing.findById("t1").orElseThrow().getStatus()).isEqualTo(TrackStatus.PROMOTED);
    }

    @Test
    @DisplayName("rejecting an unknown track fails")
    void rejectUnknown() {
        assertThatThrownBy(() -> trackService.reject("nope", null)).isInstanceOf(TrackNotFoundException.class);
    }

    @Test
    @DisplayName("listing by status takes precedence over genre")
    void listByStatus() {
        Pageable pageable = PageRequest.of(0, 20);
        Page<TrackRecord> page = new PageImpl<>(List.of(PipelineFixtures.track("t1", PipelineFixtures.NOW)));
        when(trackRepository.findByStatusOrderByCreatedDateDesc(TrackStatus.ENHANCED, pageable)).thenReturn(page);

        Page<TrackDTO> result = trackService.getTracks(TrackStatus.ENHANCED, "electronic", pageable);

        assertThat(result.getContent()).extracting(TrackDTO::getId).containsExactly("t1");
        verify(trackRepository, never()).findByGenreIgnoreCaseOrderByCreatedDateDesc(any(), any());
    }

    @Test
    @DisplayName("the DTO carries a copy of the tags")
    void convertCopiesTags() {
        TrackRecord record = PipelineFixtures.track("t1", PipelineFixtures.NOW);

        TrackDTO dto = TrackService.convertToDTO(record);
        dto.getTags().add("edited");

        assertThat(record.getTags()).containsExactly("house");
        assertThat(dto.getFileUrl()).isEqualTo(record.getFileUrl());
    }
}
