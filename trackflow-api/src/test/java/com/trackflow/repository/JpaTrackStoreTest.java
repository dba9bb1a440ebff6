package com.trackflow.repository;

import com.trackflow.model.TrackRecord;
import com.trackflow.model.TrackStatus;
import com.trackflow.support.PipelineFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Repository queries and the JPA store over the Flyway schema on H2.
 */
@DataJpaTest
class JpaTrackStoreTest {

    @Configuration
    @EntityScan(basePackageClasses = TrackRecord.class)
    @EnableJpaRepositories(basePackageClasses = TrackRepository.class)
    @Import(JpaTrackStore.class)
    static class Config {
    }

    @Autowired
    private TrackRepository trackRepository;

    @Autowired
    private JpaTrackStore store;

    @BeforeEach
    void setUp() {
        store.save(PipelineFixtures.track("old", PipelineFixtures.NOW.minus(Duration.ofDays(3))));
        store.save(PipelineFixtures.track("new", PipelineFixtures.NOW));
        TrackRecord rejected = PipelineFixtures.track("bad", PipelineFixtures.NOW.minus(Duration.ofDays(1)));
        rejected.setStatus(TrackStatus.REJECTED);
        rejected.setGenre("Techno");
        store.save(rejected);
    }

    @Test
    @DisplayName("a track is found by id alone")
    void findById() {
        TrackRecord found = store.findById("old").orElseThrow();

        assertThat(found.getCreatedDate()).isEqualTo(PipelineFixtures.NOW.minus(Duration.ofDays(3)));
        assertThat(found.getTags()).containsExactly("house");
        assertThat(store.findById("missing")).isEmpty();
    }

    @Test
    @DisplayName("promotable tracks come back oldest first")
    void promotableOldestFirst() {
        List<TrackRecord> found = store.findByStatusIn(TrackStatus.PROMOTABLE);

        assertThat(found).extracting(TrackRecord::getId).containsExactly("old", "new");
    }

    @Test
    @DisplayName("browsing pages newest first and filters by status or genre")
    void browse() {
        Page<TrackRecord> all = trackRepository.findAllByOrderByCreatedDateDesc(PageRequest.of(0, 2));
        Page<TrackRecord> rejected = trackRepository.findByStatusOrderByCreatedDateDesc(TrackStatus.REJECTED,
                PageRequest.of(0, 10));
        Page<TrackRecord> techno = trackRepository.findByGenreIgnoreCaseOrderByCreatedDateDesc("techno",
                PageRequest.of(0, 10));

        assertThat(all.getTotalElements()).isEqualTo(3);
        assertThat(all.getContent()).extracting(TrackRecord::getId).containsExactly("new", "bad");
        assertThat(rejected.getContent()).extracting(TrackRecord::getId).containsExactly("bad");
        assertThat(techno.getContent()).extracting(TrackRecord::getId).containsExactly("bad");
    }

    @Test
    @DisplayName("saving again updates the status in place")
    void updateStatus() {
        TrackRecord record = store.findById("new").orElseThrow();
        record.setStatus(TrackStatus.PROMOTED);
        record.setPromotionDate(PipelineFixtures.NOW);

        store.save(record);

        assertThat(store.findById("new").orElseThrow().getStatus()).isEqualTo(TrackStatus.PROMOTED);
        assertThat(trackRepository.count()).isEqualTo(3);
    }

    @Test
    @DisplayName("a guarded save leaves a track whose status has moved on untouched")
    void saveIfStatusIn() {
        TrackRecord stale = PipelineFixtures.track("bad", PipelineFixtures.NOW.minus(Duration.ofDays(1))).toBuilder()
                .status(TrackStatus.PROMOTED)
                .promotionDate(PipelineFixtures.NOW)
                .build();
        TrackRecord fresh = PipelineFixtures.track("new", PipelineFixtures.NOW).toBuilder()
                .status(TrackStatus.PROMOTED)
                .promotionDate(PipelineFixtures.NOW)
                .build();

        assertThat(store.saveIfStatusIn(stale, TrackStatus.PROMOTABLE)).isFalse();
        assertThat(store.saveIfStatusIn(fresh, TrackStatus.PROMOTABLE)).isTrue();

        assertThat(store.findById("bad").orElseThrow().getStatus()).isEqualTo(TrackStatus.REJECTED);
        assertThat(store.findById("new").orElseThrow().getStatus()).isEqualTo(TrackStatus.PROMOTED);
    }

    @Test
    @DisplayName("deleting reports whether a track was removed")
    void delete() {
        assertThat(store.deleteById("old")).isTrue();
        assertThat(store.deleteById("old")).isFalse();
    }
}
