package com.trackflow.service;

import com.trackflow.error.EnrichmentException;
import com.trackflow.error.TrackNotFoundException;
import com.trackflow.model.TrackRecord;
import com.trackflow.model.TrackStatus;
import com.trackflow.storage.FileSystemBlobStore;
import com.trackflow.storage.MediaUrls;
import com.trackflow.support.InMemoryTrackStore;
import com.trackflow.support.PipelineFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.ByteArrayInputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("enrichment")
class EnrichmentServiceTest {

    @TempDir
    Path media;

    private FileSystemBlobStore mediaStore;
    private InMemoryTrackStore trackStore;
    private AudioMetadataReader reader;
    private EnrichmentService service;

    @BeforeEach
    void setUp() throws Exception {
        mediaStore = new FileSystemBlobStore("media", media);
        trackStore = new InMemoryTrackStore();
        reader = mock(AudioMetadataReader.class);
        service = new EnrichmentService(trackStore, mediaStore, reader,
                new MediaUrls(PipelineFixtures.MEDIA_BASE_URL), PipelineFixtures.CLOCK);

        TrackRecord processed = PipelineFixtures.track("t1", PipelineFixtures.NOW.minusSeconds(60)).toBuilder()
                .status(TrackStatus.PROCESSED)
                .duration(0)
                .genre(TrackRecord.UNKNOWN_GENRE)
                .description("")
                .build();
        trackStore.save(processed);
        mediaStore.put(PipelineFixtures.audioKey("t1"), new ByteArrayInputStream(new byte[2048]));
    }

    @Test
    @DisplayName("tags overwrite derived values, artwork is stored and the track becomes enhanced")
    void enrichesTrack() throws Exception {
        // given
        AudioMetadata metadata = new AudioMetadata(215, 320, 44100, 2, "Real Title", null, "Night Drive",
                "Techno", "Recorded live", "2021", new AudioMetadata.Artwork(new byte[]{1, 2, 3}, "image/png"));
        when(reader.read(any())).thenReturn(metadata);

        // when
        TrackRecord enriched = service.enrich("t1", PipelineFixtures.audioKey("t1"));

        // then
        assertThat(enriched.getStatus()).isEqualTo(TrackStatus.ENHANCED);
        assertThat(enriched.getDuration()).isEqualTo(215);
        assertThat(enriched.getBitrate()).isEqualTo(320);
        assertThat(enriched.getSampleRate()).isEqualTo(44100);
        assertThat(enriched.getChannels()).isEqualTo(2);
        assertThat(enriched.getTitle()).isEqualTo("Real Title");
        assertThat(enriched.getArtist()).isEqualTo("Artist");
        assertThat(enriched.getAlbum()).isEqualTo("Night Drive");
        assertThat(enriched.getGenre()).isEqualTo("Techno");
        assertThat(enriched.getDescription()).isEqualTo("Recorded live");
        assertThat(enriched.getTags()).contains("house", "year:2021");
        assertThat(enriched.getEnrichedDate()).isEqualTo(PipelineFixtures.NOW);
        assertThat(enriched.getThumbnailUrl())
                .isEqualTo(PipelineFixtures.MEDIA_BASE_URL + "/audio/t1/artwork/cover.png");
        assertThat(mediaStore.exists("audio/t1/artwork/cover.png")).isTrue();
        assertThat(trackStore.findById("t1").orElseThrow().getStatus()).isEqualTo(TrackStatus.ENHANCED);
    }

    @Test
    @DisplayName("the reader sees a temporary copy that keeps the extension and is removed afterwards")
    void usesTemporaryCopy() throws Exception {
        when(reader.read(any())).thenReturn(new AudioMetadata(90, null, null, null,
                null, null, null, null, null, null, null));

        service.enrich("t1", PipelineFixtures.audioKey("t1"));

        ArgumentCaptor<Path> captor = ArgumentCaptor.forClass(Path.class);
        verify(reader).read(captor.capture());
        assertThat(captor.getValue().getFileName().toString()).endsWith(".mp3");
        assertThat(Files.exists(captor.getValue())).isFalse();
    }

    @Test
    @DisplayName("audio without a positive duration leaves the record untouched")
    void zeroDurationFails() throws Exception {
        when(reader.read(any())).thenReturn(new AudioMetadata(0, null, null, null,
                "Title", null, null, null, null, null, null));

        assertThatThrownBy(() -> service.enrich("t1", PipelineFixtures.audioKey("t1")))
                .isInstanceOf(EnrichmentException.class);

        TrackRecord stored = trackStore.findById("t1").orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(TrackStatus.PROCESSED);
        assertThat(stored.getDuration()).isZero();
        assertThat(stored.getTitle()).isEqualTo("Track t1");
    }

    @Test
    @DisplayName("undecodable audio surfaces as an enrichment failure")
    void unreadableAudioFails() throws Exception {
        when(reader.read(any())).thenThrow(new EnrichmentException("Unreadable audio data"));

        assertThatThrownBy(() -> service.enrich("t1", PipelineFixtures.audioKey("t1")))
                .isInstanceOf(EnrichmentException.class);
        assertThat(trackStore.findById("t1").orElseThrow().getStatus()).isEqualTo(TrackStatus.PROCESSED);
    }

    @Test
    @DisplayName("a missing blob is an enrichment failure, not a crash")
    void missingBlobFails() throws Exception {
        mediaStore.delete(PipelineFixtures.audioKey("t1"));

        assertThatThrownBy(() -> service.enrich("t1", PipelineFixtures.audioKey("t1")))
                .isInstanceOf(EnrichmentException.class);
        verifyNoInteractions(reader);
    }

    @Test
    @DisplayName("promoted tracks are left alone")
    void skipsPromotedTracks() throws Exception {
        TrackRecord promoted = trackStore.findById("t1").orElseThrow();
        promoted.setStatus(TrackStatus.PROMOTED);
        trackStore.save(promoted);

        TrackRecord result = service.enrich("t1", PipelineFixtures.audioKey("t1"));

        assertThat(result.getStatus()).isEqualTo(TrackStatus.PROMOTED);
        verifyNoInteractions(reader);
    }

    @Test
    @DisplayName("a track promoted while its audio is decoded keeps its promoted status")
    void promotedDuringDecodeStaysPromoted() throws Exception {
        // given: the track is promoted while the reader runs
        when(reader.read(any())).thenAnswer(inv -> {
            TrackRecord promoted = trackStore.findById("t1").orElseThrow();
            promoted.setStatus(TrackStatus.PROMOTED);
            promoted.setPromotionDate(PipelineFixtures.NOW);
            trackStore.save(promoted);
            return new AudioMetadata(200, 320, 44100, 2, "Late Title", null, null, null, null, null, null);
        });

        // when
        TrackRecord result = service.enrich("t1", PipelineFixtures.audioKey("t1"));

        // then
        TrackRecord stored = trackStore.findById("t1").orElseThrow();
        assertThat(result.getStatus()).isEqualTo(TrackStatus.PROMOTED);
        assertThat(stored.getStatus()).isEqualTo(TrackStatus.PROMOTED);
        assertThat(stored.getPromotionDate()).isEqualTo(PipelineFixtures.NOW);
        assertThat(stored.getDuration()).isZero();
        assertThat(stored.getTitle()).isEqualTo("Track t1");
    }

    @Test
    @DisplayName("a track rejected while its audio is decoded stays rejected")
    void rejectedDuringDecodeStaysRejected() throws Exception {
        when(reader.read(any())).thenAnswer(inv -> {
            TrackRecord rejected = trackStore.findById("t1").orElseThrow();
            rejected.setStatus(TrackStatus.REJECTED);
            trackStore.save(rejected);
            return new AudioMetadata(200, null, null, null, null, null, null, null, null, null, null);
        });

        service.enrich("t1", PipelineFixtures.audioKey("t1"));

        assertThat(trackStore.findById("t1").orElseThrow().getStatus()).isEqualTo(TrackStatus.REJECTED);
    }

    @Test
    @DisplayName("the single-argument form finds the audio through the file URL")
    void enrichByIdUsesFileUrl() throws Exception {
        when(reader.read(any())).thenReturn(new AudioMetadata(120, 192, 48000, 1,
                null, null, null, null, null, null, null));

        assertThat(service.enrich("t1").getDuration()).isEqualTo(120);
        assertThatThrownBy(() -> service.enrich("nope")).isInstanceOf(TrackNotFoundException.class);
    }
}
