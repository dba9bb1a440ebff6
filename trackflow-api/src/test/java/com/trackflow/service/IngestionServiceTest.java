package com.trackflow.service;

import com.trackflow.config.PipelineProperties;
import com.trackflow.dto.IngestionResult;
import com.trackflow.error.IngestionException;
import com.trackflow.error.PipelineBusyException;
import com.trackflow.event.TrackIngestedEvent;
import com.trackflow.model.TrackRecord;
import com.trackflow.model.TrackStatus;
import com.trackflow.repository.TrackStore;
import com.trackflow.storage.FileSystemBlobStore;
import com.trackflow.storage.MediaUrls;
import com.trackflow.support.InMemoryTrackStore;
import com.trackflow.support.PipelineFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessResourceFailureException;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.time.Duration;
import java.util.HexFormat;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * {@link IngestionService} against real file system areas.
 *
 * <p>Covers the screening rules, the initial record, the copy into the media
 * area and the cleanup when the record cannot be written.</p>
 */
@DisplayName("ingestion")
class IngestionServiceTest {

    @TempDir
    Path uploads;

    @TempDir
    Path media;

    private FileSystemBlobStore uploadStore;
    private FileSystemBlobStore mediaStore;
    private InMemoryTrackStore trackStore;
    private ApplicationEventPublisher publisher;

    @BeforeEach
    void setUp() {
        uploadStore = new FileSystemBlobStore("uploads", uploads);
        mediaStore = new FileSystemBlobStore("media", media);
        trackStore = new InMemoryTrackStore();
        publisher = mock(ApplicationEventPublisher.class);
    }

    private IngestionService service(TrackStore store, PipelineProperties.Ingestion ingestion) {
        PipelineProperties properties = PipelineFixtures.properties(PipelineFixtures.storage(uploads, media),
                ingestion, PipelineFixtures.validation(true), PipelineFixtures.promotion(10, 2, 3, Duration.ofSeconds(30)));
        return new IngestionService(uploadStore, mediaStore, store, new ContentScanner(), publisher,
                new MediaUrls(PipelineFixtures.MEDIA_BASE_URL), PipelineFixtures.CLOCK, properties);
    }

    private IngestionService service() {
        return service(trackStore, PipelineFixtures.ingestion(2, Duration.ofSeconds(1)));
    }

    @Test
    @DisplayName("a valid upload becomes a processed record with its audio in the media area")
    void ingestsValidUpload() throws Exception {
        // given
        byte[] audio = audioBytes(4096);
        uploadStore.put("audio/dj_shadow - midnight.mp3", new ByteArrayInputStream(audio));

        // when
        IngestionResult result = service().ingest("uploads", "audio/dj_shadow - midnight.mp3");

        // then
        assertThat(result.status()).isEqualTo(IngestionResult.Status.INGESTED);
        TrackRecord record = trackStore.findById(result.trackId()).orElseThrow();
        String mediaKey = "audio/" + record.getId() + "/dj_shadow - midnight.mp3";

        assertThat(record.getStatus()).isEqualTo(TrackStatus.PROCESSED);
        assertThat(record.getDuration()).isZero();
        assertThat(record.getGenre()).isEqualTo(TrackRecord.UNKNOWN_GENRE);
        assertThat(record.getTitle()).isEqualTo("Midnight");
        assertThat(record.getArtist()).isEqualTo("Dj Shadow");
        assertThat(record.getFilename()).isEqualTo("dj_shadow - midnight.mp3");
        assertThat(record.getFileSize()).isEqualTo(4096L);
        assertThat(record.getCreatedDate()).isEqualTo(PipelineFixtures.NOW);
        assertThat(record.getFileUrl()).isEqualTo(PipelineFixtures.MEDIA_BASE_URL + "/" + mediaKey);
        assertThat(record.getFileHash()).isEqualTo(sha256(audio));
        assertThat(mediaStore.exists(mediaKey)).isTrue();
        verify(publisher).publishEvent(new TrackIngestedEvent(record.getId(), mediaKey));
    }

    @Test
    @DisplayName("form encoded keys are decoded")
    void decodesKeys() {
        assertThat(IngestionService.decodeKey("audio/my+song%20%282%29.mp3")).isEqualTo("audio/my song (2).mp3");
    }

    @Test
    @DisplayName("objects outside the upload prefix or with other extensions are skipped silently")
    void skipsIrrelevantObjects() throws Exception {
        uploadStore.put("images/cover.mp3", new ByteArrayInputStream(audioBytes(2048)));
        uploadStore.put("audio/notes.txt", new ByteArrayInputStream(audioBytes(2048)));

        assertThat(service().ingest("uploads", "images/cover.mp3").status()).isEqualTo(IngestionResult.Status.SKIPPED);
        assertThat(service().ingest("uploads", "audio/notes.txt").status()).isEqualTo(IngestionResult.Status.SKIPPED);
        assertThat(trackStore.size()).isZero();
        verifyNoInteractions(publisher);
    }

    @Test
    @DisplayName("uploads below the minimum size are rejected")
    void rejectsTinyFiles() throws Exception {
        uploadStore.put("audio/tiny.mp3", new ByteArrayInputStream(audioBytes(500)));

        IngestionResult result = service().ingest("uploads", "audio/tiny.mp3");

        assertThat(result.status()).isEqualTo(IngestionResult.Status.REJECTED);
        assertThat(trackStore.size()).isZero();
    }

    @Test
    @DisplayName("a script hidden in an audio file is rejected and nothing is written")
    void rejectsSuspiciousContent() throws Exception {
        // given
        byte[] payload = audioBytes(2048);
        byte[] script = "<?php echo 'hi'; ?>".getBytes(StandardCharsets.UTF_8);
        System.arraycopy(script, 0, payload, 100, script.length);
        uploadStore.put("audio/evil.mp3", new ByteArrayInputStream(payload));

        // when
        IngestionResult result = service().ingest("uploads", "audio/evil.mp3");

        // then
        assertThat(result.status()).isEqualTo(IngestionResult.Status.REJECTED);
        assertThat(result.message()).contains("Suspicious");
        assertThat(trackStore.size()).isZero();
        assertThat(mediaStore.list("audio/")).isEmpty();
        verifyNoInteractions(publisher);
    }

    @Test
    @DisplayName("when the record cannot be written the copied audio is removed and the error is retriable")
    void compensatesFailedWrite() throws Exception {
        // given
        TrackStore failing = mock(TrackStore.class);
        when(failing.save(any())).thenThrow(new DataAccessResourceFailureException("store down"));
        uploadStore.put("audio/song.mp3", new ByteArrayInputStream(audioBytes(2048)));
        IngestionService service = service(failing, PipelineFixtures.ingestion(2, Duration.ofSeconds(1)));

        // when / then
        assertThatThrownBy(() -> service.ingest("uploads", "audio/song.mp3"))
                .isInstanceOf(IngestionException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
        assertThat(mediaStore.list("audio/")).isEmpty();
        verifyNoInteractions(publisher);
    }

    @Test
    @DisplayName("callers beyond the concurrency limit give up after the acquire timeout")
    void busyWhenSaturated() throws Exception {
        // given: one slot, held by an ingestion stuck in the store
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        TrackStore slow = mock(TrackStore.class);
        when(slow.save(any())).thenAnswer(inv -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return inv.getArgument(0);
        });
        uploadStore.put("audio/one.mp3", new ByteArrayInputStream(audioBytes(2048)));
        uploadStore.put("audio/two.mp3", new ByteArrayInputStream(audioBytes(2048)));
        IngestionService service = service(slow, PipelineFixtures.ingestion(1, Duration.ofMillis(100)));

        CompletableFuture<IngestionResult> first = CompletableFuture.supplyAsync(() -> service.ingest("uploads", "audio/one.mp3"));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        // when / then
        assertThatThrownBy(() -> service.ingest("uploads", "audio/two.mp3")).isInstanceOf(PipelineBusyException.class);

        release.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS).status()).isEqualTo(IngestionResult.Status.INGESTED);
    }

    private static byte[] audioBytes(int size) {
        byte[] data = new byte[size];
        data[0] = 'I';
        data[1] = 'D';
        data[2] = '3';
        return data;
    }

    private static String sha256(byte[] data) throws Exception {
        return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(data));
    }
}
