package com.trackflow.service;

import com.trackflow.config.ConditionalOnPromotion;
import com.trackflow.config.PipelineProperties;
import com.trackflow.config.StorageConfig;
import com.trackflow.dto.ValidationCheck;
import com.trackflow.dto.ValidationVerdict;
import com.trackflow.model.TrackRecord;
import com.trackflow.model.TrackStatus;
import com.trackflow.storage.BlobStore;
import com.trackflow.storage.MediaUrls;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a track may be promoted. Reads the media area to confirm the
 * audio exists but never writes anything.
 */
@Component
@ConditionalOnPromotion
@Slf4j
public class TrackValidator {

    public static final String PROCESSING_STATUS = "processing_status";
    public static final String REQUIRED_FIELDS = "required_fields";
    public static final String AGE_GATE = "age_gate";
    public static final String BLOB_EXISTENCE = "blob_existence";
    public static final String AUDIO_QUALITY = "audio_quality";

    private final BlobStore mediaStore;
    private final MediaUrls mediaUrls;
    private final Clock clock;
    private final PipelineProperties.Validation settings;

    public TrackValidator(@Qualifier(StorageConfig.MEDIA_STORE) BlobStore mediaStore,
                          MediaUrls mediaUrls,
                          Clock clock,
                          PipelineProperties properties) {
        this.mediaStore = mediaStore;
        this.mediaUrls = mediaUrls;
        this.clock = clock;
        this.settings = properties.validation();
    }

    /**
     * @throws UncheckedIOException if the media area cannot be queried
     */
    public ValidationVerdict validate(TrackRecord record, AgeGate ageGate) {
        boolean bypass = ageGate == AgeGate.BYPASSED && settings.manualAgeGateBypass();
        if (ageGate == AgeGate.BYPASSED && !bypass) {
            log.info("Age gate bypass requested for track {} but not permitted here", record.getId());
        }
        return validate(record, bypass);
    }

    /**
     * Runs every check except the soak time, which is left out regardless of the
     * bypass policy. Used to select batch candidates.
     */
    public boolean passesNonBypassableChecks(TrackRecord record) {
        return validate(record, true).valid();
    }

    private ValidationVerdict validate(TrackRecord record, boolean bypassAgeGate) {
        List<ValidationCheck> checks = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        ValidationCheck status = checkStatus(record);
        checks.add(status);
        if (!status.passed()) {
            return ValidationVerdict.of(checks, warnings);
        }

        checks.add(checkRequiredFields(record));
        ValidationCheck age = checkAge(record);
        checks.add(bypassAgeGate ? age.asBypassed() : age);
        checks.add(checkBlob(record));
        checks.add(checkQuality(record));

        if (record.getDescription() == null || record.getDescription().isBlank()) {
            warnings.add("No description provided");
        }
        if (record.getGenre() == null || TrackRecord.UNKNOWN_GENRE.equalsIgnoreCase(record.getGenre())) {
            warnings.add("Genre not specified");
        }
        if (record.getTags() == null || record.getTags().isEmpty()) {
            warnings.add("No tags provided");
        }

        ValidationVerdict verdict = ValidationVerdict.of(checks, warnings);
        log.debug("Track {} validation: valid={} failed={}", record.getId(), verdict.valid(), verdict.failedChecks());
        return verdict;
    }

    private ValidationCheck checkStatus(TrackRecord record) {
        TrackStatus status = record.getStatus();
        if (status == null || !TrackStatus.PROMOTABLE.contains(status)) {
            return ValidationCheck.fail(PROCESSING_STATUS,
                    "Status is " + (status == null ? "missing" : status.value()) + ", expected processed or enhanced");
        }
        return ValidationCheck.pass(PROCESSING_STATUS, "Status is " + status.value());
    }

    private ValidationCheck checkRequiredFields(TrackRecord record) {
        List<String> missing = new ArrayList<>();
        if (isBlank(record.getTitle())) {
            missing.add("title");
        }
        if (isBlank(record.getFileUrl())) {
            missing.add("fileUrl");
        }
        if (isBlank(record.getFilename())) {
            missing.add("filename");
        }
        if (record.durationOrZero() <= 0) {
            missing.add("duration");
        }
        if (missing.isEmpty()) {
            return ValidationCheck.pass(REQUIRED_FIELDS, "All required fields present");
        }
        return ValidationCheck.fail(REQUIRED_FIELDS, "Missing or invalid: " + String.join(", ", missing));
    }

    private ValidationCheck checkAge(TrackRecord record) {
        if (record.getCreatedDate() == null) {
            return ValidationCheck.fail(AGE_GATE, "Creation date unknown");
        }
        Duration age = Duration.between(record.getCreatedDate(), clock.instant());
        Duration soak = settings.minSoak();
        if (age.compareTo(soak) < 0) {
            return ValidationCheck.fail(AGE_GATE, "Age " + age.toHours() + "h is below the " + soak.toHours() + "h soak time");
        }
        return ValidationCheck.pass(AGE_GATE, "Age " + age.toHours() + "h");
    }

    private ValidationCheck checkBlob(TrackRecord record) {
        Optional<String> key = mediaUrls.keyOf(record.getFileUrl());
        if (key.isEmpty()) {
            return ValidationCheck.fail(BLOB_EXISTENCE, "File URL does not point into " + mediaStore.area());
        }
        try {
            if (!mediaStore.exists(key.get())) {
                return ValidationCheck.fail(BLOB_EXISTENCE, "Audio file missing: " + key.get());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not look up " + key.get() + " in " + mediaStore.area(), e);
        }
        return ValidationCheck.pass(BLOB_EXISTENCE, "Audio file present");
    }

    private ValidationCheck checkQuality(TrackRecord record) {
        List<String> problems = new ArrayList<>();
        int duration = record.durationOrZero();
        if (duration < settings.minDurationSeconds() || duration > settings.maxDurationSeconds()) {
            problems.add("duration " + duration + "s outside [" + settings.minDurationSeconds() + ", "
                    + settings.maxDurationSeconds() + "]s");
        }
        long size = record.fileSizeOrZero();
        DataSize min = settings.minFileSize();
        DataSize max = settings.maxFileSize();
        if (size < min.toBytes() || size > max.toBytes()) {
            problems.add("file size " + size + " bytes outside [" + min + ", " + max + "]");
        }
        if (problems.isEmpty()) {
            return ValidationCheck.pass(AUDIO_QUALITY, "Duration " + duration + "s, size " + size + " bytes");
        }
        return ValidationCheck.fail(AUDIO_QUALITY, String.join("; ", problems));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
