package com.trackflow.service;

import com.trackflow.error.EnrichmentException;
import lombok.extern.slf4j.Slf4j;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.audio.AudioHeader;
import org.jaudiotagger.audio.exceptions.CannotReadException;
import org.jaudiotagger.audio.exceptions.InvalidAudioFrameException;
import org.jaudiotagger.audio.exceptions.ReadOnlyFileException;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.KeyNotFoundException;
import org.jaudiotagger.tag.Tag;
import org.jaudiotagger.tag.TagException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads headers and tags with jaudiotagger. The format is picked from the file
 * extension, so callers must keep it.
 */
@Component
@Slf4j
public class JaudiotaggerMetadataReader implements AudioMetadataReader {

    @Override
    public AudioMetadata read(Path file) throws IOException {
        AudioFile audioFile;
        try {
            audioFile = AudioFileIO.read(file.toFile());
        } catch (CannotReadException | InvalidAudioFrameException | TagException | ReadOnlyFileException e) {
            throw new EnrichmentException("Unreadable audio data in " + file.getFileName() + ": " + e.getMessage(), e);
        }

        AudioHeader header = audioFile.getAudioHeader();
        if (header == null) {
            throw new EnrichmentException("No audio header in " + file.getFileName());
        }
        Tag tag = audioFile.getTag();
        AudioMetadata.Artwork artwork = null;
        if (tag != null && tag.getFirstArtwork() != null && tag.getFirstArtwork().getBinaryData() != null) {
            artwork = new AudioMetadata.Artwork(tag.getFirstArtwork().getBinaryData(), tag.getFirstArtwork().getMimeType());
        }

        return new AudioMetadata(
                header.getTrackLength(),
                positive(header.getBitRateAsNumber()),
                positive(header.getSampleRateAsNumber()),
                parseChannels(header.getChannels()),
                field(tag, FieldKey.TITLE),
                field(tag, FieldKey.ARTIST),
                field(tag, FieldKey.ALBUM),
                field(tag, FieldKey.GENRE),
                field(tag, FieldKey.COMMENT),
                field(tag, FieldKey.YEAR),
                artwork);
    }

    private static String field(Tag tag, FieldKey key) {
        if (tag == null) {
            return null;
        }
        try {
            String value = tag.getFirst(key);
            return value == null || value.isBlank() ? null : value.trim();
        } catch (KeyNotFoundException | UnsupportedOperationException e) {
            log.debug("Tag field {} not supported by {}", key, tag.getClass().getSimpleName());
            return null;
        }
    }

    private static Integer positive(long value) {
        return value > 0 ? (int) value : null;
    }

    static Integer parseChannels(String channels) {
        if (channels == null || channels.isBlank()) {
            return null;
        }
        String lower = channels.trim().toLowerCase(Locale.ROOT);
        if (lower.startsWith("mono")) {
            return 1;
        }
        if (lower.startsWith("stereo") || lower.contains("joint")) {
            return 2;
        }
        try {
            return Integer.parseInt(lower.replaceAll("\\D.*$", ""));
        } catch (NumberFormatException e) {
            log.debug("Unrecognised channel description '{}'", channels);
            return null;
        }
    }
}
