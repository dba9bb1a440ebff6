package com.trackflow.service;

import com.trackflow.error.EnrichmentException;

import java.io.IOException;
import java.nio.file.Path;

public interface AudioMetadataReader {

    /**
     * @throws EnrichmentException if the file is not decodable audio
     * @throws IOException         if the file cannot be read at all
     */
    AudioMetadata read(Path file) throws IOException;
}
