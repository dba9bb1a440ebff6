package com.trackflow.service;

import java.util.Locale;

/**
 * Technical and descriptive data read from an audio file. Descriptive fields are
 * null when the file carries no such tag.
 */
public record AudioMetadata(
        int durationSeconds,
        Integer bitrate,
        Integer sampleRate,
        Integer channels,
        String title,
        String artist,
        String album,
        String genre,
        String comment,
        String year,
        Artwork artwork) {

    public record Artwork(byte[] data, String mimeType) {

        public String extension() {
            if (mimeType == null) {
                return "jpg";
            }
            return switch (mimeType.toLowerCase(Locale.ROOT)) {
                case "image/png" -> "png";
                case "image/gif" -> "gif";
                case "image/webp" -> "webp";
                default -> "jpg";
            };
        }
    }
}
