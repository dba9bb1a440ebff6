package com.trackflow.storage;

import java.util.Optional;

/**
 * Maps blob keys of one media area to the public URLs stored on track records.
 */
public final class MediaUrls {

    private final String baseUrl;

    public MediaUrls(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Media base URL must be set");
        }
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public String baseUrl() {
        return baseUrl;
    }

    public String urlFor(String key) {
        return baseUrl + "/" + key;
    }

    /**
     * @return the blob key, or empty if the URL does not point into this area
     */
    public Optional<String> keyOf(String url) {
        if (url == null || !url.startsWith(baseUrl + "/")) {
            return Optional.empty();
        }
        String key = url.substring(baseUrl.length() + 1);
        return key.isBlank() ? Optional.empty() : Optional.of(key);
    }

    /**
     * Points a URL of this area at the same key in {@code other}. URLs from
     * elsewhere are returned unchanged.
     */
    public String rebase(String url, MediaUrls other) {
        return keyOf(url).map(other::urlFor).orElse(url);
    }

    public static String trackPrefix(String trackId) {
        return "audio/" + trackId + "/";
    }
}
