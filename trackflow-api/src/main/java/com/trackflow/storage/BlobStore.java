package com.trackflow.storage;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * An object area holding track media, addressed by slash separated keys such as
 * {@code audio/{trackId}/{filename}}.
 *
 * <p>Writes replace existing objects, so repeating a copy is safe.</p>
 */
public interface BlobStore {

    /** Name of the area, used in logs and events. */
    String area();

    boolean exists(String key) throws IOException;

    /**
     * Head lookup.
     *
     * @return size and modification time, or empty if the object does not exist
     */
    Optional<BlobInfo> stat(String key) throws IOException;

    /** Caller closes the stream. */
    InputStream open(String key) throws IOException;

    /** Reads at most {@code maxBytes} from the start of the object. */
    byte[] readHead(String key, int maxBytes) throws IOException;

    /**
     * @return number of bytes written
     */
    long put(String key, InputStream data) throws IOException;

    /**
     * Every object whose key starts with {@code prefix}, in key order.
     */
    List<String> list(String prefix) throws IOException;

    /**
     * @return {@code true} if an object was removed
     */
    boolean delete(String key) throws IOException;

    record BlobInfo(String key, long size, Instant lastModified) {
    }
}
