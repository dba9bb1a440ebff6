package com.trackflow.service;

import com.trackflow.repository.TrackStore;
import com.trackflow.storage.BlobStore;
import com.trackflow.storage.MediaUrls;

/**
 * The environment tracks are promoted into.
 */
public interface TargetEnvironment {

    String name();

    TrackStore tracks();

    BlobStore media();

    MediaUrls mediaUrls();
}
