package com.xksgroup.vodpipeline.service.storage;

import com.xksgroup.vodpipeline.exception.ObjectStoreException;

import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Write-once object storage for processed artifacts.
 */
public interface ObjectStore {

    StoredObject put(Path file, String key, String contentType) throws ObjectStoreException;

    StoredObject put(String content, String key, String contentType) throws ObjectStoreException;

    StoredObject put(InputStream content, long contentLength, String key, String contentType) throws ObjectStoreException;

    /**
     * Time-limited GET URL for {@code key}.
     */
    String presign(String key, Duration ttl) throws ObjectStoreException;
}
