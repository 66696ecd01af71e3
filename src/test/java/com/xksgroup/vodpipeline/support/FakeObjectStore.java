package com.xksgroup.vodpipeline.support;

import com.xksgroup.vodpipeline.exception.ObjectStoreException;
import com.xksgroup.vodpipeline.service.storage.ObjectStore;
import com.xksgroup.vodpipeline.service.storage.StoredObject;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Object store held in memory. Presigned URLs are {@code https://signed/<key>}.
 */
public class FakeObjectStore implements ObjectStore {

    public final Map<String, byte[]> objects = new ConcurrentHashMap<>();
    public final Map<String, String> contentTypes = new ConcurrentHashMap<>();

    public volatile String failOnKey;
    public volatile boolean presignFailure;

    @Override
    public StoredObject put(Path file, String key, String contentType) throws ObjectStoreException {
        try {
            return store(key, Files.readAllBytes(file), contentType);
        } catch (IOException e) {
            throw new ObjectStoreException("cannot read " + file, e);
        }
    }

    @Override
    public StoredObject put(String content, String key, String contentType) throws ObjectStoreException {
        return store(key, content.getBytes(StandardCharsets.UTF_8), contentType);
    }

    @Override
    public StoredObject put(InputStream content, long contentLength, String key, String contentType)
            throws ObjectStoreException {
        try {
            return store(key, content.readAllBytes(), contentType);
        } catch (IOException e) {
            throw new ObjectStoreException("cannot read stream", e);
        }
    }

    @Override
    public String presign(String key, Duration ttl) throws ObjectStoreException {
        if (presignFailure) {
            throw new ObjectStoreException("signer unavailable");
        }
        return "https://signed/" + key;
    }

    public String text(String key) {
        return new String(objects.get(key), StandardCharsets.UTF_8);
    }

    private StoredObject store(String key, byte[] bytes, String contentType) throws ObjectStoreException {
        if (key.equals(failOnKey)) {
            throw new ObjectStoreException("bucket unreachable");
        }
        objects.put(key, bytes);
        contentTypes.put(key, contentType);
        return new StoredObject(key, bytes.length);
    }
}
