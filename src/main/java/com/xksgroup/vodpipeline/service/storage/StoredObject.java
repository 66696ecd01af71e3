package com.xksgroup.vodpipeline.service.storage;

import lombok.Value;

@Value
public class StoredObject {
    // Object key within the bucket
    String location;
    long sizeBytes;
}
