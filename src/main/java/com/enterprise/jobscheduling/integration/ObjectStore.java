package com.enterprise.jobscheduling.integration;

import java.io.IOException;

/**
 * Remote object storage capability
 */
public interface ObjectStore {
    
    /**
     * Store bytes under a key, replacing any existing object
     */
    void put(String bucket, String key, byte[] content) throws IOException;
    
    /**
     * URL through which the object can be downloaded
     */
    String urlFor(String bucket, String key);
}
