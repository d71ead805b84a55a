package com.enterprise.jobscheduling.exception;

import java.util.UUID;

/**
 * Exception thrown when the temporary file behind an upload job no longer exists.
 * Jobs failing this way are not retried.
 */
public class SourceFileMissingException extends JobNotFoundException {
    
    private final String path;
    
    public SourceFileMissingException(UUID jobId, String path) {
        super(jobId, "Source file not found: " + path);
        this.path = path;
    }
    
    public String getPath() {
        return path;
    }
}
