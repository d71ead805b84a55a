package com.enterprise.jobscheduling.handler;

import com.enterprise.jobscheduling.core.Job;
import com.enterprise.jobscheduling.exception.SourceFileMissingException;
import com.enterprise.jobscheduling.integration.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Moves a temporarily stored upload into the object store and reports its download URL
 */
public class UploadFileHandler implements JobHandler {

    private static final Logger logger = LoggerFactory.getLogger(UploadFileHandler.class);

    public static final String FILE_NAME = "file_name";
    public static final String TEMP_PATH = "temp_path";
    public static final String FILE_URL = "file_url";

    private final ObjectStore objectStore;
    private final String bucket;

    public UploadFileHandler(ObjectStore objectStore, String bucket) {
        this.objectStore = objectStore;
        this.bucket = bucket;
    }

    /**
     * @throws SourceFileMissingException if the temporary file is gone, e.g. cleaned up before a delayed run
     */
    @Override
    public Map<String, Object> handle(Job job) throws Exception {
        String fileName = job.getParameter(FILE_NAME);
        String tempPath = job.getParameter(TEMP_PATH);
        if (fileName == null || tempPath == null) {
            throw new IllegalArgumentException("Upload job requires " + FILE_NAME + " and " + TEMP_PATH);
        }

        Path source = Paths.get(tempPath);
        if (!Files.exists(source)) {
            throw new SourceFileMissingException(job.getId(), tempPath);
        }

        byte[] content = Files.readAllBytes(source);
        objectStore.put(bucket, fileName, content);
        Files.deleteIfExists(source);

        String url = objectStore.urlFor(bucket, fileName);
        logger.info("Uploaded {} ({} bytes) for job {}", fileName, content.length, job.getId());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("message", "File " + fileName + " uploaded.");
        result.put(FILE_NAME, fileName);
        result.put(FILE_URL, url);
        return result;
    }
}
