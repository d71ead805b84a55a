package com.enterprise.jobscheduling.integration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Object store that keeps each bucket as a directory under a root path.
 * URLs point at {@code publicBaseUrl} when one is configured, otherwise at the local file.
 */
public class FileSystemObjectStore implements ObjectStore {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemObjectStore.class);

    private final Path root;
    private final String publicBaseUrl;

    public FileSystemObjectStore(Path root, String publicBaseUrl) {
        this.root = root.toAbsolutePath().normalize();
        this.publicBaseUrl = publicBaseUrl != null && publicBaseUrl.endsWith("/")
            ? publicBaseUrl.substring(0, publicBaseUrl.length() - 1)
            : publicBaseUrl;
    }

    @Override
    public void put(String bucket, String key, byte[] content) throws IOException {
        Path target = resolve(bucket, key);
        Files.createDirectories(target.getParent());

        // Write aside and move so readers never see a partial object
        Path partial = target.resolveSibling(target.getFileName() + ".part");
        Files.write(partial, content);
        Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

        logger.debug("Stored {} bytes at {}/{}", content.length, bucket, key);
    }

    @Override
    public String urlFor(String bucket, String key) {
        if (publicBaseUrl == null || publicBaseUrl.isEmpty()) {
            return resolve(bucket, key).toUri().toString();
        }
        return publicBaseUrl + "/" + encode(bucket) + "/" + encode(key);
    }

    /**
     * Local path of an object
     */
    public Path resolve(String bucket, String key) {
        Path target = root.resolve(bucket).resolve(key).normalize();
        if (!target.startsWith(root.resolve(bucket).normalize())) {
            throw new IllegalArgumentException("Object key escapes its bucket: " + key);
        }
        return target;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
