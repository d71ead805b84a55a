package com.enterprise.jobscheduling.integration;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

class FileSystemObjectStoreTest {
    
    @TempDir
    Path root;
    
    @Test
    void testPutWritesUnderBucket() throws Exception {
        FileSystemObjectStore store = new FileSystemObjectStore(root, null);
        
        store.put("job-files", "notes.txt", "first".getBytes(StandardCharsets.UTF_8));
        store.put("job-files", "notes.txt", "second".getBytes(StandardCharsets.UTF_8));
        
        Path stored = store.resolve("job-files", "notes.txt");
        assertEquals("second", Files.readString(stored));
        assertFalse(Files.exists(stored.resolveSibling("notes.txt.part")));
    }
    
    @Test
    void testUrlWithoutPublicBase() {
        FileSystemObjectStore store = new FileSystemObjectStore(root, null);
        
        assertEquals(store.resolve("job-files", "a.txt").toUri().toString(), store.urlFor("job-files", "a.txt"));
    }
    
    @Test
    void testUrlWithPublicBase() {
        FileSystemObjectStore store = new FileSystemObjectStore(root, "https://cdn.example.com/");
        
        assertEquals("https://cdn.example.com/job-files/annual%20report.pdf",
                     store.urlFor("job-files", "annual report.pdf"));
    }
    
    @Test
    void testKeyCannotEscapeBucket() {
        FileSystemObjectStore store = new FileSystemObjectStore(root, null);
        
        assertThrows(IllegalArgumentException.class, () -> store.resolve("job-files", "../other/secret"));
    }
}
