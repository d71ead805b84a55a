package com.enterprise.jobscheduling.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of work a job can carry. The type selects the handler that runs it.
 */
public enum JobType {
    SEND_EMAIL("send_email", "Send Email"),
    PROCESS_IMAGE("process_image", "Process Image"),
    GENERATE_REPORT("generate_report", "Generate Report"),
    BACKUP_DATABASE("backup_database", "Backup Database"),
    FETCH_DATA("fetch_data", "Fetch Data"),
    BATCH_PROCESS("batch_process", "Batch Process"),
    SEND_NOTIFICATION("send_notification", "Send Notification"),
    CLEANUP_FILES("cleanup_files", "Cleanup Files"),
    UPLOAD_FILE("upload_file", "Upload File");
    
    private final String value;
    private final String label;
    
    JobType(String value, String label) {
        this.value = value;
        this.label = label;
    }
    
    @JsonValue
    public String getValue() { return value; }
    
    public String getLabel() { return label; }
    
    @JsonCreator
    public static JobType fromValue(String value) {
        for (JobType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown job type: " + value);
    }
    
    @Override
    public String toString() {
        return value;
    }
}
