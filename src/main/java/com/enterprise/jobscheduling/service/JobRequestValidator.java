package com.enterprise.jobscheduling.service;

import com.enterprise.jobscheduling.core.Frequency;
import com.enterprise.jobscheduling.core.JobType;
import com.enterprise.jobscheduling.core.ScheduleType;
import com.enterprise.jobscheduling.exception.ValidationException;
import com.enterprise.jobscheduling.handler.SendEmailHandler;
import com.enterprise.jobscheduling.handler.UploadFileHandler;

import java.time.Instant;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Boundary checks for job submissions. A request that fails here is never persisted.
 */
public class JobRequestValidator {

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
    private static final int MAX_FILE_NAME_LENGTH = 255;

    private final long maxUploadBytes;

    public JobRequestValidator(long maxUploadBytes) {
        this.maxUploadBytes = maxUploadBytes;
    }

    public long getMaxUploadBytes() {
        return maxUploadBytes;
    }

    /**
     * Validate a single request against the current instant
     */
    public void validate(JobRequest request, Instant now) throws ValidationException {
        if (request.getJobType() == null) {
            throw new ValidationException("job_type", "Job type is required");
        }
        if (request.getMaxRetries() < 0) {
            throw new ValidationException("max_retries", "Max retries cannot be negative");
        }

        validateSchedule(request.getScheduleType(), request.getScheduledTime(), request.getFrequency(), now);

        if (request.getJobType() == JobType.SEND_EMAIL) {
            validateRecipient(request.getParameter(SendEmailHandler.RECIPIENT));
        } else if (request.getJobType() == JobType.UPLOAD_FILE) {
            validateFileName(request.getParameter(UploadFileHandler.FILE_NAME));
            if (request.getParameter(UploadFileHandler.TEMP_PATH) == null) {
                throw new ValidationException(UploadFileHandler.TEMP_PATH, "Upload source path is required");
            }
        }
    }

    /**
     * Check that schedule fields are consistent with the schedule type
     */
    public void validateSchedule(ScheduleType scheduleType, Instant scheduledTime, Frequency frequency,
                                 Instant now) throws ValidationException {
        if (scheduleType == null) {
            throw new ValidationException("schedule_type", "Schedule type is required");
        }

        switch (scheduleType) {
            case IMMEDIATE:
                if (scheduledTime != null) {
                    throw new ValidationException("scheduled_time",
                        "Scheduled time is only allowed for scheduled and interval jobs");
                }
                break;

            case SCHEDULED:
                if (scheduledTime == null) {
                    throw new ValidationException("scheduled_time", "Scheduled time is required for scheduled jobs");
                }
                if (!scheduledTime.isAfter(now)) {
                    throw new ValidationException("scheduled_time", "Scheduled time must be in the future");
                }
                break;

            case INTERVAL:
                if (frequency == null) {
                    throw new ValidationException("frequency", "Frequency is required for interval jobs");
                }
                break;

            default:
                throw new ValidationException("schedule_type", "Unsupported schedule type: " + scheduleType);
        }

        if (frequency != null && scheduleType != ScheduleType.INTERVAL) {
            throw new ValidationException("frequency", "Frequency is only allowed for interval jobs");
        }
    }

    public void validateRecipient(String recipient) throws ValidationException {
        if (recipient == null || recipient.trim().isEmpty()) {
            throw new ValidationException(SendEmailHandler.RECIPIENT, "Recipient is required");
        }
        if (!isValidEmail(recipient)) {
            throw new ValidationException(SendEmailHandler.RECIPIENT, "Invalid email address: " + recipient);
        }
    }

    /**
     * Validate a recipient list for bulk mail
     */
    public void validateRecipients(List<String> recipients) throws ValidationException {
        if (recipients == null || recipients.isEmpty()) {
            throw new ValidationException("recipients", "At least one recipient is required");
        }
        for (String recipient : recipients) {
            if (recipient == null || !isValidEmail(recipient)) {
                throw new ValidationException("recipients", "Invalid email address: " + recipient);
            }
        }
    }

    public void validateUpload(String fileName, byte[] content) throws ValidationException {
        validateFileName(fileName);
        if (content == null) {
            throw new ValidationException("file", "File content is required");
        }
        if (content.length > maxUploadBytes) {
            throw new ValidationException("file", String.format(
                "File is %d bytes, the limit is %d bytes", content.length, maxUploadBytes));
        }
    }

    private void validateFileName(String fileName) throws ValidationException {
        if (fileName == null || fileName.trim().isEmpty()) {
            throw new ValidationException(UploadFileHandler.FILE_NAME, "File name is required");
        }
        if (fileName.length() > MAX_FILE_NAME_LENGTH) {
            throw new ValidationException(UploadFileHandler.FILE_NAME,
                "File name cannot exceed " + MAX_FILE_NAME_LENGTH + " characters");
        }
        if (fileName.contains("/") || fileName.contains("\\") || fileName.equals("..") || fileName.equals(".")) {
            throw new ValidationException(UploadFileHandler.FILE_NAME, "File name cannot contain a path");
        }
    }

    public static boolean isValidEmail(String address) {
        return address != null && EMAIL.matcher(address.trim()).matches();
    }
}
