package com.enterprise.jobscheduling.handler;

import com.enterprise.jobscheduling.core.Job;
import com.enterprise.jobscheduling.integration.Mailer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sends one message to the job's recipient
 */
public class SendEmailHandler implements JobHandler {
    
    private static final Logger logger = LoggerFactory.getLogger(SendEmailHandler.class);
    
    public static final String RECIPIENT = "recipient";
    public static final String SUBJECT = "subject";
    public static final String BODY = "body";
    
    private final Mailer mailer;
    
    public SendEmailHandler(Mailer mailer) {
        this.mailer = mailer;
    }
    
    @Override
    public Map<String, Object> handle(Job job) throws Exception {
        String recipient = job.getParameter(RECIPIENT);
        if (recipient == null || recipient.isBlank()) {
            throw new IllegalArgumentException("Missing required parameter: " + RECIPIENT);
        }
        String subject = job.getParameter(SUBJECT);
        String body = job.getParameter(BODY);
        
        logger.info("Sending email for job {} to {} with subject: {}", job.getId(), recipient, subject);
        mailer.send(recipient, subject != null ? subject : "", body != null ? body : "");
        
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("message", "Email sent to " + recipient);
        result.put(RECIPIENT, recipient);
        return result;
    }
}
