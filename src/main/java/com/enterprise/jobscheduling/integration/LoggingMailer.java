package com.enterprise.jobscheduling.integration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Mailer that writes messages to the log instead of a mail server.
 * Used when no mail transport is configured.
 */
public class LoggingMailer implements Mailer {
    
    private static final Logger logger = LoggerFactory.getLogger(LoggingMailer.class);
    
    private final String fromAddress;
    private final AtomicLong sent = new AtomicLong(0);
    
    public LoggingMailer(String fromAddress) {
        this.fromAddress = fromAddress;
    }
    
    @Override
    public void send(String recipient, String subject, String body) {
        sent.incrementAndGet();
        logger.info("Mail from {} to {} with subject '{}' ({} chars)",
                   fromAddress, recipient, subject, body != null ? body.length() : 0);
    }
    
    public long getSentCount() {
        return sent.get();
    }
}
