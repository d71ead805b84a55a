package com.enterprise.jobscheduling.integration;

/**
 * Outbound mail capability
 */
public interface Mailer {
    
    /**
     * Send one message to one recipient
     * @throws Exception if the message could not be handed to the mail transport
     */
    void send(String recipient, String subject, String body) throws Exception;
}
