package io.deadswitch.infrastructure.email;

/**
 * Transport for a single email send attempt. Retries are the caller's job.
 */
public interface EmailProvider {

    /**
     * Provider name used in logs, metrics and failure records.
     */
    String name();

    /**
     * @return Provider message id
     * @throws EmailSendException if the attempt failed
     */
    String send(EmailData email);

    boolean supportsTracking();
}
