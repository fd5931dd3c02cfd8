package io.deadswitch.application.port.output;

import io.deadswitch.domain.model.EmailFailure;
import io.deadswitch.domain.model.EmailType;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository for email_failures.
 */
public interface EmailFailureRepository {

    /**
     * List filter. Null fields are not applied.
     */
    record Query(
            EmailType emailType,
            String provider,
            String recipient,
            boolean unresolvedOnly,
            int limit,
            int offset
    ) {
        public static Query unresolved(int limit) {
            return new Query(null, null, null, true, limit, 0);
        }
    }

    record Stats(
            long total,
            long unresolved,
            Map<String, Long> byProvider,
            Map<String, Long> byType
    ) {}

    /**
     * @return Generated id
     */
    long insert(EmailFailure failure);

    Optional<EmailFailure> findById(long id);

    /**
     * Latest unresolved failure of the same logical send.
     */
    Optional<EmailFailure> findUnresolved(EmailType emailType, String recipient, String subject);

    /**
     * Increment retry_count and store the latest error.
     *
     * @return New retry count
     */
    int incrementRetryCount(long id, String errorMessage);

    /**
     * @return true if the row existed and was unresolved
     */
    boolean markResolved(long id, Instant resolvedAt);

    /**
     * Resolve every unresolved failure of the same logical send.
     *
     * @return Number of rows resolved
     */
    int resolveMatching(EmailType emailType, String recipient, String subject, Instant resolvedAt);

    /**
     * Delete resolved failures resolved before the cutoff. Unresolved rows are kept.
     *
     * @return Number of rows deleted
     */
    int deleteResolvedBefore(Instant cutoff);

    List<EmailFailure> find(Query query);

    Stats stats();
}
