package io.deadswitch.application.port.output;

import io.deadswitch.domain.model.Secret;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for the secrets table.
 *
 * OWNERSHIP:
 * This core only resets deadlines (through CheckInTokenRepository.consume)
 * and moves secrets to triggered. Creation and deletion happen elsewhere.
 */
public interface SecretRepository {

    Optional<Secret> findById(String secretId);

    /**
     * Active secrets that may need a reminder or a disclosure.
     *
     * Returns secrets whose nextCheckIn is at or before {@code lookaheadUntil},
     * plus secrets that have already used up half of their interval at
     * {@code now} (the widest percentage tier).
     *
     * @param now            Evaluation time
     * @param lookaheadUntil Furthest fixed reminder horizon
     * @return Candidate secrets, never null
     */
    List<Secret> findSchedulerCandidates(Instant now, Instant lookaheadUntil);

    /**
     * Move an active secret to triggered.
     *
     * Conditional on status = active so concurrent runs disclose once, and on
     * the deadline still being the one the disclosure was decided on. A
     * check-in committed in between moves next_check_in past {@code dueAt}
     * and wins.
     *
     * @param dueAt nextCheckIn of the secret as read by the scheduler
     * @return true if this call performed the transition
     */
    boolean markTriggered(String secretId, Instant dueAt, Instant triggeredAt);
}
