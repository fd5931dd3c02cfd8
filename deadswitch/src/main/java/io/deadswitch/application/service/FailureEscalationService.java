package io.deadswitch.application.service;

import io.deadswitch.application.port.output.EmailFailureRepository;
import io.deadswitch.application.port.output.MessageRenderer;
import io.deadswitch.application.port.output.MessageRenderer.RenderedMessage;
import io.deadswitch.application.port.output.SwitchMetrics;
import io.deadswitch.domain.model.EmailFailure;
import io.deadswitch.domain.model.EmailType;
import io.deadswitch.domain.monitoring.FailureSeverity;
import io.deadswitch.infrastructure.email.EmailData;
import io.deadswitch.infrastructure.email.EmailDeliveryService;
import io.deadswitch.infrastructure.email.EmailPriority;
import io.deadswitch.infrastructure.email.EmailResult;
import io.deadswitch.infrastructure.email.RetryPolicy;
import io.deadswitch.security.LogSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Logs email delivery failures, rates their severity and alerts operators.
 *
 * CRITICAL and HIGH failures send a high-priority email to the configured
 * operator address at once. MEDIUM and LOW are logged only. When the operator
 * email itself fails it is recorded as a LOW admin_notification failure,
 * which never notifies again.
 */
public final class FailureEscalationService {
    private static final Logger log = LoggerFactory.getLogger(FailureEscalationService.class);

    private static final int HIGH_SEVERITY_RETRY_COUNT = 3;
    private static final String UNKNOWN_ERROR = "Unknown error";
    static final int MAX_BATCH_RETRY = 100;

    /**
     * A failed send as reported by the caller.
     */
    public record FailureReport(
            EmailType emailType,
            String provider,
            String recipient,
            String subject,
            String errorMessage,
            String contextTitle // Secret title for operator alerts, may be null
    ) {}

    private final EmailFailureRepository failureRepo;
    private final EmailDeliveryService deliveryService;
    private final MessageRenderer renderer;
    private final SwitchMetrics metrics;
    private final String operatorEmail;
    private final Clock clock;

    public FailureEscalationService(EmailFailureRepository failureRepo,
                                    EmailDeliveryService deliveryService,
                                    MessageRenderer renderer,
                                    SwitchMetrics metrics,
                                    String operatorEmail,
                                    Clock clock) {
        this.failureRepo = failureRepo;
        this.deliveryService = deliveryService;
        this.renderer = renderer;
        this.metrics = metrics;
        this.operatorEmail = operatorEmail;
        this.clock = clock;
    }

    /**
     * disclosure is always CRITICAL; reminder is HIGH once retryCount &gt; 3,
     * else MEDIUM; every other type is LOW.
     */
    public static FailureSeverity calculateSeverity(EmailType type, int retryCount) {
        switch (type) {
            case DISCLOSURE:
                return FailureSeverity.CRITICAL;
            case REMINDER:
                return retryCount > HIGH_SEVERITY_RETRY_COUNT ? FailureSeverity.HIGH : FailureSeverity.MEDIUM;
            default:
                return FailureSeverity.LOW;
        }
    }

    /**
     * Log a failure. A repeat of an unresolved failure for the same type,
     * recipient and subject increments its retry count instead of adding a row.
     *
     * @return The stored failure with its current retry count
     */
    public EmailFailure recordFailure(FailureReport report) {
        EmailFailure failure = store(report);
        escalate(failure, report.contextTitle());
        return failure;
    }

    /**
     * Resend a logged failure. Only reminders can be rebuilt; the original
     * disclosure content is not kept. Permanent errors and failures past
     * their type's retry limit are not attempted.
     *
     * @throws FailureNotFoundException if no failure has this id
     */
    public FailureRetryResult retry(long failureId) {
        EmailFailure failure = failureRepo.findById(failureId)
            .orElseThrow(() -> new FailureNotFoundException(failureId));
        return retry(failure);
    }

    /**
     * Retry unresolved failures of one type, newest first, at most
     * {@value #MAX_BATCH_RETRY} per call.
     */
    public List<FailureRetryResult> retryAll(EmailType type) {
        EmailFailureRepository.Query query =
            new EmailFailureRepository.Query(type, null, null, true, MAX_BATCH_RETRY, 0);
        List<EmailFailure> failures = failureRepo.find(query);
        List<FailureRetryResult> results = new ArrayList<>(failures.size());
        for (EmailFailure failure : failures) {
            results.add(retry(failure));
        }
        long delivered = results.stream().filter(r -> r.outcome() == FailureRetryResult.Outcome.DELIVERED).count();
        log.info("[ESCALATION] Batch retry of {} failures: {} of {} delivered",
            type.dbValue(), delivered, results.size());
        return results;
    }

    private FailureRetryResult retry(EmailFailure failure) {
        if (failure.isResolved()) {
            return skipped(failure, FailureRetryResult.Outcome.ALREADY_RESOLVED);
        }
        if (RetryPolicy.classify(failure.errorMessage()) == RetryPolicy.FailureClass.PERMANENT) {
            log.info("[ESCALATION] Failure {} has a permanent error, not retrying", failure.id());
            return skipped(failure, FailureRetryResult.Outcome.PERMANENT);
        }
        if (!RetryPolicy.canRetry(failure.emailType(), failure.retryCount())) {
            log.info("[ESCALATION] Failure {} reached the {} retry limit of {}",
                failure.id(), failure.emailType().dbValue(), failure.emailType().maxRetries());
            return skipped(failure, FailureRetryResult.Outcome.EXHAUSTED);
        }
        if (failure.emailType() != EmailType.REMINDER) {
            return skipped(failure, FailureRetryResult.Outcome.UNSUPPORTED);
        }

        RenderedMessage message = renderer.renderReminderRetry(failure);
        EmailData email = EmailData.builder()
            .to(failure.recipient())
            .subject(message.subject())
            .html(message.html())
            .text(message.text())
            .priority(EmailPriority.HIGH)
            .build();

        EmailResult result = deliveryService.send(email);
        if (result.success()) {
            failureRepo.markResolved(failure.id(), clock.instant());
            log.info("[ESCALATION] ✓ Failure {} delivered on retry to {}",
                failure.id(), LogSanitizer.email(failure.recipient()));
            return new FailureRetryResult(failure.id(), FailureRetryResult.Outcome.DELIVERED,
                failure.retryCount(), null);
        }

        String error = result.error() != null ? result.error() : UNKNOWN_ERROR;
        int retryCount = failureRepo.incrementRetryCount(failure.id(), error);
        EmailFailure updated = new EmailFailure(failure.id(), failure.emailType(), result.provider(),
            failure.recipient(), failure.subject(), error, retryCount, failure.createdAt(), null);
        escalate(updated, null);
        return new FailureRetryResult(failure.id(), FailureRetryResult.Outcome.FAILED, retryCount, error);
    }

    private static FailureRetryResult skipped(EmailFailure failure, FailureRetryResult.Outcome outcome) {
        return new FailureRetryResult(failure.id(), outcome, failure.retryCount(), null);
    }

    /**
     * Mark a failure resolved by an operator.
     *
     * @throws FailureNotFoundException if no failure has this id
     */
    public void resolve(long failureId) {
        EmailFailure failure = failureRepo.findById(failureId)
            .orElseThrow(() -> new FailureNotFoundException(failureId));
        if (failure.isResolved()) {
            log.info("[ESCALATION] Failure {} already resolved at {}", failureId, failure.resolvedAt());
            return;
        }
        failureRepo.markResolved(failureId, clock.instant());
        log.info("[ESCALATION] ✓ Failure {} resolved", failureId);
    }

    /**
     * Resolve open failures of a send that has now been delivered.
     */
    public int resolveDelivered(EmailType type, String recipient, String subject) {
        int resolved = failureRepo.resolveMatching(type, recipient, subject, clock.instant());
        if (resolved > 0) {
            log.info("[ESCALATION] ✓ Resolved {} {} failure(s) for {} after delivery",
                resolved, type.dbValue(), LogSanitizer.email(recipient));
        }
        return resolved;
    }

    /**
     * Delete resolved failures older than the retention window. Unresolved
     * failures are never purged.
     *
     * @return Number of rows deleted
     */
    public int cleanup(int retentionDays) {
        if (retentionDays <= 0) {
            throw new IllegalArgumentException("retentionDays must be positive: " + retentionDays);
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(retentionDays));
        int deleted = failureRepo.deleteResolvedBefore(cutoff);
        log.info("[ESCALATION] Cleanup removed {} resolved failures older than {} days", deleted, retentionDays);
        return deleted;
    }

    public List<EmailFailure> list(EmailFailureRepository.Query query) {
        return failureRepo.find(query);
    }

    public EmailFailureRepository.Stats stats() {
        return failureRepo.stats();
    }

    private EmailFailure store(FailureReport report) {
        String errorMessage = report.errorMessage() != null ? report.errorMessage() : UNKNOWN_ERROR;
        Optional<EmailFailure> existing =
            failureRepo.findUnresolved(report.emailType(), report.recipient(), report.subject());
        if (existing.isPresent()) {
            EmailFailure prior = existing.get();
            int retryCount = failureRepo.incrementRetryCount(prior.id(), errorMessage);
            return new EmailFailure(prior.id(), prior.emailType(), report.provider(), prior.recipient(),
                prior.subject(), errorMessage, retryCount, prior.createdAt(), null);
        }

        EmailFailure failure = new EmailFailure(0L, report.emailType(), report.provider(), report.recipient(),
            report.subject(), errorMessage, 0, clock.instant(), null);
        long id = failureRepo.insert(failure);
        return failure.withId(id);
    }

    private void escalate(EmailFailure failure, String contextTitle) {
        FailureSeverity severity = calculateSeverity(failure.emailType(), failure.retryCount());
        metrics.recordFailureLogged(failure.emailType(), severity);

        switch (severity) {
            case CRITICAL:
                log.error("[ESCALATION-CRITICAL] {} to {} failed (retries={}): {}",
                    failure.emailType().dbValue(), LogSanitizer.email(failure.recipient()),
                    failure.retryCount(), failure.errorMessage());
                break;
            case HIGH:
                log.warn("[ESCALATION-HIGH] {} to {} failed (retries={}): {}",
                    failure.emailType().dbValue(), LogSanitizer.email(failure.recipient()),
                    failure.retryCount(), failure.errorMessage());
                break;
            case MEDIUM:
                log.warn("[ESCALATION-MEDIUM] {} to {} failed: {}",
                    failure.emailType().dbValue(), LogSanitizer.email(failure.recipient()), failure.errorMessage());
                break;
            case LOW:
                log.info("[ESCALATION-LOW] {} to {} failed: {}",
                    failure.emailType().dbValue(), LogSanitizer.email(failure.recipient()), failure.errorMessage());
                break;
        }

        if (severity.requiresOperatorNotification() && failure.emailType() != EmailType.ADMIN_NOTIFICATION) {
            notifyOperators(failure, severity, contextTitle);
        }
    }

    private void notifyOperators(EmailFailure failure, FailureSeverity severity, String contextTitle) {
        RenderedMessage message = renderer.renderAdminAlert(failure, severity, contextTitle);
        EmailData email = EmailData.builder()
            .to(operatorEmail)
            .subject(message.subject())
            .html(message.html())
            .text(message.text())
            .priority(EmailPriority.HIGH)
            .build();

        EmailResult result = deliveryService.send(email);
        if (result.success()) {
            log.info("[ESCALATION] ✓ Operators notified of {} failure {}", severity, failure.id());
            return;
        }

        log.error("[ESCALATION] Operator notification for failure {} failed: {}", failure.id(), result.error());
        recordFailure(new FailureReport(EmailType.ADMIN_NOTIFICATION, result.provider(), operatorEmail,
            message.subject(), result.error(), contextTitle));
    }
}
