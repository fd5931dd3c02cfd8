package io.deadswitch.application.service;

import io.deadswitch.application.port.output.MessageRenderer;
import io.deadswitch.application.port.output.MessageRenderer.RenderedMessage;
import io.deadswitch.application.port.output.OwnerDirectory;
import io.deadswitch.application.port.output.ReminderJobRepository;
import io.deadswitch.application.port.output.SecretDecryptor;
import io.deadswitch.application.port.output.SecretRepository;
import io.deadswitch.application.port.output.SwitchMetrics;
import io.deadswitch.application.service.FailureEscalationService.FailureReport;
import io.deadswitch.domain.model.CheckInToken;
import io.deadswitch.domain.model.EmailType;
import io.deadswitch.domain.model.Owner;
import io.deadswitch.domain.model.Recipient;
import io.deadswitch.domain.model.ReminderJob;
import io.deadswitch.domain.model.ReminderTier;
import io.deadswitch.domain.model.Secret;
import io.deadswitch.domain.model.SecretStatus;
import io.deadswitch.infrastructure.email.EmailData;
import io.deadswitch.infrastructure.email.EmailDeliveryService;
import io.deadswitch.infrastructure.email.EmailPriority;
import io.deadswitch.infrastructure.email.EmailResult;
import io.deadswitch.security.LogSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scans active secrets and sends due reminders and disclosures.
 *
 * Flow per run:
 * 1. Load candidates: deadline within the 7-day lookahead, already past,
 *    or past half of the interval
 * 2. Per secret, on a bounded worker pool: disclose if due, else send the
 *    due reminder tier unless it was already handled this cycle
 * 3. Aggregate counts; one failing secret never aborts the batch
 *
 * The whole run is capped by a wall-clock timeout. Secrets still in flight
 * when it expires are cancelled and counted as errors; they are picked up
 * again by the next run.
 */
public final class ReminderScheduler {
    private static final Logger log = LoggerFactory.getLogger(ReminderScheduler.class);

    static final Duration LOOKAHEAD = Duration.ofDays(7);

    private static final String NO_EMAIL_ERROR = "Recipient has no email address, phone delivery is not supported";

    private final SecretRepository secretRepo;
    private final ReminderJobRepository reminderRepo;
    private final OwnerDirectory ownerDirectory;
    private final CheckInTokenService tokenService;
    private final EmailDeliveryService deliveryService;
    private final FailureEscalationService escalationService;
    private final MessageRenderer renderer;
    private final SecretDecryptor decryptor;
    private final DisclosureStateMachine stateMachine;
    private final SwitchMetrics metrics;
    private final String siteUrl;
    private final Duration runTimeout;
    private final ExecutorService workers;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public ReminderScheduler(SecretRepository secretRepo,
                             ReminderJobRepository reminderRepo,
                             OwnerDirectory ownerDirectory,
                             CheckInTokenService tokenService,
                             EmailDeliveryService deliveryService,
                             FailureEscalationService escalationService,
                             MessageRenderer renderer,
                             SecretDecryptor decryptor,
                             DisclosureStateMachine stateMachine,
                             SwitchMetrics metrics,
                             String siteUrl,
                             int workerCount,
                             Duration runTimeout) {
        this.secretRepo = secretRepo;
        this.reminderRepo = reminderRepo;
        this.ownerDirectory = ownerDirectory;
        this.tokenService = tokenService;
        this.deliveryService = deliveryService;
        this.escalationService = escalationService;
        this.renderer = renderer;
        this.decryptor = decryptor;
        this.stateMachine = stateMachine;
        this.metrics = metrics;
        this.siteUrl = siteUrl;
        this.runTimeout = runTimeout;

        AtomicInteger threadIndex = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(workerCount, r -> {
            Thread t = new Thread(r, "reminder-worker-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Run one scan. Store failures while loading candidates propagate;
     * failures for individual secrets are counted.
     */
    public SchedulerRunSummary runOnce(Instant now) {
        if (!running.compareAndSet(false, true)) {
            log.warn("[SCHEDULER] Run requested while another run is in progress, skipping");
            return SchedulerRunSummary.alreadyRunning(now);
        }
        long startNanos = System.nanoTime();
        try {
            List<Secret> candidates = secretRepo.findSchedulerCandidates(now, now.plus(LOOKAHEAD));
            log.info("[SCHEDULER] Evaluating {} candidate secrets", candidates.size());

            RunCounters counters = new RunCounters();
            List<Callable<Void>> tasks = new ArrayList<>(candidates.size());
            for (Secret secret : candidates) {
                tasks.add(() -> {
                    processSecret(secret, now, counters);
                    return null;
                });
            }

            List<Future<Void>> futures;
            try {
                futures = workers.invokeAll(tasks, runTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.error("[SCHEDULER] Interrupted while waiting for workers");
                futures = List.of();
                counters.errors.addAndGet(candidates.size());
            }

            for (int i = 0; i < futures.size(); i++) {
                try {
                    futures.get(i).get();
                } catch (CancellationException e) {
                    counters.errors.incrementAndGet();
                    log.error("[SCHEDULER] Secret {} not finished within {}s run timeout",
                        candidates.get(i).id(), runTimeout.toSeconds());
                } catch (ExecutionException e) {
                    counters.errors.incrementAndGet();
                    log.error("[SCHEDULER] Secret {} failed: {}", candidates.get(i).id(),
                        e.getCause().getMessage(), e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    counters.errors.incrementAndGet();
                }
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            metrics.recordSchedulerRun(elapsed);
            SchedulerRunSummary summary = counters.toSummary(candidates.size(), now, elapsed.toMillis());
            log.info("[SCHEDULER] ✓ Run complete: reminders sent={} failed={}, disclosures={}, skipped={}, errors={} ({}ms)",
                summary.remindersSent(), summary.remindersFailed(), summary.disclosuresTriggered(),
                summary.secretsSkipped(), summary.errors(), summary.durationMs());
            return summary;
        } finally {
            running.set(false);
        }
    }

    public void shutdown() {
        log.info("[SCHEDULER] Stopping reminder workers...");
        workers.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void processSecret(Secret secret, Instant now, RunCounters counters) {
        try {
            if (!stateMachine.isSchedulable(secret)) {
                return;
            }
            if (stateMachine.isDisclosureDue(secret, now)) {
                disclose(secret, now, counters);
                return;
            }
            if (!secret.hasServerShare()) {
                counters.skipped.incrementAndGet();
                log.debug("[SCHEDULER] Secret {} is disabled, no reminders", secret.id());
                return;
            }
            Set<ReminderTier> recorded = reminderRepo.findRecordedTiers(secret.id(), secret.cycleStart());
            Optional<ReminderTier> tier = stateMachine.dueReminderTier(secret, now, recorded);
            if (tier.isPresent()) {
                sendReminder(secret, tier.get(), now, counters);
            }
        } catch (RuntimeException e) {
            counters.errors.incrementAndGet();
            log.error("[SCHEDULER] Failed to process secret {}: {}", secret.id(), e.getMessage(), e);
        }
    }

    private void sendReminder(Secret secret, ReminderTier tier, Instant now, RunCounters counters) {
        counters.remindersProcessed.incrementAndGet();

        Optional<Owner> owner = ownerDirectory.findOwner(secret.userId());
        if (owner.isEmpty() || owner.get().email() == null) {
            log.warn("[SCHEDULER] No owner email for secret {}, {} reminder not sent", secret.id(), tier.dbValue());
            reminderRepo.record(ReminderJob.failed(UUID.randomUUID().toString(), secret.id(), tier,
                secret.cycleStart(), now, "Owner email not found"));
            counters.remindersFailed.incrementAndGet();
            metrics.recordReminderFailed(tier);
            return;
        }

        CheckInToken token = tokenService.issue(secret, now);
        String checkInUrl = siteUrl + "/check-in?token=" + token.token();
        String timeRemaining = TimeFormatter.formatRemaining(stateMachine.remaining(secret, now));
        RenderedMessage message = renderer.renderReminder(secret, owner.get(), tier, timeRemaining, checkInUrl);

        EmailResult result = deliveryService.send(EmailData.builder()
            .to(owner.get().email())
            .subject(message.subject())
            .html(message.html())
            .text(message.text())
            .priority(tier.ordinal() <= ReminderTier.ONE_HOUR.ordinal() ? EmailPriority.HIGH : EmailPriority.NORMAL)
            .trackDelivery(true)
            .build());

        if (result.success()) {
            reminderRepo.record(ReminderJob.sent(UUID.randomUUID().toString(), secret.id(), tier,
                secret.cycleStart(), now));
            counters.remindersSent.incrementAndGet();
            metrics.recordReminderSent(tier);
            log.info("[SCHEDULER] ✓ {} reminder sent for secret {}", tier.dbValue(), secret.id());
            try {
                escalationService.resolveDelivered(EmailType.REMINDER, owner.get().email(),
                    reminderFailureSubject(secret));
            } catch (RuntimeException e) {
                log.error("[SCHEDULER] Failed to resolve earlier reminder failures for secret {}: {}",
                    secret.id(), e.getMessage(), e);
            }
            return;
        }

        counters.remindersFailed.incrementAndGet();
        metrics.recordReminderFailed(tier);

        // Rate limits are not terminal: leave the tier open for the next run
        if (result.retryAfterSeconds() != null) {
            log.warn("[SCHEDULER] {} reminder for secret {} rate limited, retry after {}s",
                tier.dbValue(), secret.id(), result.retryAfterSeconds());
            return;
        }

        escalate(new FailureReport(EmailType.REMINDER, result.provider(),
            owner.get().email(), reminderFailureSubject(secret), result.error(), secret.title()), secret.id());
        reminderRepo.record(ReminderJob.failed(UUID.randomUUID().toString(), secret.id(), tier,
            secret.cycleStart(), now, result.error()));
    }

    private void disclose(Secret secret, Instant now, RunCounters counters) {
        if (!secret.hasServerShare()) {
            counters.skipped.incrementAndGet();
            log.info("[SCHEDULER] Secret {} is past its deadline but disabled, not disclosing", secret.id());
            return;
        }
        stateMachine.transition(secret.status(), SecretStatus.TRIGGERED);

        String serverShare;
        try {
            serverShare = decryptor.decrypt(secret.serverShare(), secret.iv(), secret.authTag());
        } catch (RuntimeException e) {
            counters.disclosuresFailed.incrementAndGet();
            log.error("[SCHEDULER] Cannot decrypt server share of secret {}, disclosure postponed: {}",
                secret.id(), e.getMessage(), e);
            return;
        }

        Owner owner = ownerDirectory.findOwner(secret.userId()).orElse(new Owner(secret.userId(), null, null));
        int failedRecipients = 0;

        for (Recipient recipient : secret.recipients()) {
            try {
                if (!discloseTo(secret, recipient, owner, serverShare)) {
                    failedRecipients++;
                }
            } catch (RuntimeException e) {
                failedRecipients++;
                log.error("[SCHEDULER] Disclosure of secret {} to recipient {} failed: {}",
                    secret.id(), recipient.name(), e.getMessage(), e);
            }
        }

        // Deadline has passed: transition even when some deliveries failed
        if (secretRepo.markTriggered(secret.id(), secret.nextCheckIn(), now)) {
            counters.disclosuresTriggered.incrementAndGet();
            metrics.recordDisclosureTriggered();
            log.info("[SCHEDULER] ✓ Secret {} triggered, {}/{} recipients reached", secret.id(),
                secret.recipients().size() - failedRecipients, secret.recipients().size());
        } else {
            log.warn("[SCHEDULER] Secret {} was checked in or left active state during disclosure, not triggered",
                secret.id());
        }
        if (failedRecipients > 0) {
            counters.disclosuresFailed.incrementAndGet();
        }
    }

    /**
     * @return true if the recipient was sent the disclosure
     */
    private boolean discloseTo(Secret secret, Recipient recipient, Owner owner, String serverShare) {
        if (!recipient.hasEmail()) {
            log.error("[SCHEDULER] Recipient {} of secret {} has no email address", recipient.name(), secret.id());
            escalate(new FailureReport(EmailType.DISCLOSURE, deliveryService.providerName(),
                recipient.phone() != null ? recipient.phone() : recipient.name(), "Disclosure: " + secret.title(),
                NO_EMAIL_ERROR, secret.title()), secret.id());
            return false;
        }

        RenderedMessage message = renderer.renderDisclosure(secret, recipient, owner, serverShare);
        EmailResult result = deliveryService.send(EmailData.builder()
            .to(recipient.email())
            .subject(message.subject())
            .html(message.html())
            .text(message.text())
            .priority(EmailPriority.HIGH)
            .trackDelivery(true)
            .build());

        if (!result.success()) {
            escalate(new FailureReport(EmailType.DISCLOSURE, result.provider(),
                recipient.email(), message.subject(), result.error(), secret.title()), secret.id());
            return false;
        }

        log.info("[SCHEDULER] ✓ Disclosure of secret {} delivered to {}",
            secret.id(), LogSanitizer.email(recipient.email()));
        try {
            escalationService.resolveDelivered(EmailType.DISCLOSURE, recipient.email(), message.subject());
        } catch (RuntimeException e) {
            log.error("[SCHEDULER] Failed to resolve earlier disclosure failures for secret {}: {}",
                secret.id(), e.getMessage(), e);
        }
        return true;
    }

    /**
     * Reminder subjects carry the time remaining, so failures are logged under
     * one subject per secret and repeated failures add up on a single row.
     */
    static String reminderFailureSubject(Secret secret) {
        return "Check-in reminder: " + secret.title();
    }

    /**
     * Record a failed send. A broken failure store must not stop the caller's
     * remaining deliveries.
     */
    private void escalate(FailureReport report, String secretId) {
        try {
            escalationService.recordFailure(report);
        } catch (RuntimeException e) {
            log.error("[SCHEDULER] Failed to record {} failure for secret {}: {}",
                report.emailType().dbValue(), secretId, e.getMessage(), e);
        }
    }

    private static final class RunCounters {
        final AtomicInteger remindersProcessed = new AtomicInteger();
        final AtomicInteger remindersSent = new AtomicInteger();
        final AtomicInteger remindersFailed = new AtomicInteger();
        final AtomicInteger disclosuresTriggered = new AtomicInteger();
        final AtomicInteger disclosuresFailed = new AtomicInteger();
        final AtomicInteger skipped = new AtomicInteger();
        final AtomicInteger errors = new AtomicInteger();

        SchedulerRunSummary toSummary(int processed, Instant timestamp, long durationMs) {
            return new SchedulerRunSummary(processed, remindersProcessed.get(), remindersSent.get(),
                remindersFailed.get(), disclosuresTriggered.get(), disclosuresFailed.get(), skipped.get(),
                errors.get(), false, timestamp, durationMs);
        }
    }
}
