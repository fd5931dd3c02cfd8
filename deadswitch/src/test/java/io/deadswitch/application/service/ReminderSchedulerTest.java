package io.deadswitch.application.service;

import io.deadswitch.application.port.output.EmailFailureRepository;
import io.deadswitch.application.port.output.OwnerDirectory;
import io.deadswitch.application.port.output.SecretDecryptor;
import io.deadswitch.domain.model.CheckInResult;
import io.deadswitch.domain.model.CheckInToken;
import io.deadswitch.domain.model.EmailFailure;
import io.deadswitch.domain.model.EmailType;
import io.deadswitch.domain.model.Owner;
import io.deadswitch.domain.model.Recipient;
import io.deadswitch.domain.model.ReminderJob;
import io.deadswitch.domain.model.ReminderJobStatus;
import io.deadswitch.domain.model.ReminderTier;
import io.deadswitch.domain.model.Secret;
import io.deadswitch.domain.model.SecretStatus;
import io.deadswitch.infrastructure.email.EmailData;
import io.deadswitch.infrastructure.email.EmailDeliveryService;
import io.deadswitch.infrastructure.email.EmailPriority;
import io.deadswitch.infrastructure.email.EmailSendException;
import io.deadswitch.infrastructure.email.InMemoryEmailProvider;
import io.deadswitch.infrastructure.email.RetryPolicy;
import io.deadswitch.infrastructure.metrics.PrometheusSwitchMetrics;
import io.deadswitch.infrastructure.render.DefaultMessageRenderer;
import io.deadswitch.support.InMemoryCheckInTokenRepository;
import io.deadswitch.support.InMemoryEmailFailureRepository;
import io.deadswitch.support.InMemoryReminderJobRepository;
import io.deadswitch.support.InMemorySecretRepository;
import io.deadswitch.support.MutableClock;
import io.deadswitch.support.TestSecrets;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class ReminderSchedulerTest {

    private static final Instant LAST_CHECK_IN = Instant.parse("2024-06-01T00:00:00Z");
    private static final String SITE_URL = "https://switch.example";
    private static final String OPERATOR = "ops@example.com";
    private static final String SHARE = "decrypted-server-share";

    private InMemorySecretRepository secrets;
    private InMemoryReminderJobRepository jobs;
    private InMemoryEmailFailureRepository failures;
    private InMemoryCheckInTokenRepository tokens;
    private InMemoryEmailProvider provider;
    private CollectorRegistry registry;
    private MutableClock clock;
    private PrometheusSwitchMetrics metrics;
    private EmailDeliveryService delivery;
    private DefaultMessageRenderer renderer;
    private DisclosureStateMachine machine;
    private CheckInTokenService tokenService;
    private ReminderScheduler scheduler;

    private final Map<String, Owner> owners = Map.of(
        "user-1", new Owner("user-1", "owner@example.com", "Olivia Owner"),
        "user-2", new Owner("user-2", "second@example.com", null));

    private final OwnerDirectory ownerDirectory = userId -> {
        if ("broken".equals(userId)) {
            throw new IllegalStateException("directory unavailable");
        }
        return Optional.ofNullable(owners.get(userId));
    };

    private volatile boolean decryptFails;
    private volatile Runnable duringDisclosure; // Runs once the disclosure decision is made
    private final SecretDecryptor decryptor = (share, iv, tag) -> {
        if (decryptFails) {
            throw new IllegalStateException("Failed to decrypt server share");
        }
        if (duringDisclosure != null) {
            duringDisclosure.run();
        }
        return SHARE;
    };

    @BeforeEach
    void setUp() {
        secrets = new InMemorySecretRepository();
        jobs = new InMemoryReminderJobRepository();
        failures = new InMemoryEmailFailureRepository();
        tokens = new InMemoryCheckInTokenRepository(secrets);
        provider = new InMemoryEmailProvider();
        registry = new CollectorRegistry();

        metrics = new PrometheusSwitchMetrics(registry);
        clock = new MutableClock(LAST_CHECK_IN);
        RetryPolicy fastRetries = RetryPolicy.builder()
            .baseDelay(Duration.ofMillis(1))
            .maxDelay(Duration.ofMillis(5))
            .jitterRatio(0)
            .build();
        delivery = new EmailDeliveryService(
            provider, fastRetries, metrics, "noreply@switch.example", "Dead Man's Switch");
        renderer = new DefaultMessageRenderer(SITE_URL);
        machine = new DisclosureStateMachine();
        tokenService = new CheckInTokenService(tokens, secrets, machine, metrics, clock, Duration.ZERO);

        scheduler = newScheduler(failures);
    }

    private ReminderScheduler newScheduler(EmailFailureRepository failureStore) {
        FailureEscalationService escalation = new FailureEscalationService(
            failureStore, delivery, renderer, metrics, OPERATOR, clock);
        return new ReminderScheduler(secrets, jobs, ownerDirectory, tokenService, delivery, escalation,
            renderer, decryptor, machine, metrics, SITE_URL, 4, Duration.ofSeconds(10));
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    @DisplayName("29.9 days into a 30-day cycle sends the 12 hour reminder once")
    void sendsMostUrgentReminderOncePerCycle() {
        Secret secret = TestSecrets.active("s1", "user-1", 30, LAST_CHECK_IN);
        secrets.save(secret);
        Instant now = LAST_CHECK_IN.plusMillis((long) (29.9 * Secret.MILLIS_PER_DAY));

        SchedulerRunSummary first = scheduler.runOnce(now);

        assertEquals(1, first.processed());
        assertEquals(1, first.remindersSent());
        List<EmailData> sent = provider.getSentEmails();
        assertEquals(1, sent.size());
        EmailData email = sent.get(0);
        assertEquals("owner@example.com", email.to());
        assertEquals("URGENT: Check-in required within 2 hours - Secret s1", email.subject());
        assertTrue(email.text().contains(SITE_URL + "/check-in?token="));
        assertEquals(EmailPriority.NORMAL, email.priority());
        assertEquals(1, tokens.size());

        List<ReminderJob> recorded = jobs.all();
        assertEquals(1, recorded.size());
        assertEquals(ReminderTier.TWELVE_HOURS, recorded.get(0).tier());
        assertEquals(ReminderJobStatus.SENT, recorded.get(0).status());
        assertEquals(LAST_CHECK_IN, recorded.get(0).cycleStartedAt());

        SchedulerRunSummary second = scheduler.runOnce(now.plusSeconds(60));

        assertEquals(0, second.remindersSent());
        assertEquals(1, provider.getSentEmails().size());
        assertEquals(1.0, registry.getSampleValue("deadswitch_reminders_sent_total",
            new String[]{"tier"}, new String[]{"12_hours"}));
    }

    @Test
    void finalTiersGoOutAtHighPriority() {
        Secret secret = TestSecrets.active("s1", "user-1", 30, LAST_CHECK_IN);
        secrets.save(secret);

        scheduler.runOnce(secret.nextCheckIn().minus(Duration.ofMinutes(10)));

        EmailData email = provider.getSentEmails().get(0);
        assertEquals(EmailPriority.HIGH, email.priority());
        assertTrue(email.subject().startsWith("CRITICAL: Check-in required within 10 minutes"));
    }

    @Test
    @DisplayName("One minute past the deadline every recipient gets exactly one disclosure")
    void disclosesToEveryRecipientOnce() {
        Secret secret = TestSecrets.active("s1", "user-1", 7, LAST_CHECK_IN);
        secrets.save(secret);
        Instant now = secret.nextCheckIn().plusSeconds(60);

        SchedulerRunSummary summary = scheduler.runOnce(now);

        assertEquals(1, summary.disclosuresTriggered());
        assertEquals(0, summary.disclosuresFailed());
        Secret stored = secrets.get("s1");
        assertEquals(SecretStatus.TRIGGERED, stored.status());
        assertEquals(now, stored.triggeredAt());

        Map<String, Long> perRecipient = provider.getSentEmails().stream()
            .collect(Collectors.groupingBy(EmailData::to, Collectors.counting()));
        assertEquals(Map.of("alice@example.com", 1L, "bob@example.com", 1L), perRecipient);

        EmailData disclosure = provider.getSentEmails().get(0);
        assertEquals("Confidential Message from Olivia Owner - Secret s1", disclosure.subject());
        assertTrue(disclosure.text().contains(SHARE));
        assertEquals(EmailPriority.HIGH, disclosure.priority());

        SchedulerRunSummary again = scheduler.runOnce(now.plusSeconds(300));
        assertEquals(0, again.processed());
        assertEquals(2, provider.getSentEmails().size());
    }

    @Test
    void disabledSecretIsNeverDisclosed() {
        Secret secret = TestSecrets.disabled(TestSecrets.active("s1", "user-1", 7, LAST_CHECK_IN));
        secrets.save(secret);

        SchedulerRunSummary summary = scheduler.runOnce(secret.nextCheckIn().plusSeconds(60));

        assertEquals(1, summary.secretsSkipped());
        assertEquals(0, summary.disclosuresTriggered());
        assertEquals(SecretStatus.ACTIVE, secrets.get("s1").status());
        assertTrue(provider.getSentEmails().isEmpty());
    }

    @Test
    void disabledSecretGetsNoReminders() {
        Secret secret = TestSecrets.disabled(TestSecrets.active("s1", "user-1", 7, LAST_CHECK_IN));
        secrets.save(secret);

        SchedulerRunSummary summary = scheduler.runOnce(secret.nextCheckIn().minus(Duration.ofHours(2)));

        assertEquals(1, summary.secretsSkipped());
        assertEquals(0, summary.remindersProcessed());
        assertTrue(provider.getSentEmails().isEmpty());
    }

    @Test
    void decryptFailurePostponesDisclosure() {
        decryptFails = true;
        Secret secret = TestSecrets.active("s1", "user-1", 7, LAST_CHECK_IN);
        secrets.save(secret);

        SchedulerRunSummary summary = scheduler.runOnce(secret.nextCheckIn().plusSeconds(60));

        assertEquals(1, summary.disclosuresFailed());
        assertEquals(0, summary.disclosuresTriggered());
        assertEquals(SecretStatus.ACTIVE, secrets.get("s1").status());
        assertTrue(provider.getSentEmails().isEmpty());
    }

    @Test
    void recipientWithoutEmailIsEscalatedAndOthersStillReceive() {
        Secret secret = TestSecrets.withRecipients(
            TestSecrets.active("s1", "user-1", 7, LAST_CHECK_IN),
            List.of(new Recipient("Carol", null, "+15550123"), new Recipient("Alice", "alice@example.com", null)));
        secrets.save(secret);

        SchedulerRunSummary summary = scheduler.runOnce(secret.nextCheckIn().plusSeconds(60));

        assertEquals(1, summary.disclosuresTriggered());
        assertEquals(1, summary.disclosuresFailed());
        assertEquals(SecretStatus.TRIGGERED, secrets.get("s1").status());

        List<String> recipients = provider.getSentEmails().stream().map(EmailData::to).collect(Collectors.toList());
        assertTrue(recipients.contains("alice@example.com"));
        assertTrue(recipients.contains(OPERATOR));

        EmailFailure failure = failures.all().get(0);
        assertEquals(EmailType.DISCLOSURE, failure.emailType());
        assertEquals("+15550123", failure.recipient());
        assertFalse(failure.isResolved());
    }

    @Test
    void oneBrokenSecretDoesNotStopTheRun() {
        secrets.save(TestSecrets.active("bad", "broken", 30, LAST_CHECK_IN));
        Secret good = TestSecrets.active("good", "user-2", 30, LAST_CHECK_IN);
        secrets.save(good);

        SchedulerRunSummary summary = scheduler.runOnce(good.nextCheckIn().minus(Duration.ofHours(2)));

        assertEquals(2, summary.processed());
        assertEquals(1, summary.errors());
        assertEquals(1, summary.remindersSent());
        assertEquals("second@example.com", provider.getSentEmails().get(0).to());
    }

    @Test
    void rateLimitedReminderIsRetriedNextRun() {
        Secret secret = TestSecrets.active("s1", "user-1", 30, LAST_CHECK_IN);
        secrets.save(secret);
        Instant now = secret.nextCheckIn().minus(Duration.ofHours(2));

        provider.simulateRateLimit(true);
        SchedulerRunSummary limited = scheduler.runOnce(now);

        assertEquals(1, limited.remindersFailed());
        assertTrue(jobs.all().isEmpty());
        assertTrue(failures.all().isEmpty());

        provider.simulateRateLimit(false);
        SchedulerRunSummary retried = scheduler.runOnce(now.plusSeconds(120));

        assertEquals(1, retried.remindersSent());
        assertEquals(1, provider.getSentEmails().size());
    }

    @Test
    @DisplayName("Reminder failures for a secret add up on one logged failure until a reminder is delivered")
    void reminderFailuresAccumulateAndResolveOnDelivery() {
        Secret secret = TestSecrets.active("s1", "user-1", 30, LAST_CHECK_IN);
        secrets.save(secret);
        Instant next = secret.nextCheckIn();

        provider.simulateFailure(EmailSendException.Kind.INVALID_REQUEST, "Bad request (400): invalid payload", 2);
        scheduler.runOnce(next.minus(Duration.ofHours(2)));
        scheduler.runOnce(next.minus(Duration.ofMinutes(30)));

        List<EmailFailure> logged = failures.all();
        assertEquals(1, logged.size());
        assertEquals("Check-in reminder: Secret s1", logged.get(0).subject());
        assertEquals(1, logged.get(0).retryCount());
        assertEquals(2, jobs.all().size());

        SchedulerRunSummary delivered = scheduler.runOnce(next.minus(Duration.ofMinutes(10)));

        assertEquals(1, delivered.remindersSent());
        assertTrue(failures.all().get(0).isResolved());
    }

    @Test
    void missingOwnerEmailRecordsFailedTier() {
        Secret secret = TestSecrets.active("s1", "unknown-user", 30, LAST_CHECK_IN);
        secrets.save(secret);

        SchedulerRunSummary summary = scheduler.runOnce(secret.nextCheckIn().minus(Duration.ofHours(2)));

        assertEquals(1, summary.remindersFailed());
        assertTrue(provider.getSentEmails().isEmpty());
        assertEquals(ReminderJobStatus.FAILED, jobs.all().get(0).status());
    }

    @Test
    void overlappingRunIsSkipped() throws Exception {
        Secret secret = TestSecrets.active("s1", "user-1", 30, LAST_CHECK_IN);
        secrets.save(secret);
        Instant now = secret.nextCheckIn().minus(Duration.ofHours(2));
        provider.simulateDelay(Duration.ofMillis(600));

        CompletableFuture<SchedulerRunSummary> first = CompletableFuture.supplyAsync(() -> scheduler.runOnce(now));
        Thread.sleep(150);
        SchedulerRunSummary overlapping = scheduler.runOnce(now);

        assertTrue(overlapping.alreadyRunning());
        SchedulerRunSummary completed = first.get(5, TimeUnit.SECONDS);
        assertFalse(completed.alreadyRunning());
        assertEquals(1, completed.remindersSent());
    }

    @Test
    @DisplayName("A single provider hiccup during disclosure is retried, not escalated")
    void disclosureSurvivesTransientProviderFailure() {
        Secret secret = TestSecrets.active("s1", "user-1", 7, LAST_CHECK_IN);
        secrets.save(secret);
        provider.simulateFailure(EmailSendException.Kind.NETWORK, "Network error: connection reset", 1);

        SchedulerRunSummary summary = scheduler.runOnce(secret.nextCheckIn());

        assertEquals(1, summary.disclosuresTriggered());
        assertEquals(0, summary.disclosuresFailed());
        assertEquals(List.of("alice@example.com", "bob@example.com"), sentTo());
        assertTrue(failures.all().isEmpty());
    }

    @Test
    void disclosureSurvivesTransientRateLimit() {
        Secret secret = TestSecrets.active("s1", "user-1", 7, LAST_CHECK_IN);
        secrets.save(secret);
        provider.simulateFailure(EmailSendException.Kind.RATE_LIMITED, "429 Too Many Requests", 1);

        SchedulerRunSummary summary = scheduler.runOnce(secret.nextCheckIn());

        assertEquals(1, summary.disclosuresTriggered());
        assertEquals(0, summary.disclosuresFailed());
        assertEquals(List.of("alice@example.com", "bob@example.com"), sentTo());
        assertTrue(failures.all().isEmpty());
        assertEquals(SecretStatus.TRIGGERED, secrets.get("s1").status());
    }

    @Test
    @DisplayName("A check-in committed while disclosure is in flight keeps the secret active")
    void checkInDuringDisclosureWins() {
        Secret secret = TestSecrets.active("s1", "user-1", 7, LAST_CHECK_IN);
        secrets.save(secret);
        clock.set(secret.nextCheckIn().minusSeconds(30));
        CheckInToken token = tokenService.issue(secret, clock.instant());
        CheckInResult[] checkIn = new CheckInResult[1];
        duringDisclosure = () -> checkIn[0] = tokenService.consume(token.token());

        SchedulerRunSummary summary = scheduler.runOnce(secret.nextCheckIn());

        assertTrue(checkIn[0].isSuccess());
        assertEquals(0, summary.disclosuresTriggered());
        Secret after = secrets.get("s1");
        assertEquals(SecretStatus.ACTIVE, after.status());
        assertEquals(clock.instant().plus(Duration.ofDays(7)), after.nextCheckIn());
        assertEquals(0.0, registry.getSampleValue("deadswitch_disclosures_triggered_total"));
    }

    @Test
    void checkInAtTheDeadlineIsRejectedAndDisclosureProceeds() {
        Secret secret = TestSecrets.active("s1", "user-1", 7, LAST_CHECK_IN);
        secrets.save(secret);
        clock.set(secret.nextCheckIn().minus(Duration.ofHours(1)));
        CheckInToken token = tokenService.issue(secret, clock.instant());
        clock.set(secret.nextCheckIn());

        CheckInResult checkIn = tokenService.consume(token.token());
        SchedulerRunSummary summary = scheduler.runOnce(secret.nextCheckIn());

        assertFalse(checkIn.isSuccess());
        assertEquals(1, summary.disclosuresTriggered());
        assertEquals(SecretStatus.TRIGGERED, secrets.get("s1").status());
    }

    @Test
    @DisplayName("A failing failure store does not stop delivery to later recipients")
    void escalationErrorDoesNotAbortDisclosure() {
        EmailFailureRepository brokenStore = mock(EmailFailureRepository.class, invocation -> {
            throw new RuntimeException("Failed to query email failures");
        });
        ReminderScheduler brokenEscalation = newScheduler(brokenStore);
        Secret secret = TestSecrets.active("s1", "user-1", 7, LAST_CHECK_IN);
        secrets.save(secret);
        provider.simulateFailure(EmailSendException.Kind.INVALID_REQUEST, "Bad request (400): invalid payload", 1);

        try {
            SchedulerRunSummary summary = brokenEscalation.runOnce(secret.nextCheckIn());

            assertEquals(List.of("bob@example.com"), sentTo());
            assertEquals(1, summary.disclosuresTriggered());
            assertEquals(1, summary.disclosuresFailed());
            assertEquals(0, summary.errors());
            assertEquals(SecretStatus.TRIGGERED, secrets.get("s1").status());
        } finally {
            brokenEscalation.shutdown();
        }

        SchedulerRunSummary next = scheduler.runOnce(secret.nextCheckIn().plusSeconds(60));
        assertEquals(0, next.processed());
        assertEquals(1, provider.getSentEmails().size());
    }

    private List<String> sentTo() {
        return provider.getSentEmails().stream()
            .map(EmailData::to)
            .sorted()
            .collect(Collectors.toList());
    }
}
