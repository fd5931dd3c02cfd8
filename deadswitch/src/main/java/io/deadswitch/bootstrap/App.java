package io.deadswitch.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.deadswitch.application.port.output.CheckInTokenRepository;
import io.deadswitch.application.port.output.EmailFailureRepository;
import io.deadswitch.application.port.output.MessageRenderer;
import io.deadswitch.application.port.output.OwnerDirectory;
import io.deadswitch.application.port.output.ReminderJobRepository;
import io.deadswitch.application.port.output.SecretDecryptor;
import io.deadswitch.application.port.output.SecretRepository;
import io.deadswitch.application.service.CheckInTokenService;
import io.deadswitch.application.service.DisclosureStateMachine;
import io.deadswitch.application.service.FailureEscalationService;
import io.deadswitch.application.service.MaintenanceScheduler;
import io.deadswitch.application.service.ReminderScheduler;
import io.deadswitch.config.SwitchConfig;
import io.deadswitch.infrastructure.crypto.AesGcmSecretDecryptor;
import io.deadswitch.infrastructure.email.EmailDeliveryService;
import io.deadswitch.infrastructure.email.EmailProvider;
import io.deadswitch.infrastructure.email.EmailProviderFactory;
import io.deadswitch.infrastructure.email.RetryPolicy;
import io.deadswitch.infrastructure.metrics.PrometheusMetricsHandler;
import io.deadswitch.infrastructure.metrics.PrometheusSwitchMetrics;
import io.deadswitch.infrastructure.persistence.PostgresCheckInTokenRepository;
import io.deadswitch.infrastructure.persistence.PostgresEmailFailureRepository;
import io.deadswitch.infrastructure.persistence.PostgresOwnerDirectory;
import io.deadswitch.infrastructure.persistence.PostgresReminderJobRepository;
import io.deadswitch.infrastructure.persistence.PostgresSecretRepository;
import io.deadswitch.infrastructure.render.DefaultMessageRenderer;
import io.deadswitch.migration.SchemaMigration;
import io.deadswitch.security.BearerAuthenticator;
import io.deadswitch.transport.http.CheckInHandler;
import io.deadswitch.transport.http.CronHandler;
import io.deadswitch.transport.http.EmailFailureAdminHandler;
import io.deadswitch.util.Json;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;

/**
 * Entry point: wires the store, email delivery, scheduler and HTTP API by hand.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    private static final Duration MIN_INVALID_TOKEN_DELAY = Duration.ofMillis(100);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== Dead Man's Switch Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        SwitchConfig config = SwitchConfig.fromEnv();
        Clock clock = Clock.systemUTC();

        if (!config.hasCronSecret()) {
            log.warn("[CONFIG] CRON_SECRET is not set, every cron request will be rejected");
        }
        if (!config.hasAdminToken()) {
            log.warn("[CONFIG] ADMIN_TOKEN is not set, the email failure API is disabled");
        }

        // ═══════════════════════════════════════════════════════════════
        // Database
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = createDataSource(config);
        new SchemaMigration(dataSource).migrate();

        SecretRepository secretRepo = new PostgresSecretRepository(dataSource, Json.mapper());
        CheckInTokenRepository tokenRepo = new PostgresCheckInTokenRepository(dataSource);
        ReminderJobRepository reminderRepo = new PostgresReminderJobRepository(dataSource);
        EmailFailureRepository failureRepo = new PostgresEmailFailureRepository(dataSource);
        OwnerDirectory ownerDirectory = new PostgresOwnerDirectory(dataSource);
        log.info("✓ Repositories initialized");

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusSwitchMetrics metrics = new PrometheusSwitchMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Email Delivery
        // ═══════════════════════════════════════════════════════════════
        EmailProvider provider = EmailProviderFactory.create(config, Json.mapper());
        RetryPolicy retryPolicy = RetryPolicy.builder()
            .maxAttempts(config.emailMaxAttempts())
            .baseDelay(Duration.ofMillis(config.emailBaseDelayMs()))
            .maxDelay(Duration.ofMillis(config.emailMaxDelayMs()))
            .build();
        EmailDeliveryService deliveryService = new EmailDeliveryService(
            provider, retryPolicy, metrics, config.senderEmail(), config.senderName());
        MessageRenderer renderer = new DefaultMessageRenderer(config.siteUrl());
        FailureEscalationService escalationService = new FailureEscalationService(
            failureRepo, deliveryService, renderer, metrics, config.failureNotificationEmail(), clock);

        // ═══════════════════════════════════════════════════════════════
        // Check-in and Scheduler
        // ═══════════════════════════════════════════════════════════════
        DisclosureStateMachine stateMachine = new DisclosureStateMachine();
        SecretDecryptor decryptor = createDecryptor(config);
        CheckInTokenService tokenService = new CheckInTokenService(
            tokenRepo, secretRepo, stateMachine, metrics, clock, MIN_INVALID_TOKEN_DELAY);
        ReminderScheduler reminderScheduler = new ReminderScheduler(
            secretRepo, reminderRepo, ownerDirectory, tokenService, deliveryService, escalationService,
            renderer, decryptor, stateMachine, metrics, config.siteUrl(),
            config.schedulerWorkers(), config.schedulerRunTimeout());

        MaintenanceScheduler maintenance = new MaintenanceScheduler(
            escalationService, tokenService, reminderScheduler, config.failureRetentionDays(),
            config.internalSchedulerEnabled() ? config.internalSchedulerInterval() : null, clock);
        maintenance.start();
        log.info("✓ Maintenance scheduler started");

        // ═══════════════════════════════════════════════════════════════
        // HTTP API
        // ═══════════════════════════════════════════════════════════════
        CronHandler cronHandler = new CronHandler(
            reminderScheduler, new BearerAuthenticator("CRON", config.cronSecret()), clock);
        CheckInHandler checkInHandler = new CheckInHandler(tokenService, decryptor);
        EmailFailureAdminHandler adminHandler = new EmailFailureAdminHandler(
            escalationService, new BearerAuthenticator("ADMIN", config.adminToken()), config.failureRetentionDays());
        HttpHandler metricsHandler = new PrometheusMetricsHandler(metrics.getRegistry());

        Undertow server = Undertow.builder()
            .addHttpListener(config.port(), config.host())
            .setHandler(routes(cronHandler, checkInHandler, adminHandler, metricsHandler))
            .build();
        server.start();
        log.info("✓ HTTP API server started on http://{}:{}/", config.host(), config.port());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received");
            server.stop();
            maintenance.stop();
            reminderScheduler.shutdown();
            dataSource.close();
            log.info("✓ Shutdown complete");
        }, "deadswitch-shutdown"));
    }

    /**
     * Route table wrapped in CORS handling. Every route runs on a worker
     * thread because the handlers block on JDBC and email sends.
     */
    static HttpHandler routes(CronHandler cronHandler,
                              CheckInHandler checkInHandler,
                              EmailFailureAdminHandler adminHandler,
                              HttpHandler metricsHandler) {
        RoutingHandler routes = Handlers.routing()
            .get("/api/health", exchange -> {
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
                exchange.getResponseSender().send("{\"status\":\"ok\"}", StandardCharsets.UTF_8);
            })
            .get("/metrics", metricsHandler)
            .post("/api/cron/process-reminders", cronHandler::processReminders)
            .post("/api/cron/check-secrets", cronHandler::processReminders)
            .post("/api/check-in", checkInHandler::checkIn)
            .get("/api/secrets/{id}/server-share", checkInHandler::serverShare)
            .get("/api/admin/email-failures", adminHandler::list)
            .post("/api/admin/email-failures/cleanup", adminHandler::cleanup)
            .post("/api/admin/email-failures/retry", adminHandler::retryAll)
            .post("/api/admin/email-failures/{id}/resolve", adminHandler::resolve)
            .post("/api/admin/email-failures/{id}/retry", adminHandler::retry)
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
                exchange.getResponseSender().send("{\"error\":\"Not Found\"}", StandardCharsets.UTF_8);
            });

        HttpHandler blocking = new BlockingHandler(routes);

        return exchange -> {
            exchange.getResponseHeaders()
                .put(HttpString.tryFromString("Access-Control-Allow-Origin"), "*")
                .put(HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, POST, OPTIONS")
                .put(HttpString.tryFromString("Access-Control-Allow-Headers"), "Content-Type, Authorization")
                .put(HttpString.tryFromString("Access-Control-Max-Age"), "3600");

            if (exchange.getRequestMethod().toString().equals("OPTIONS")) {
                exchange.setStatusCode(200);
                exchange.endExchange();
            } else {
                blocking.handleRequest(exchange);
            }
        };
    }

    private static HikariDataSource createDataSource(SwitchConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(config.dbUrl());
        hikari.setUsername(config.dbUser());
        hikari.setPassword(config.dbPass());
        hikari.setMaximumPoolSize(config.dbPoolSize());
        hikari.setMinimumIdle(2);
        hikari.setConnectionTimeout(5000);
        hikari.setPoolName("deadswitch-hikari");

        log.info("Connecting to database: {}", config.dbUrl());
        return new HikariDataSource(hikari);
    }

    /**
     * Without ENCRYPTION_KEY the service still sends reminders; disclosures
     * and server-share reads fail until a key is configured.
     */
    static SecretDecryptor createDecryptor(SwitchConfig config) {
        if (config.encryptionKey() == null || config.encryptionKey().isBlank()) {
            log.warn("[CONFIG] ENCRYPTION_KEY is not set, disclosures will be postponed");
            return (serverShare, iv, authTag) -> {
                throw new IllegalStateException("ENCRYPTION_KEY is not configured");
            };
        }
        return new AesGcmSecretDecryptor(config.encryptionKey());
    }

    private App() {}
}
