package io.deadswitch.transport.http;

import io.deadswitch.application.service.ReminderScheduler;
import io.deadswitch.application.service.SchedulerRunSummary;
import io.deadswitch.security.BearerAuthenticator;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scheduler trigger called by an external cron.
 *
 * - POST /api/cron/process-reminders
 * - POST /api/cron/check-secrets (same run)
 *
 * Requires Authorization: Bearer &lt;CRON_SECRET&gt;, otherwise 401.
 */
public final class CronHandler {
    private static final Logger log = LoggerFactory.getLogger(CronHandler.class);

    private final ReminderScheduler scheduler;
    private final BearerAuthenticator authenticator;
    private final Clock clock;

    public CronHandler(ReminderScheduler scheduler, BearerAuthenticator authenticator, Clock clock) {
        this.scheduler = scheduler;
        this.authenticator = authenticator;
        this.clock = clock;
    }

    public void processReminders(HttpServerExchange exchange) {
        if (!authenticator.isAuthorized(HttpResponses.authorization(exchange))) {
            HttpResponses.sendUnauthorized(exchange);
            return;
        }

        try {
            SchedulerRunSummary summary = scheduler.runOnce(clock.instant());
            HttpResponses.sendJson(exchange, StatusCodes.OK, toBody(summary));
            log.info("POST {} → 200 OK", exchange.getRequestPath());
        } catch (Exception e) {
            log.error("[CRON] Scheduler run failed: {}", e.getMessage(), e);
            HttpResponses.sendInternalError(exchange);
        }
    }

    static Map<String, Object> toBody(SchedulerRunSummary summary) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", !summary.alreadyRunning());
        body.put("processed", summary.processed());
        body.put("remindersProcessed", summary.remindersProcessed());
        body.put("remindersSent", summary.remindersSent());
        body.put("remindersFailed", summary.remindersFailed());
        body.put("disclosuresTriggered", summary.disclosuresTriggered());
        body.put("disclosuresFailed", summary.disclosuresFailed());
        body.put("secretsSkipped", summary.secretsSkipped());
        body.put("errors", summary.errors());
        if (summary.alreadyRunning()) {
            body.put("message", "A scheduler run is already in progress");
        }
        body.put("durationMs", summary.durationMs());
        body.put("timestamp", summary.timestamp());
        return body;
    }
}
