package io.deadswitch.infrastructure.metrics;

import io.deadswitch.domain.model.EmailType;
import io.deadswitch.domain.model.ReminderTier;
import io.deadswitch.domain.monitoring.FailureSeverity;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the Prometheus /metrics endpoint.
 */
public class PrometheusMetricsEndpointTest {

    private static final int TEST_PORT = 19091;
    private Undertow server;
    private PrometheusSwitchMetrics metrics;
    private HttpClient httpClient;

    @BeforeEach
    public void setUp() {
        metrics = new PrometheusSwitchMetrics(new CollectorRegistry());

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(Handlers.path()
                .addPrefixPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry())))
            .build();
        server.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private HttpResponse<String> fetch() throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + "/metrics"))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    public void testMetricsEndpointReturnsTextFormat() throws Exception {
        HttpResponse<String> response = fetch();

        assertEquals(200, response.statusCode(), "Metrics endpoint should return HTTP 200");
        assertTrue(response.headers().firstValue("Content-Type").orElse("").contains("text/plain"),
            "Content-Type should be text/plain");
        assertTrue(response.body().contains("# HELP deadswitch_reminders_sent_total"));
        assertTrue(response.body().contains("# TYPE deadswitch_scheduler_run_seconds histogram"));
    }

    @Test
    public void testRecordedValuesAreExported() throws Exception {
        metrics.recordReminderSent(ReminderTier.SEVEN_DAYS);
        metrics.recordReminderSent(ReminderTier.SEVEN_DAYS);
        metrics.recordReminderFailed(ReminderTier.CRITICAL);
        metrics.recordDisclosureTriggered();
        metrics.recordSendAttempt("sendgrid", false);
        metrics.recordFailureLogged(EmailType.DISCLOSURE, FailureSeverity.CRITICAL);
        metrics.recordCheckIn("token_already_used");
        metrics.recordSchedulerRun(Duration.ofMillis(250));

        String body = fetch().body();

        assertTrue(body.contains("deadswitch_reminders_sent_total{tier=\"7_days\",} 2.0"), body);
        assertTrue(body.contains("deadswitch_reminders_failed_total{tier=\"critical\",} 1.0"));
        assertTrue(body.contains("deadswitch_disclosures_triggered_total 1.0"));
        assertTrue(body.contains("provider=\"sendgrid\",outcome=\"failure\""));
        assertTrue(body.contains("type=\"disclosure\",severity=\"critical\""));
        assertTrue(body.contains("deadswitch_checkins_total{outcome=\"token_already_used\",} 1.0"));
        assertTrue(body.contains("deadswitch_scheduler_run_seconds_count 1.0"));
    }
}
