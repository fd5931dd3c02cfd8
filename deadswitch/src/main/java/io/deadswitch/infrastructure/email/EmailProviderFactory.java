package io.deadswitch.infrastructure.email;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.deadswitch.config.SwitchConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Chooses the EmailProvider from configuration.
 */
public final class EmailProviderFactory {
    private static final Logger log = LoggerFactory.getLogger(EmailProviderFactory.class);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    public static EmailProvider create(SwitchConfig config, ObjectMapper mapper) {
        EmailProvider provider = switch (config.emailProvider()) {
            case SENDGRID -> new SendGridEmailProvider(
                HttpClient.newBuilder().connectTimeout(CONNECT_TIMEOUT).build(),
                SendGridEmailProvider.DEFAULT_ENDPOINT,
                config.sendGridApiKey(),
                REQUEST_TIMEOUT,
                mapper);
            case MOCK -> new InMemoryEmailProvider();
        };
        log.info("[EMAIL] Using email provider: {}", provider.name());
        return provider;
    }

    private EmailProviderFactory() {}
}
