package io.deadswitch.application.service;

import io.deadswitch.application.port.output.CheckInTokenRepository;
import io.deadswitch.application.port.output.CheckInTokenRepository.ConsumeOutcome;
import io.deadswitch.application.port.output.SecretRepository;
import io.deadswitch.application.port.output.SwitchMetrics;
import io.deadswitch.domain.model.CheckInError;
import io.deadswitch.domain.model.CheckInResult;
import io.deadswitch.domain.model.CheckInToken;
import io.deadswitch.domain.model.Secret;
import io.deadswitch.domain.model.SecretStatus;
import io.deadswitch.domain.model.ShareAccessError;
import io.deadswitch.domain.model.ShareAccessResult;
import io.deadswitch.security.LogSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Issues and consumes single-use check-in tokens.
 *
 * consume() resets the deadline exactly once per token. The repository's
 * conditional update on used_at decides the winner between concurrent
 * requests, so no locking happens here.
 *
 * A consumed token keeps a second, read-only use: authorizeShareRead() lets
 * it fetch the server share for 24 hours after consumption.
 */
public final class CheckInTokenService {
    private static final Logger log = LoggerFactory.getLogger(CheckInTokenService.class);

    private static final int TOKEN_BYTES = 32;

    private final CheckInTokenRepository tokenRepo;
    private final SecretRepository secretRepo;
    private final DisclosureStateMachine stateMachine;
    private final SwitchMetrics metrics;
    private final Clock clock;
    private final Duration minInvalidTokenDelay;
    private final SecureRandom random = new SecureRandom();

    public CheckInTokenService(CheckInTokenRepository tokenRepo,
                               SecretRepository secretRepo,
                               DisclosureStateMachine stateMachine,
                               SwitchMetrics metrics,
                               Clock clock,
                               Duration minInvalidTokenDelay) {
        this.tokenRepo = tokenRepo;
        this.secretRepo = secretRepo;
        this.stateMachine = stateMachine;
        this.metrics = metrics;
        this.clock = clock;
        this.minInvalidTokenDelay = minInvalidTokenDelay;
    }

    /**
     * Consume a token and reset its secret's deadline.
     */
    public CheckInResult consume(String token) {
        long startNanos = System.nanoTime();

        if (token == null || token.isBlank()) {
            return reject(CheckInError.MISSING_TOKEN, token);
        }

        Optional<CheckInToken> found = tokenRepo.findByToken(token);
        if (found.isEmpty()) {
            padResponseTime(startNanos);
            return reject(CheckInError.INVALID_TOKEN, token);
        }

        CheckInToken checkInToken = found.get();
        Instant now = clock.instant();

        if (checkInToken.isExpired(now)) {
            return reject(CheckInError.TOKEN_EXPIRED, token);
        }
        // The grace window only applies to share reads, never to a second reset
        if (checkInToken.isUsed()) {
            return reject(CheckInError.TOKEN_ALREADY_USED, token);
        }

        Optional<Secret> secretOpt = secretRepo.findById(checkInToken.secretId());
        if (secretOpt.isEmpty()) {
            return reject(CheckInError.SECRET_NOT_FOUND, token);
        }
        Secret secret = secretOpt.get();
        if (secret.status() == SecretStatus.TRIGGERED) {
            return reject(CheckInError.SECRET_ALREADY_TRIGGERED, token);
        }

        Instant nextCheckIn = stateMachine.nextCheckInAfter(now, secret.checkInDays());
        ConsumeOutcome outcome = tokenRepo.consume(token, secret.id(), secret.userId(), now, nextCheckIn);

        switch (outcome) {
            case ALREADY_USED:
                return reject(CheckInError.TOKEN_ALREADY_USED, token);
            case SECRET_TRIGGERED:
                return reject(CheckInError.SECRET_ALREADY_TRIGGERED, token);
            default:
                break;
        }

        metrics.recordCheckIn("success");
        log.info("[CHECK-IN] ✓ Secret {} checked in with token {}, next check-in {}",
            secret.id(), LogSanitizer.token(token), nextCheckIn);
        return CheckInResult.success(secret.title(), nextCheckIn);
    }

    /**
     * Authorize a read of the secret's server share.
     *
     * The token must belong to the secret. A consumed token is accepted for
     * 24 hours after consumption. The first read marks the token used but
     * never touches the deadline.
     */
    public ShareAccessResult authorizeShareRead(String secretId, String token) {
        if (token == null || token.isBlank()) {
            return ShareAccessResult.denied(ShareAccessError.INVALID_TOKEN);
        }
        Optional<CheckInToken> found = tokenRepo.findByToken(token);
        if (found.isEmpty() || !found.get().secretId().equals(secretId)) {
            log.warn("[SHARE READ] Rejected token {} for secret {}", LogSanitizer.token(token), secretId);
            return ShareAccessResult.denied(ShareAccessError.INVALID_TOKEN);
        }

        CheckInToken checkInToken = found.get();
        Instant now = clock.instant();

        if (checkInToken.isUsed() && !checkInToken.isWithinGracePeriod(now)) {
            return ShareAccessResult.denied(ShareAccessError.GRACE_PERIOD_EXPIRED);
        }
        if (checkInToken.isExpired(now)) {
            return ShareAccessResult.denied(ShareAccessError.TOKEN_EXPIRED);
        }

        Optional<Secret> secret = secretRepo.findById(secretId);
        if (secret.isEmpty()) {
            return ShareAccessResult.denied(ShareAccessError.SECRET_NOT_FOUND);
        }
        if (!secret.get().hasServerShare()) {
            log.info("[SHARE READ] Secret {} is disabled, server share deleted", secretId);
            return ShareAccessResult.denied(ShareAccessError.SECRET_DISABLED);
        }

        if (!checkInToken.isUsed() && tokenRepo.markUsedIfUnused(token, now)) {
            log.info("[SHARE READ] Token {} marked used by share read", LogSanitizer.token(token));
        }
        return ShareAccessResult.granted(secret.get());
    }

    /**
     * Create a token for a reminder link. It expires at the secret's current
     * deadline, since a check-in after that is no longer possible.
     */
    public CheckInToken issue(Secret secret, Instant now) {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        String value = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);

        CheckInToken token = new CheckInToken(
            UUID.randomUUID().toString(),
            secret.id(),
            value,
            secret.nextCheckIn(),
            null,
            now);
        tokenRepo.insert(token);
        log.debug("[CHECK-IN] Issued token {} for secret {}, expires {}",
            LogSanitizer.token(value), secret.id(), token.expiresAt());
        return token;
    }

    /**
     * Delete expired tokens that were never used.
     */
    public int purgeExpiredTokens() {
        int deleted = tokenRepo.deleteExpiredUnused(clock.instant());
        if (deleted > 0) {
            log.info("[CHECK-IN] Purged {} expired check-in tokens", deleted);
        }
        return deleted;
    }

    private CheckInResult reject(CheckInError error, String token) {
        metrics.recordCheckIn(error.name().toLowerCase(Locale.ROOT));
        log.warn("[CHECK-IN] Rejected token {}: {}", LogSanitizer.token(token), error.message());
        return CheckInResult.failure(error);
    }

    /**
     * Unknown tokens take at least minInvalidTokenDelay so response time does
     * not reveal whether a token exists.
     */
    private void padResponseTime(long startNanos) {
        long remaining = minInvalidTokenDelay.toNanos() - (System.nanoTime() - startNanos);
        if (remaining <= 0) {
            return;
        }
        try {
            Thread.sleep(remaining / 1_000_000, (int) (remaining % 1_000_000));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("[CHECK-IN] Interrupted while padding invalid-token response");
        }
    }
}
