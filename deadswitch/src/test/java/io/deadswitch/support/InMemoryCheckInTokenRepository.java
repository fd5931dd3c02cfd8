package io.deadswitch.support;

import io.deadswitch.application.port.output.CheckInTokenRepository;
import io.deadswitch.domain.model.CheckInToken;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Map-backed token store. consume() is serialized to mirror the single SQL transaction.
 */
public final class InMemoryCheckInTokenRepository implements CheckInTokenRepository {

    private final ConcurrentHashMap<String, CheckInToken> tokens = new ConcurrentHashMap<>();
    private final InMemorySecretRepository secrets;
    private final AtomicInteger historyRows = new AtomicInteger();

    public InMemoryCheckInTokenRepository(InMemorySecretRepository secrets) {
        this.secrets = secrets;
    }

    public int historyRows() {
        return historyRows.get();
    }

    public int size() {
        return tokens.size();
    }

    @Override
    public Optional<CheckInToken> findByToken(String token) {
        return Optional.ofNullable(tokens.get(token));
    }

    @Override
    public void insert(CheckInToken token) {
        if (tokens.putIfAbsent(token.token(), token) != null) {
            throw new IllegalStateException("Duplicate token");
        }
    }

    @Override
    public synchronized ConsumeOutcome consume(String token, String secretId, String userId,
                                               Instant now, Instant nextCheckIn) {
        CheckInToken current = tokens.get(token);
        if (current == null || current.usedAt() != null) {
            return ConsumeOutcome.ALREADY_USED;
        }
        if (!secrets.resetDeadline(secretId, now, nextCheckIn)) {
            return ConsumeOutcome.SECRET_TRIGGERED;
        }
        tokens.put(token, used(current, now));
        historyRows.incrementAndGet();
        return ConsumeOutcome.CONSUMED;
    }

    @Override
    public boolean markUsedIfUnused(String token, Instant now) {
        CheckInToken current = tokens.get(token);
        if (current == null || current.usedAt() != null) {
            return false;
        }
        return tokens.replace(token, current, used(current, now));
    }

    @Override
    public int deleteExpiredUnused(Instant now) {
        int before = tokens.size();
        tokens.values().removeIf(t -> t.usedAt() == null && t.expiresAt().isBefore(now));
        return before - tokens.size();
    }

    private static CheckInToken used(CheckInToken token, Instant now) {
        return new CheckInToken(token.id(), token.secretId(), token.token(), token.expiresAt(), now,
            token.createdAt());
    }
}
