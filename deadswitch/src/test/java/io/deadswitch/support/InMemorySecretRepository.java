package io.deadswitch.support;

import io.deadswitch.application.port.output.SecretRepository;
import io.deadswitch.domain.model.Secret;
import io.deadswitch.domain.model.SecretStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Map-backed SecretRepository with the same conditional updates as the SQL one.
 */
public final class InMemorySecretRepository implements SecretRepository {

    private final ConcurrentHashMap<String, Secret> secrets = new ConcurrentHashMap<>();

    public void save(Secret secret) {
        secrets.put(secret.id(), secret);
    }

    public Secret get(String id) {
        return secrets.get(id);
    }

    @Override
    public Optional<Secret> findById(String secretId) {
        return Optional.ofNullable(secrets.get(secretId));
    }

    @Override
    public List<Secret> findSchedulerCandidates(Instant now, Instant lookaheadUntil) {
        return secrets.values().stream()
            .filter(s -> s.status() == SecretStatus.ACTIVE && s.nextCheckIn() != null)
            .filter(s -> !s.nextCheckIn().isAfter(lookaheadUntil)
                || s.nextCheckIn().toEpochMilli() - now.toEpochMilli() <= s.intervalMillis() / 2)
            .sorted((a, b) -> a.nextCheckIn().compareTo(b.nextCheckIn()))
            .collect(Collectors.toList());
    }

    @Override
    public boolean markTriggered(String secretId, Instant dueAt, Instant triggeredAt) {
        AtomicBoolean changed = new AtomicBoolean(false);
        secrets.computeIfPresent(secretId, (id, s) -> {
            if (s.status() != SecretStatus.ACTIVE || s.nextCheckIn().isAfter(dueAt)) {
                return s;
            }
            changed.set(true);
            return new Secret(s.id(), s.userId(), s.title(), s.recipients(), s.checkInDays(),
                SecretStatus.TRIGGERED, s.serverShare(), s.iv(), s.authTag(), s.lastCheckIn(),
                s.nextCheckIn(), triggeredAt, s.createdAt(), triggeredAt);
        });
        return changed.get();
    }

    /**
     * Deadline reset applied by the token repository's consume.
     *
     * @return false when the secret is missing or already triggered
     */
    boolean resetDeadline(String secretId, Instant checkIn, Instant nextCheckIn) {
        AtomicBoolean changed = new AtomicBoolean(false);
        secrets.computeIfPresent(secretId, (id, s) -> {
            if (s.status() == SecretStatus.TRIGGERED) {
                return s;
            }
            changed.set(true);
            return new Secret(s.id(), s.userId(), s.title(), s.recipients(), s.checkInDays(),
                s.status(), s.serverShare(), s.iv(), s.authTag(), checkIn,
                nextCheckIn, s.triggeredAt(), s.createdAt(), checkIn);
        });
        return changed.get();
    }
}
