package com.contactbook.backend.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import com.contactbook.backend.modules.auth.application.IdentityCache;

public class InMemoryIdentityCache implements IdentityCache {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryIdentityCache(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<UUID> get(String tokenKey) {
        Entry entry = entries.get(tokenKey);
        if (entry == null || !entry.expiresAt().isAfter(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(entry.userId());
    }

    @Override
    public void put(String tokenKey, UUID userId, Duration ttl) {
        entries.put(tokenKey, new Entry(userId, clock.instant().plus(ttl), ttl));
    }

    @Override
    public void invalidate(String tokenKey) {
        entries.remove(tokenKey);
    }

    public Optional<Duration> ttlOf(String tokenKey) {
        return Optional.ofNullable(entries.get(tokenKey)).map(Entry::ttl);
    }

    public int size() {
        return entries.size();
    }

    private record Entry(UUID userId, Instant expiresAt, Duration ttl) {
    }
}
