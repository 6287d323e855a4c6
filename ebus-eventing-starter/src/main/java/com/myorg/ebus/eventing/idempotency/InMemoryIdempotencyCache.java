package com.myorg.ebus.eventing.idempotency;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
//Keeps handled keys in memory; only deduplicates inside one instance.
// A background cleaner sweeps expired keys.
@Slf4j
public class InMemoryIdempotencyCache implements IdempotencyCache {

    private record Entry(boolean value, long expireAtMs) {}

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();

    private final int maxEntries;
    private final ScheduledExecutorService cleaner;
    private final String keyPrefix; // normalized, may be ""

    public InMemoryIdempotencyCache(int maxEntries, Duration cleanupInterval) {
        this("", maxEntries, cleanupInterval);
    }

    public InMemoryIdempotencyCache(String keyPrefix, int maxEntries, Duration cleanupInterval) {
        this.maxEntries = Math.max(1000, maxEntries);
        this.keyPrefix = normalizePrefix(keyPrefix);

        this.cleaner = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ebus-idempotency-cleaner");
            t.setDaemon(true);
            return t;
        });

        long periodMs = Math.max(1_000L, cleanupInterval.toMillis());
        cleaner.scheduleAtFixedRate(this::cleanupExpiredSafe, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    private String key(String key, String namespace) {
        return keyPrefix + normalizePrefix(namespace) + key;
    }

    @Override
    public boolean exists(String key, String namespace) {
        String k = key(key, namespace);
        Entry e = entries.get(k);
        if (e == null) return false;

        if (System.currentTimeMillis() > e.expireAtMs()) {
            entries.remove(k, e);
            return false;
        }
        return true;
    }

    @Override
    public void add(String key, boolean value, Duration ttl, String namespace) {
        requirePositive(ttl, "ttl");
        long exp = System.currentTimeMillis() + ttl.toMillis();
        entries.put(key(key, namespace), new Entry(value, exp));

        if (entries.size() > maxEntries) {
            cleanupExpired();
            trimToMaxEntries();
        }
    }

    int size() {
        return entries.size();
    }

    private void cleanupExpiredSafe() {
        try {
            cleanupExpired();
        } catch (Exception e) {
            log.warn("Idempotency cleanup failed", e);
        }
    }

    void cleanupExpired() {
        long now = System.currentTimeMillis();
        Iterator<Map.Entry<String, Entry>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Entry> e = it.next();
            if (now > e.getValue().expireAtMs()) {
                it.remove();
            }
        }
    }

    private void trimToMaxEntries() {
        int over = entries.size() - maxEntries;
        if (over <= 0) return;

        Iterator<String> it = entries.keySet().iterator();
        int removed = 0;
        while (it.hasNext() && removed < over) {
            it.next();
            it.remove();
            removed++;
        }
    }

    @Override
    public void close() {
        cleaner.shutdownNow();
    }

    private static Duration requirePositive(Duration d, String name) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return d;
    }

    private static String normalizePrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) return "";
        String p = prefix.trim();
        return p.endsWith(":") ? p : (p + ":");
    }
}
