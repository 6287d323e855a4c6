package com.myorg.ebus.eventing.idempotency;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

@RequiredArgsConstructor
public class RedisIdempotencyCache implements IdempotencyCache {

    private final StringRedisTemplate redis;
    private final String keyPrefix;

    private String key(String key, String namespace) {
        return normalizePrefix(keyPrefix) + normalizePrefix(namespace) + key;
    }

    @Override
    public boolean exists(String key, String namespace) {
        return Boolean.TRUE.equals(redis.hasKey(key(key, namespace)));
    }

    @Override
    public void add(String key, boolean value, Duration ttl, String namespace) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        redis.opsForValue().set(key(key, namespace), String.valueOf(value), ttl);
    }

    private static String normalizePrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) return "";
        String p = prefix.trim();
        return p.endsWith(":") ? p : (p + ":");
    }
}
