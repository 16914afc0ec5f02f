package com.example.kiosksync.kv;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.*;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
public class RedisKvClient implements KvClient {

    private static final int SCAN_BATCH = 500;

    private final StringRedisTemplate redis;

    @Autowired
    public RedisKvClient(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redis.opsForValue().get(key));
    }

    @Override
    public Map<String, String> mget(List<String> keys) {
        Map<String, String> result = new LinkedHashMap<>();
        if (keys.isEmpty()) return result;
        // multiGet answers positionally, so the request order has to be kept
        List<String> values = redis.opsForValue().multiGet(keys);
        for (int i = 0; i < keys.size(); i++) {
            String v = (values != null && i < values.size()) ? values.get(i) : null;
            result.put(keys.get(i), v);
        }
        return result;
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            redis.opsForValue().set(key, value);
        } else {
            redis.opsForValue().set(key, value, ttl);
        }
    }

    @Override
    public void del(String key) {
        redis.delete(key);
    }

    @Override
    public List<String> scan(String prefix, int limit) {
        ScanOptions options = ScanOptions.scanOptions()
                .match(prefix + "*")
                .count(SCAN_BATCH).build();
        try (RedisConnection conn = Objects.requireNonNull(redis.getConnectionFactory()).getConnection()) {
            Set<String> keys = new LinkedHashSet<>();
            try (var cursor = conn.keyCommands().scan(options)) {
                while (cursor.hasNext() && keys.size() < limit) {
                    keys.add(new String(cursor.next(), StandardCharsets.UTF_8));
                }
            }
            return new ArrayList<>(keys);
        }
    }
}
