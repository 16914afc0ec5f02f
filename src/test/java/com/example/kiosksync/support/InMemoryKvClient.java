package com.example.kiosksync.support;

import com.example.kiosksync.kv.KvClient;

import java.time.Duration;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Map-backed KV for tests. TTLs are recorded but never expire anything.
 */
public class InMemoryKvClient implements KvClient {

    private final Map<String, String> data = new TreeMap<>();
    private final Map<String, Duration> ttls = new HashMap<>();
    private boolean failing;

    /** When set, every write throws as if the server were unreachable. */
    public synchronized void setFailing(boolean failing) {
        this.failing = failing;
    }

    @Override
    public synchronized Optional<String> get(String key) {
        return Optional.ofNullable(data.get(key));
    }

    @Override
    public synchronized Map<String, String> mget(List<String> keys) {
        Map<String, String> result = new LinkedHashMap<>();
        for (String k : keys) result.put(k, data.get(k));
        return result;
    }

    @Override
    public synchronized void set(String key, String value, Duration ttl) {
        if (failing) throw new IllegalStateException("redis down");
        data.put(key, value);
        if (ttl != null) ttls.put(key, ttl); else ttls.remove(key);
    }

    @Override
    public synchronized void del(String key) {
        if (failing) throw new IllegalStateException("redis down");
        data.remove(key);
        ttls.remove(key);
    }

    @Override
    public synchronized List<String> scan(String prefix, int limit) {
        return data.keySet().stream()
                .filter(k -> k.startsWith(prefix))
                .limit(limit)
                .collect(Collectors.toList());
    }

    public synchronized Optional<Duration> ttl(String key) {
        return Optional.ofNullable(ttls.get(key));
    }

    public synchronized Set<String> keys() {
        return new TreeSet<>(data.keySet());
    }
}
