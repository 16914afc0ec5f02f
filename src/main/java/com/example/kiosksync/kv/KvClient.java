package com.example.kiosksync.kv;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The edge node's local key/value store. Holds the entity caches and the chat recovery data,
 * so it must survive process restarts.
 */
public interface KvClient {
    Optional<String> get(String key);
    Map<String, String> mget(List<String> keys);
    void set(String key, String value, Duration ttl);
    void del(String key);
    List<String> scan(String prefix, int limit);

    default void set(String key, String value) {
        set(key, value, null);
    }

    default List<String> scanAll(String prefix) {
        return scan(prefix, Integer.MAX_VALUE);
    }
}
