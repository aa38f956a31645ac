package org.muma.mini.kv.store;

import org.muma.mini.kv.common.RedisValue;

import java.util.Collections;
import java.util.Map;

/**
 * Keyspace 的一份独立拷贝，用于快照落盘与恢复。
 * expiresAtMillis 中的时间为 epoch 毫秒
 */
public record KeyspaceImage(Map<String, RedisValue> data, Map<String, Long> expiresAtMillis) {

    public KeyspaceImage {
        data = Collections.unmodifiableMap(data);
        expiresAtMillis = Collections.unmodifiableMap(expiresAtMillis);
    }

    public static KeyspaceImage empty() {
        return new KeyspaceImage(Map.of(), Map.of());
    }

    public int size() {
        return data.size();
    }
}
