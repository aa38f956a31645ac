package org.muma.mini.kv.memory;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * maxmemory-policy 取值
 */
public enum EvictionPolicy {
    NO_EVICTION("noeviction", Strategy.NONE, false),
    ALLKEYS_LRU("allkeys-lru", Strategy.LRU, false),
    ALLKEYS_LFU("allkeys-lfu", Strategy.LFU, false),
    VOLATILE_LRU("volatile-lru", Strategy.LRU, true),
    VOLATILE_LFU("volatile-lfu", Strategy.LFU, true),
    ALLKEYS_RANDOM("allkeys-random", Strategy.RANDOM, false),
    VOLATILE_RANDOM("volatile-random", Strategy.RANDOM, true);

    enum Strategy {
        NONE, LRU, LFU, RANDOM
    }

    private final String configName;
    private final Strategy strategy;
    // 只在设置了过期时间的 Key 中挑选
    private final boolean volatileOnly;

    EvictionPolicy(String configName, Strategy strategy, boolean volatileOnly) {
        this.configName = configName;
        this.strategy = strategy;
        this.volatileOnly = volatileOnly;
    }

    public String configName() {
        return configName;
    }

    Strategy strategy() {
        return strategy;
    }

    public boolean isVolatileOnly() {
        return volatileOnly;
    }

    /**
     * 解析配置名。未知名称直接拒绝，不做静默降级
     *
     * @throws IllegalArgumentException 名称不在固定集合中
     */
    public static EvictionPolicy fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (EvictionPolicy policy : values()) {
                if (policy.configName.equals(normalized)) {
                    return policy;
                }
            }
        }
        String allowed = Arrays.stream(values()).map(EvictionPolicy::configName).collect(Collectors.joining(", "));
        throw new IllegalArgumentException("Unknown maxmemory-policy '" + name + "', expected one of: " + allowed);
    }
}
