package org.muma.mini.kv.memory;

import org.muma.mini.kv.common.HashValue;
import org.muma.mini.kv.common.IntegerValue;
import org.muma.mini.kv.common.ListValue;
import org.muma.mini.kv.common.RedisValue;
import org.muma.mini.kv.common.SetValue;
import org.muma.mini.kv.common.StringValue;
import org.muma.mini.kv.store.Keyspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

/**
 * 内存估算与淘汰管理器
 * <p>
 * 为每个 Key 维护最近访问时间 (LRU) 与访问次数 (LFU)，并在超出 maxmemory 时按策略淘汰。
 * 本类不是线程安全的，只能在 {@link org.muma.mini.kv.store.Database} 的写锁内被 Keyspace 调用。
 * <p>
 * 估算值只是近似值，各项常量可调整，不代表 JVM 真实内存占用。
 */
public class MemoryManager {

    private static final Logger log = LoggerFactory.getLogger(MemoryManager.class);

    static final long BASE_OVERHEAD = 1024;
    static final long EXPIRY_ENTRY_OVERHEAD = 40;
    static final long TRACKING_ENTRY_OVERHEAD = 72;
    static final long ELEMENT_OVERHEAD = 8;
    static final long HASH_PAIR_OVERHEAD = 16;
    static final long INTEGER_SIZE = 8;

    static final int MAX_EVICTIONS_PER_ROUND = 1000;
    // 淘汰到预算的 90% 为止，避免每次写入都触发淘汰
    static final double EVICTION_TARGET_RATIO = 0.9;

    private final long maxMemory;
    private final EvictionPolicy policy;
    private final Random random;

    private final Map<String, Long> accessTimes = new HashMap<>();
    private final Map<String, Long> accessCounts = new HashMap<>();
    private long lastTick;

    private long evictedKeys;

    public MemoryManager() {
        this(0, EvictionPolicy.ALLKEYS_LRU);
    }

    /**
     * @param maxMemory 预算字节数，0 表示不限制
     */
    public MemoryManager(long maxMemory, EvictionPolicy policy) {
        this(maxMemory, policy, new Random());
    }

    public MemoryManager(long maxMemory, EvictionPolicy policy, Random random) {
        if (maxMemory < 0) {
            throw new IllegalArgumentException("maxmemory must be >= 0");
        }
        this.maxMemory = maxMemory;
        this.policy = policy;
        this.random = random;
    }

    public void trackAccess(String key) {
        // 严格递增，即使 nanoTime 分辨率不足也能分出先后
        lastTick = Math.max(System.nanoTime(), lastTick + 1);
        accessTimes.put(key, lastTick);
        accessCounts.merge(key, 1L, Long::sum);
    }

    public void removeTracking(String key) {
        accessTimes.remove(key);
        accessCounts.remove(key);
    }

    public void clearTracking() {
        accessTimes.clear();
        accessCounts.clear();
    }

    public boolean isTracked(String key) {
        return accessTimes.containsKey(key);
    }

    public long accessCount(String key) {
        return accessCounts.getOrDefault(key, 0L);
    }

    public int trackedCount() {
        return accessTimes.size();
    }

    public long estimateMemoryUsage(Keyspace keyspace) {
        long total = BASE_OVERHEAD;
        for (Map.Entry<String, RedisValue> entry : keyspace.entries()) {
            total += byteLength(entry.getKey());
            total += estimateValue(entry.getValue());
        }
        total += (long) keyspace.expiresCount() * EXPIRY_ENTRY_OVERHEAD;
        total += (long) accessTimes.size() * TRACKING_ENTRY_OVERHEAD;
        return total;
    }

    static long estimateValue(RedisValue value) {
        return switch (value.type()) {
            case STRING -> byteLength(((StringValue) value).value());
            case INTEGER -> INTEGER_SIZE;
            case LIST -> estimateElements(((ListValue) value).items());
            case SET -> estimateElements(((SetValue) value).members());
            case HASH -> {
                long size = 0;
                for (Map.Entry<String, String> e : ((HashValue) value).toMap().entrySet()) {
                    size += byteLength(e.getKey()) + byteLength(e.getValue()) + HASH_PAIR_OVERHEAD;
                }
                yield size;
            }
        };
    }

    private static long estimateElements(Collection<String> elements) {
        long size = 0;
        for (String element : elements) {
            size += byteLength(element) + ELEMENT_OVERHEAD;
        }
        return size;
    }

    static long byteLength(String s) {
        return s.getBytes(StandardCharsets.UTF_8).length;
    }

    public void enforceBudget(Keyspace keyspace) {
        enforceBudget(keyspace, null);
    }

    /**
     * 写入后调用。未配置预算或未超出预算时直接返回
     *
     * @param protectedKey 本次正在写入的 Key，不参与淘汰；可为 null
     * @throws MaxMemoryExceededException noeviction 策略下超出预算
     */
    public void enforceBudget(Keyspace keyspace, String protectedKey) {
        if (maxMemory == 0) return;

        long used = estimateMemoryUsage(keyspace);
        if (used <= maxMemory) return;

        if (policy == EvictionPolicy.NO_EVICTION) {
            throw new MaxMemoryExceededException(used, maxMemory);
        }

        long target = (long) (maxMemory * EVICTION_TARGET_RATIO);
        int evicted = 0;
        while (used > target && evicted < MAX_EVICTIONS_PER_ROUND) {
            String victim = selectVictim(keyspace, protectedKey);
            if (victim == null) {
                log.warn("No eviction candidate under policy {}, used memory {} still above target {}",
                        policy.configName(), used, target);
                break;
            }
            keyspace.delete(victim);
            evicted++;
            evictedKeys++;
            used = estimateMemoryUsage(keyspace);
            log.debug("Evicted key '{}' ({}), used memory now {}", victim, policy.configName(), used);
        }

        if (evicted >= MAX_EVICTIONS_PER_ROUND) {
            log.warn("Eviction round stopped after {} keys, used memory {}", evicted, used);
        }
    }

    String selectVictim(Keyspace keyspace) {
        return selectVictim(keyspace, null);
    }

    String selectVictim(Keyspace keyspace, String protectedKey) {
        Collection<String> candidates = policy.isVolatileOnly()
                ? keyspace.keysWithExpiry()
                : keyspace.rawKeys();
        if (protectedKey != null && candidates.contains(protectedKey)) {
            candidates = new ArrayList<>(candidates);
            candidates.remove(protectedKey);
        }
        if (candidates.isEmpty()) return null;

        return switch (policy.strategy()) {
            case LRU -> leastRecentlyUsed(candidates);
            case LFU -> leastFrequentlyUsed(candidates);
            case RANDOM -> randomKey(candidates);
            case NONE -> null;
        };
    }

    private String leastRecentlyUsed(Collection<String> candidates) {
        String victim = null;
        long oldest = Long.MAX_VALUE;
        for (String key : candidates) {
            Long tick = accessTimes.get(key);
            if (tick == null) {
                // 从未被访问过的 Key 直接淘汰
                return key;
            }
            if (tick < oldest) {
                oldest = tick;
                victim = key;
            }
        }
        return victim;
    }

    private String leastFrequentlyUsed(Collection<String> candidates) {
        String victim = null;
        long lowest = Long.MAX_VALUE;
        for (String key : candidates) {
            long count = accessCounts.getOrDefault(key, 0L);
            if (count < lowest) {
                lowest = count;
                victim = key;
            }
        }
        return victim;
    }

    private String randomKey(Collection<String> candidates) {
        List<String> keys = new ArrayList<>(candidates);
        return keys.get(random.nextInt(keys.size()));
    }

    public Map<String, String> memoryInfo(Keyspace keyspace) {
        long used = estimateMemoryUsage(keyspace);
        Map<String, String> info = new LinkedHashMap<>();
        info.put("used_memory", String.valueOf(used));
        info.put("used_memory_human", formatBytes(used));
        if (maxMemory > 0) {
            info.put("maxmemory", String.valueOf(maxMemory));
            info.put("maxmemory_human", formatBytes(maxMemory));
            info.put("used_memory_percentage",
                    String.format(Locale.ROOT, "%.2f%%", used * 100.0 / maxMemory));
        } else {
            info.put("maxmemory", "0");
            info.put("maxmemory_human", "unlimited");
            info.put("used_memory_percentage", "N/A");
        }
        info.put("maxmemory_policy", policy.configName());
        info.put("evicted_keys", String.valueOf(evictedKeys));
        info.put("total_keys", String.valueOf(keyspace.rawKeys().size()));
        return info;
    }

    /**
     * 1536 -> "1.50KB"，小于 1KB 时不带小数
     */
    public static String formatBytes(long bytes) {
        String[] units = {"B", "KB", "MB", "GB", "TB"};
        double size = bytes;
        int unit = 0;
        while (size >= 1024 && unit < units.length - 1) {
            size /= 1024;
            unit++;
        }
        if (unit == 0) {
            return bytes + units[0];
        }
        return String.format(Locale.ROOT, "%.2f%s", size, units[unit]);
    }

    public long getMaxMemory() {
        return maxMemory;
    }

    public EvictionPolicy getPolicy() {
        return policy;
    }

    public long getEvictedKeys() {
        return evictedKeys;
    }
}
