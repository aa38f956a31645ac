package org.muma.mini.kv.store;

import org.muma.mini.kv.common.RedisDataType;
import org.muma.mini.kv.common.RedisValue;
import org.muma.mini.kv.memory.MaxMemoryExceededException;
import org.muma.mini.kv.memory.MemoryManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 键空间: key -> value 与 key -> 过期时间 (epoch 毫秒) 两张表。
 * <p>
 * 过期采用惰性删除：只有在被访问时才检查并删除。
 * 非线程安全，所有访问都要经过 {@link Database} 的读写锁。
 */
public class Keyspace implements KeyspaceView {

    private static final Logger log = LoggerFactory.getLogger(Keyspace.class);

    public static final long TTL_NO_EXPIRY = -1;
    public static final long TTL_KEY_MISSING = -2;
    // 过期时间上限，保证 now + ttl 不会溢出
    public static final Duration MAX_TTL = Duration.ofMillis(Long.MAX_VALUE / 2);

    private final Map<String, RedisValue> data = new HashMap<>();
    private final Map<String, Long> expires = new HashMap<>();
    private final MemoryManager memoryManager;
    private final Clock clock;

    // 自上次保存以来的写操作次数
    private long dirty;

    public Keyspace() {
        this(new MemoryManager(), Clock.systemUTC());
    }

    public Keyspace(MemoryManager memoryManager) {
        this(memoryManager, Clock.systemUTC());
    }

    public Keyspace(MemoryManager memoryManager, Clock clock) {
        this.memoryManager = memoryManager;
        this.clock = clock;
    }

    // ---------------- 读 ----------------

    /**
     * @return 值的拷贝，Key 不存在或已过期时返回 null
     */
    public RedisValue get(String key) {
        if (expireIfNeeded(key)) return null;
        RedisValue value = data.get(key);
        if (value == null) return null;
        memoryManager.trackAccess(key);
        return value.copy();
    }

    /**
     * 按类型读取
     *
     * @throws WrongTypeException 存储的值不是期望的类型
     */
    public <T extends RedisValue> T getAs(String key, Class<T> type) {
        RedisValue value = get(key);
        if (value == null) return null;
        if (!type.isInstance(value)) {
            throw new WrongTypeException(key, value.type());
        }
        return type.cast(value);
    }

    public boolean exists(String key) {
        if (expireIfNeeded(key)) return false;
        if (!data.containsKey(key)) return false;
        memoryManager.trackAccess(key);
        return true;
    }

    /**
     * @return 剩余毫秒数；{@link #TTL_NO_EXPIRY} 或 {@link #TTL_KEY_MISSING}
     */
    public long ttl(String key) {
        if (expireIfNeeded(key) || !data.containsKey(key)) return TTL_KEY_MISSING;
        Long deadline = expires.get(key);
        if (deadline == null) return TTL_NO_EXPIRY;
        return Math.max(0, deadline - clock.millis());
    }

    public RedisDataType type(String key) {
        if (expireIfNeeded(key)) return null;
        RedisValue value = data.get(key);
        return value == null ? null : value.type();
    }

    // ---------------- 写 ----------------

    /**
     * 写入并清除原有的过期时间
     */
    public void set(String key, RedisValue value) {
        store(key, value, null);
    }

    public void setWithExpiry(String key, RedisValue value, Duration ttl) {
        if (ttl.isNegative() || ttl.isZero() || ttl.compareTo(MAX_TTL) > 0) {
            throw new IllegalArgumentException("invalid expire time");
        }
        store(key, value, clock.millis() + ttl.toMillis());
    }

    /**
     * 替换值但保留过期时间 (集合类命令、INCR 使用)
     */
    public void update(String key, RedisValue value) {
        store(key, value, expires.get(key));
    }

    public boolean delete(String key) {
        expires.remove(key);
        memoryManager.removeTracking(key);
        boolean existed = data.remove(key) != null;
        if (existed) dirty++;
        return existed;
    }

    public boolean expire(String key, Duration ttl) {
        if (ttl.compareTo(MAX_TTL) > 0) {
            throw new IllegalArgumentException("invalid expire time");
        }
        if (expireIfNeeded(key) || !data.containsKey(key)) return false;
        expires.put(key, clock.millis() + ttl.toMillis());
        dirty++;
        return true;
    }

    public boolean persist(String key) {
        if (expireIfNeeded(key) || !data.containsKey(key)) return false;
        if (expires.remove(key) == null) return false;
        dirty++;
        return true;
    }

    public void clear() {
        int size = data.size();
        data.clear();
        expires.clear();
        memoryManager.clearTracking();
        dirty += size;
    }

    /**
     * 用快照内容整体替换当前数据，已过期的 Key 会被丢弃
     */
    public void restore(KeyspaceImage image) {
        data.clear();
        expires.clear();
        memoryManager.clearTracking();
        dirty = 0;
        long now = clock.millis();
        for (Map.Entry<String, RedisValue> entry : image.data().entrySet()) {
            String key = entry.getKey();
            Long deadline = image.expiresAtMillis().get(key);
            if (deadline != null && deadline <= now) continue;
            data.put(key, entry.getValue().copy());
            if (deadline != null) {
                expires.put(key, deadline);
            }
            memoryManager.trackAccess(key);
        }
        log.debug("Keyspace restored with {} keys", data.size());
    }

    private void store(String key, RedisValue value, Long deadline) {
        RedisValue previous = data.put(key, value);
        Long previousDeadline = deadline == null ? expires.remove(key) : expires.put(key, deadline);
        memoryManager.trackAccess(key);
        try {
            // 刚写入的 Key 不参与本轮淘汰
            memoryManager.enforceBudget(this, key);
        } catch (MaxMemoryExceededException e) {
            // noeviction: 回滚本次写入
            if (previous == null) {
                data.remove(key);
                memoryManager.removeTracking(key);
            } else {
                data.put(key, previous);
            }
            if (previousDeadline == null) {
                expires.remove(key);
            } else {
                expires.put(key, previousDeadline);
            }
            throw e;
        }
        dirty++;
    }

    private boolean expireIfNeeded(String key) {
        Long deadline = expires.get(key);
        if (deadline == null || clock.millis() <= deadline) return false;
        delete(key);
        log.debug("Key '{}' expired lazily", key);
        return true;
    }

    private boolean isExpired(String key, long now) {
        Long deadline = expires.get(key);
        return deadline != null && now > deadline;
    }

    // ---------------- 只读视图 ----------------

    @Override
    public List<String> keys() {
        long now = clock.millis();
        List<String> result = new ArrayList<>(data.size());
        for (String key : data.keySet()) {
            if (!isExpired(key, now)) result.add(key);
        }
        return result;
    }

    @Override
    public int size() {
        long now = clock.millis();
        int count = 0;
        for (String key : data.keySet()) {
            if (!isExpired(key, now)) count++;
        }
        return count;
    }

    @Override
    public int expiresCount() {
        return expires.size();
    }

    @Override
    public long dirty() {
        return dirty;
    }

    /**
     * 保存成功后扣减保存期间之前累积的修改数
     */
    public void markSaved(long savedDirty) {
        dirty = Math.max(0, dirty - savedDirty);
    }

    @Override
    public KeyspaceImage capture() {
        long now = clock.millis();
        Map<String, RedisValue> dataCopy = new HashMap<>();
        Map<String, Long> expiresCopy = new HashMap<>();
        for (Map.Entry<String, RedisValue> entry : data.entrySet()) {
            String key = entry.getKey();
            if (isExpired(key, now)) continue;
            dataCopy.put(key, entry.getValue().copy());
            Long deadline = expires.get(key);
            if (deadline != null) {
                expiresCopy.put(key, deadline);
            }
        }
        return new KeyspaceImage(dataCopy, expiresCopy);
    }

    @Override
    public long usedMemory() {
        return memoryManager.estimateMemoryUsage(this);
    }

    @Override
    public Map<String, String> memoryInfo() {
        return memoryManager.memoryInfo(this);
    }

    // ---------------- 供 MemoryManager 使用 ----------------

    public Collection<Map.Entry<String, RedisValue>> entries() {
        return Collections.unmodifiableMap(data).entrySet();
    }

    public Set<String> rawKeys() {
        return Collections.unmodifiableSet(data.keySet());
    }

    public Set<String> keysWithExpiry() {
        return Collections.unmodifiableSet(expires.keySet());
    }

    public MemoryManager memoryManager() {
        return memoryManager;
    }
}
