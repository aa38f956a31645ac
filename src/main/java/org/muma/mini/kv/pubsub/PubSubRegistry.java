package org.muma.mini.kv.pubsub;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 订阅注册表
 * <ul>
 *     <li>channel -> 订阅者 id 集合</li>
 *     <li>pattern -> 订阅者 id 集合</li>
 *     <li>订阅者 id -> 消息队列</li>
 * </ul>
 * 自带读写锁，不与 Database 的锁同时持有。publish 只持读锁，向无锁队列投递。
 */
public class PubSubRegistry {

    private static final Logger log = LoggerFactory.getLogger(PubSubRegistry.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Set<Long>> channels = new HashMap<>();
    private final Map<String, Set<Long>> patterns = new HashMap<>();
    private final Map<String, GlobPattern> compiledPatterns = new HashMap<>();
    private final Map<Long, SubscriberQueue> subscribers = new HashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);

    public SubscriberQueue createSubscriber() {
        SubscriberQueue queue = new SubscriberQueue(nextId.getAndIncrement());
        lock.writeLock().lock();
        try {
            subscribers.put(queue.getId(), queue);
        } finally {
            lock.writeLock().unlock();
        }
        return queue;
    }

    /**
     * 幂等。订阅确认 ["subscribe", channel, count] 会同时放入该订阅者的队列
     *
     * @return 该订阅者当前的订阅总数 (频道 + 模式)
     */
    public int subscribe(long id, String channel) {
        lock.writeLock().lock();
        try {
            requireSubscriber(id);
            channels.computeIfAbsent(channel, k -> new LinkedHashSet<>()).add(id);
            return acknowledge(id, "subscribe", channel);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int unsubscribe(long id, String channel) {
        lock.writeLock().lock();
        try {
            removeFrom(channels, channel, id);
            return acknowledge(id, "unsubscribe", channel);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int psubscribe(long id, String pattern) {
        lock.writeLock().lock();
        try {
            requireSubscriber(id);
            patterns.computeIfAbsent(pattern, k -> new LinkedHashSet<>()).add(id);
            compiledPatterns.computeIfAbsent(pattern, GlobPattern::compile);
            return acknowledge(id, "psubscribe", pattern);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int punsubscribe(long id, String pattern) {
        lock.writeLock().lock();
        try {
            if (removeFrom(patterns, pattern, id)) {
                compiledPatterns.remove(pattern);
            }
            return acknowledge(id, "punsubscribe", pattern);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 先投递精确频道订阅者，再投递每个匹配模式的订阅者。
     * 同时命中频道和模式的订阅者会收到两条消息。
     *
     * @return 成功入队的条数，已关闭的队列不计入
     */
    public int publish(String channel, String message) {
        lock.readLock().lock();
        try {
            int delivered = 0;

            Set<Long> exact = channels.get(channel);
            if (exact != null) {
                for (Long id : exact) {
                    if (deliver(id, new PubSubMessage.Message(channel, message))) {
                        delivered++;
                    }
                }
            }

            for (Map.Entry<String, Set<Long>> entry : patterns.entrySet()) {
                String pattern = entry.getKey();
                GlobPattern glob = compiledPatterns.get(pattern);
                if (glob == null || !glob.matches(channel)) continue;
                for (Long id : entry.getValue()) {
                    if (deliver(id, new PubSubMessage.PatternMessage(pattern, channel, message))) {
                        delivered++;
                    }
                }
            }

            log.debug("Published to '{}', delivered to {} subscribers", channel, delivered);
            return delivered;
        } finally {
            lock.readLock().unlock();
        }
    }

    // 确认消息在写锁内入队，与 publish 的投递保持先后顺序
    private int acknowledge(long id, String kind, String name) {
        int count = countSubscriptions(id);
        SubscriberQueue queue = subscribers.get(id);
        if (queue != null) {
            queue.offer(new PubSubMessage.Subscription(kind, name, count));
        }
        return count;
    }

    private boolean deliver(Long id, PubSubMessage message) {
        SubscriberQueue queue = subscribers.get(id);
        return queue != null && queue.offer(message);
    }

    /**
     * 连接关闭时调用，重复调用无副作用
     */
    public void removeSubscriber(long id) {
        lock.writeLock().lock();
        try {
            SubscriberQueue queue = subscribers.remove(id);
            channels.entrySet().removeIf(e -> e.getValue().remove(id) && e.getValue().isEmpty());
            patterns.entrySet().removeIf(e -> {
                boolean empty = e.getValue().remove(id) && e.getValue().isEmpty();
                if (empty) compiledPatterns.remove(e.getKey());
                return empty;
            });
            if (queue != null) {
                queue.close();
                log.debug("Subscriber {} removed", id);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<String> channelsOf(long id) {
        lock.readLock().lock();
        try {
            return collectFor(channels, id);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> patternsOf(long id) {
        lock.readLock().lock();
        try {
            return collectFor(patterns, id);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int subscriptionCount(long id) {
        lock.readLock().lock();
        try {
            return countSubscriptions(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * PUBSUB CHANNELS [pattern]: 至少有一个订阅者的频道
     */
    public List<String> activeChannels(String pattern) {
        GlobPattern glob = pattern == null ? null : GlobPattern.compile(pattern);
        lock.readLock().lock();
        try {
            List<String> result = new ArrayList<>();
            for (String channel : channels.keySet()) {
                if (glob == null || glob.matches(channel)) {
                    result.add(channel);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * PUBSUB NUMSUB: 频道的订阅者数量 (不含模式订阅)
     */
    public int numSub(String channel) {
        lock.readLock().lock();
        try {
            Set<Long> ids = channels.get(channel);
            return ids == null ? 0 : ids.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * PUBSUB NUMPAT: 所有模式订阅的总数
     */
    public int numPat() {
        lock.readLock().lock();
        try {
            int total = 0;
            for (Set<Long> ids : patterns.values()) {
                total += ids.size();
            }
            return total;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int subscriberCount() {
        lock.readLock().lock();
        try {
            return subscribers.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void requireSubscriber(long id) {
        if (!subscribers.containsKey(id)) {
            throw new IllegalStateException("unknown subscriber " + id);
        }
    }

    private boolean removeFrom(Map<String, Set<Long>> index, String name, long id) {
        Set<Long> ids = index.get(name);
        if (ids == null) return false;
        ids.remove(id);
        if (ids.isEmpty()) {
            index.remove(name);
            return true;
        }
        return false;
    }

    private List<String> collectFor(Map<String, Set<Long>> index, long id) {
        List<String> result = new ArrayList<>();
        for (Map.Entry<String, Set<Long>> e : index.entrySet()) {
            if (e.getValue().contains(id)) {
                result.add(e.getKey());
            }
        }
        return result;
    }

    private int countSubscriptions(long id) {
        int count = 0;
        for (Set<Long> ids : channels.values()) {
            if (ids.contains(id)) count++;
        }
        for (Set<Long> ids : patterns.values()) {
            if (ids.contains(id)) count++;
        }
        return count;
    }
}
