package org.muma.mini.kv.pubsub;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * 订阅者私有的无界消息队列，多生产者单消费者。
 * 关闭后的 offer 返回 false，发布方直接忽略。
 */
public class SubscriberQueue {

    private final long id;
    private final Queue<PubSubMessage> messages = new ConcurrentLinkedQueue<>();
    private volatile boolean closed;
    // 入队后回调 (Netty 连接用它调度 drain)
    private volatile Runnable listener;

    public SubscriberQueue(long id) {
        this.id = id;
    }

    public long getId() {
        return id;
    }

    public boolean offer(PubSubMessage message) {
        if (closed) return false;
        messages.offer(message);
        Runnable l = listener;
        if (l != null) {
            l.run();
        }
        return true;
    }

    public PubSubMessage poll() {
        return messages.poll();
    }

    public List<PubSubMessage> drain() {
        List<PubSubMessage> drained = new ArrayList<>();
        PubSubMessage m;
        while ((m = messages.poll()) != null) {
            drained.add(m);
        }
        return drained;
    }

    public int size() {
        return messages.size();
    }

    public void setListener(Runnable listener) {
        this.listener = listener;
    }

    public void close() {
        closed = true;
        messages.clear();
    }

    public boolean isClosed() {
        return closed;
    }
}
