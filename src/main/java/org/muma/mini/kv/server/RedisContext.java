package org.muma.mini.kv.server;

import io.netty.channel.ChannelHandlerContext;
import org.muma.mini.kv.command.impl.pubsub.PubSubReplies;
import org.muma.mini.kv.config.MiniKvConfig;
import org.muma.mini.kv.pubsub.PubSubMessage;
import org.muma.mini.kv.pubsub.PubSubRegistry;
import org.muma.mini.kv.pubsub.SubscriberQueue;
import org.muma.mini.kv.snapshot.SnapshotManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 命令执行上下文
 * 封装了与当前连接相关的所有环境信息: 认证状态、订阅者队列，以及共享的 Pub/Sub 与快照组件
 */
public class RedisContext {

    private static final Logger log = LoggerFactory.getLogger(RedisContext.class);

    private final ChannelHandlerContext nettyCtx;
    private final MiniKvConfig config;
    private final PubSubRegistry pubSub;
    private final SnapshotManager snapshotManager;
    private final ServerStats stats;

    private boolean authenticated;
    // 第一次 SUBSCRIBE / PSUBSCRIBE 时创建
    private SubscriberQueue subscriber;
    private final AtomicBoolean drainScheduled = new AtomicBoolean(false);

    public RedisContext(ChannelHandlerContext nettyCtx, MiniKvConfig config, PubSubRegistry pubSub,
                        SnapshotManager snapshotManager, ServerStats stats) {
        this.nettyCtx = nettyCtx;
        this.config = config;
        this.pubSub = pubSub;
        this.snapshotManager = snapshotManager;
        this.stats = stats;
        this.authenticated = !config.isAuthRequired();
    }

    public MiniKvConfig getConfig() {
        return config;
    }

    public PubSubRegistry getPubSub() {
        return pubSub;
    }

    public SnapshotManager getSnapshotManager() {
        return snapshotManager;
    }

    public ServerStats getStats() {
        return stats;
    }

    public boolean isAuthenticated() {
        return authenticated;
    }

    public void setAuthenticated(boolean authenticated) {
        this.authenticated = authenticated;
    }

    public SubscriberQueue getOrCreateSubscriber() {
        if (subscriber == null) {
            subscriber = pubSub.createSubscriber();
            if (nettyCtx != null) {
                subscriber.setListener(this::scheduleDrain);
            }
            log.debug("Subscriber {} created for {}", subscriber.getId(), remoteAddress());
        }
        return subscriber;
    }

    /**
     * 尚未订阅过时返回 null
     */
    public SubscriberQueue getSubscriber() {
        return subscriber;
    }

    /**
     * 至少有一个频道或模式订阅时，连接处于订阅模式
     */
    public boolean isSubscriberMode() {
        return subscriber != null && pubSub.subscriptionCount(subscriber.getId()) > 0;
    }

    /**
     * 连接关闭时调用，清理订阅
     */
    public void close() {
        if (subscriber != null) {
            pubSub.removeSubscriber(subscriber.getId());
        }
    }

    // 发布线程可能是任意连接的 EventLoop，真正的写出统一切回本连接的 EventLoop
    private void scheduleDrain() {
        if (drainScheduled.compareAndSet(false, true)) {
            nettyCtx.channel().eventLoop().execute(this::drain);
        }
    }

    private void drain() {
        drainScheduled.set(false);
        SubscriberQueue queue = subscriber;
        if (queue == null || !nettyCtx.channel().isActive()) return;

        PubSubMessage message;
        boolean wrote = false;
        while ((message = queue.poll()) != null) {
            nettyCtx.write(PubSubReplies.toReply(message));
            wrote = true;
        }
        if (wrote) {
            nettyCtx.flush();
        }
    }

    private Object remoteAddress() {
        return nettyCtx == null ? "local" : nettyCtx.channel().remoteAddress();
    }
}
