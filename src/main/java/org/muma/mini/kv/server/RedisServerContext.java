package org.muma.mini.kv.server;

import io.netty.channel.ChannelHandler;
import lombok.Getter;
import org.muma.mini.kv.command.CommandDispatcher;
import org.muma.mini.kv.config.MiniKvConfig;
import org.muma.mini.kv.memory.MemoryManager;
import org.muma.mini.kv.pubsub.PubSubRegistry;
import org.muma.mini.kv.snapshot.SnapshotManager;
import org.muma.mini.kv.store.Database;
import org.muma.mini.kv.store.Keyspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 服务器上下文 (God Object)
 * 负责组装各个模块，管理生命周期。
 */
@Getter
public class RedisServerContext {

    private static final Logger log = LoggerFactory.getLogger(RedisServerContext.class);

    private final MiniKvConfig config;
    private final MemoryManager memoryManager;
    private final Database database;
    private final PubSubRegistry pubSub;
    private final SnapshotManager snapshotManager;
    private final CommandDispatcher dispatcher;
    private final ServerStats stats;

    @Getter(lombok.AccessLevel.NONE)
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public RedisServerContext(MiniKvConfig config) {
        this.config = config;

        // 1. 内存管理 + 键空间
        this.memoryManager = new MemoryManager(config.getMaxMemory(), config.getMaxMemoryPolicy());
        this.database = new Database(new Keyspace(memoryManager));

        // 2. Pub/Sub 与快照
        this.pubSub = new PubSubRegistry();
        this.snapshotManager = new SnapshotManager(config, database);

        // 3. Dispatcher
        this.dispatcher = new CommandDispatcher(database);
        this.stats = new ServerStats();
    }

    /**
     * 核心初始化流程
     * 顺序：数据恢复 -> 启动后台任务 -> 注册关闭钩子
     */
    public void init() {
        // Step 1: 快照恢复，必须在接受连接之前完成
        snapshotManager.load();

        // Step 2: 定时保存
        snapshotManager.init();

        // Step 3: 注册 Shutdown Hook
        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "Shutdown-Hook"));

        log.info("Server context initialized: maxmemory={}, policy={}, snapshot={}",
                config.getMaxMemory() > 0 ? MemoryManager.formatBytes(config.getMaxMemory()) : "unlimited",
                config.getMaxMemoryPolicy().configName(),
                config.getSnapshotPath());
    }

    /**
     * 每个连接创建一个新的 handler
     */
    public ChannelHandler newCommandHandler() {
        return new RedisCommandHandler(dispatcher, config, pubSub, snapshotManager, stats);
    }

    /**
     * 可重复调用，只执行一次
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) return;
        log.info("Shutting down, saving final snapshot...");
        snapshotManager.shutdown();
    }
}
