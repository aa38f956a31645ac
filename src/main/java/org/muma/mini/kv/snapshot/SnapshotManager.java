package org.muma.mini.kv.snapshot;

import org.muma.mini.kv.config.MiniKvConfig;
import org.muma.mini.kv.store.Database;
import org.muma.mini.kv.store.KeyspaceImage;
import org.muma.mini.kv.store.KeyspaceView;
import org.muma.mini.kv.utils.ThreadUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 快照生命周期: 启动加载、定时保存 (save 规则)、SAVE / BGSAVE、从备份恢复、关闭前保存。
 * <p>
 * 数据在读锁内拷贝，文件 I/O 在锁外进行。
 */
public class SnapshotManager {

    private static final Logger log = LoggerFactory.getLogger(SnapshotManager.class);

    private final Database database;
    private final List<MiniKvConfig.SaveParam> saveParams;
    private final Clock clock;
    private final SnapshotSaver saver;
    private final SnapshotLoader loader;

    private final ScheduledExecutorService cronExecutor;
    private final ExecutorService bgsaveExecutor;
    private final AtomicBoolean bgsaveInProgress = new AtomicBoolean(false);
    // SAVE 与 BGSAVE 串行写文件
    private final Object saveLock = new Object();

    private volatile long lastSaveMillis;

    public SnapshotManager(MiniKvConfig config, Database database) {
        this(config.getSnapshotPath(), config.getSaveParams(), database, Clock.systemUTC());
    }

    public SnapshotManager(Path path, List<MiniKvConfig.SaveParam> saveParams, Database database, Clock clock) {
        this.database = database;
        this.saveParams = List.copyOf(saveParams);
        this.clock = clock;

        SnapshotCodec codec = new SnapshotCodec();
        this.saver = new SnapshotSaver(path, codec);
        this.loader = new SnapshotLoader(path, codec, saver, clock);

        this.cronExecutor = Executors.newSingleThreadScheduledExecutor(ThreadUtils.namedDaemonFactory("Snapshot-Cron"));
        this.bgsaveExecutor = Executors.newSingleThreadExecutor(ThreadUtils.namedDaemonFactory("Snapshot-Bgsave"));
        this.lastSaveMillis = clock.millis();
    }

    /**
     * 启动时调用，必须在接受连接之前完成
     */
    public void load() {
        KeyspaceImage image = loader.load();
        database.restore(image);
        lastSaveMillis = clock.millis();
    }

    public void init() {
        if (saveParams.isEmpty()) {
            log.info("Automatic snapshots disabled (no save rules)");
            return;
        }
        cronExecutor.scheduleAtFixedRate(this::serverCron, 1, 1, TimeUnit.SECONDS);
    }

    void serverCron() {
        long dirty = database.read(KeyspaceView::dirty);
        if (dirty == 0) return;

        long elapsed = clock.millis() - lastSaveMillis;
        for (MiniKvConfig.SaveParam param : saveParams) {
            if (dirty >= param.changes() && elapsed >= param.seconds() * 1000) {
                log.info("Snapshot triggered: {} changes in {} seconds", dirty, elapsed / 1000);
                triggerBgsave();
                break;
            }
        }
    }

    /**
     * 同步保存 (SAVE)
     */
    public void save() throws IOException {
        synchronized (saveLock) {
            Capture capture = database.read(view -> new Capture(view.capture(), view.dirty()));
            saver.save(capture.image());
            database.execute(ks -> ks.markSaved(capture.dirty()));
            lastSaveMillis = clock.millis();
        }
    }

    /**
     * 后台保存 (BGSAVE)
     *
     * @return false 表示已有后台保存在进行
     */
    public boolean triggerBgsave() {
        if (!bgsaveInProgress.compareAndSet(false, true)) {
            log.warn("Background save already in progress");
            return false;
        }

        bgsaveExecutor.submit(() -> {
            try {
                save();
            } catch (IOException | RuntimeException e) {
                log.error("Background save failed", e);
            } finally {
                bgsaveInProgress.set(false);
            }
        });
        return true;
    }

    public boolean isBgsaveInProgress() {
        return bgsaveInProgress.get();
    }

    public boolean verifyIntegrity() {
        return loader.verifyIntegrity();
    }

    /**
     * 用 .bak 替换当前数据并回写主文件
     *
     * @return 恢复的 Key 数量
     */
    public int recoverFromBackup() throws IOException {
        synchronized (saveLock) {
            KeyspaceImage image = loader.loadBackup();
            database.restore(image);
            saver.save(image, false);
            lastSaveMillis = clock.millis();
            log.warn("Keyspace replaced with {} keys from backup", image.size());
            return image.size();
        }
    }

    /**
     * LASTSAVE 返回值 (epoch 秒)
     */
    public long getLastSaveTime() {
        return lastSaveMillis / 1000;
    }

    public Path getPath() {
        return saver.getPath();
    }

    public void shutdown() {
        cronExecutor.shutdownNow();
        ThreadUtils.shutdownAndAwait(bgsaveExecutor, 10, TimeUnit.SECONDS);
        try {
            save();
            log.info("Final snapshot saved to {}", saver.getPath());
        } catch (IOException | RuntimeException e) {
            log.error("Final snapshot on shutdown failed", e);
        }
    }

    private record Capture(KeyspaceImage image, long dirty) {
    }
}
