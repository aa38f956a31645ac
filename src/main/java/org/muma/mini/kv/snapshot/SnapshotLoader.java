package org.muma.mini.kv.snapshot;

import org.muma.mini.kv.common.RedisValue;
import org.muma.mini.kv.store.KeyspaceImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * 启动时读取快照。主文件失败时回退到 .bak，再失败则以空数据启动。
 */
public class SnapshotLoader {

    private static final Logger log = LoggerFactory.getLogger(SnapshotLoader.class);

    private final Path path;
    private final SnapshotCodec codec;
    private final SnapshotSaver saver;
    private final Clock clock;

    public SnapshotLoader(Path path, SnapshotCodec codec, SnapshotSaver saver, Clock clock) {
        this.path = path;
        this.codec = codec;
        this.saver = saver;
        this.clock = clock;
    }

    /**
     * 不抛异常，任何情况下都返回可用的数据
     */
    public KeyspaceImage load() {
        cleanupTempFile();

        Path backup = SnapshotSaver.backupPath(path);
        if (!Files.exists(path)) {
            if (!Files.exists(backup)) {
                log.info("No snapshot found at {}, starting with empty keyspace", path);
                return KeyspaceImage.empty();
            }
            log.warn("Snapshot {} is missing but backup exists, recovering from backup", path);
            return loadFromBackupOrEmpty(null);
        }

        try {
            KeyspaceImage image = read(path);
            log.info("Loaded {} keys from snapshot {}", image.size(), path);
            return image;
        } catch (IOException e) {
            log.warn("Failed to load snapshot {}: {}", path, e.getMessage());
            return loadFromBackupOrEmpty(e);
        }
    }

    /**
     * 读取 .bak，供 RECOVERFROMBACKUP 使用
     */
    public KeyspaceImage loadBackup() throws IOException {
        return read(SnapshotSaver.backupPath(path));
    }

    /**
     * 重新计算磁盘上文件的校验和，不修改任何状态
     */
    public boolean verifyIntegrity() {
        try {
            return codec.verify(Files.readAllBytes(path));
        } catch (IOException e) {
            log.warn("Cannot read snapshot {} for verification: {}", path, e.getMessage());
            return false;
        }
    }

    private KeyspaceImage loadFromBackupOrEmpty(IOException primaryFailure) {
        Path backup = SnapshotSaver.backupPath(path);
        try {
            KeyspaceImage image = read(backup);
            log.warn("Recovered {} keys from backup {}", image.size(), backup);
            promote(image);
            return image;
        } catch (IOException e) {
            if (primaryFailure != null) {
                e.addSuppressed(primaryFailure);
            }
            log.error("DATA LOSS: snapshot {} and backup {} are both unusable, starting with empty keyspace",
                    path, backup, e);
            return KeyspaceImage.empty();
        }
    }

    // 备份可用时回写主文件，不覆盖 .bak
    private void promote(KeyspaceImage image) {
        try {
            saver.save(image, false);
        } catch (IOException e) {
            log.warn("Failed to promote backup to {}: {}", path, e.getMessage());
        }
    }

    private KeyspaceImage read(Path file) throws IOException {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            throw new SnapshotException("Snapshot file not found: " + file, e);
        }
        if (bytes.length == 0) {
            log.info("Snapshot {} is empty", file);
            return KeyspaceImage.empty();
        }
        return dropElapsed(codec.decode(bytes));
    }

    private KeyspaceImage dropElapsed(KeyspaceImage image) {
        long now = clock.millis();
        Map<String, RedisValue> data = new HashMap<>(image.data());
        Map<String, Long> expires = new HashMap<>();
        for (Map.Entry<String, Long> entry : image.expiresAtMillis().entrySet()) {
            if (entry.getValue() > now) {
                expires.put(entry.getKey(), entry.getValue());
            } else {
                data.remove(entry.getKey());
            }
        }
        return new KeyspaceImage(data, expires);
    }

    private void cleanupTempFile() {
        Path temp = SnapshotSaver.tempPath(path);
        try {
            if (Files.deleteIfExists(temp)) {
                log.info("Removed stale temp file {}", temp);
            }
        } catch (IOException e) {
            log.warn("Failed to remove stale temp file {}: {}", temp, e.getMessage());
        }
    }
}
