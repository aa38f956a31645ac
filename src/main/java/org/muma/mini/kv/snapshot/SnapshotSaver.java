package org.muma.mini.kv.snapshot;

import org.muma.mini.kv.store.KeyspaceImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * 快照写入：
 * 1. 旧快照复制为 .bak (失败只记日志)
 * 2. 写入 .tmp 并 fsync
 * 3. 原子 rename 覆盖正式文件
 * 4. fsync 父目录 (部分平台不支持，失败只记日志)
 */
public class SnapshotSaver {

    private static final Logger log = LoggerFactory.getLogger(SnapshotSaver.class);

    private final Path path;
    private final SnapshotCodec codec;

    public SnapshotSaver(Path path, SnapshotCodec codec) {
        this.path = path;
        this.codec = codec;
    }

    public void save(KeyspaceImage image) throws IOException {
        save(image, true);
    }

    /**
     * @param rotateBackup false 时不覆盖 .bak (从备份恢复后回写主文件时使用)
     */
    public void save(KeyspaceImage image, boolean rotateBackup) throws IOException {
        long start = System.currentTimeMillis();

        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        if (rotateBackup) {
            backupExisting();
        }

        byte[] bytes = codec.encode(image);
        Path tempPath = tempPath(path);
        try (FileChannel channel = FileChannel.open(tempPath,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }

        try {
            Files.move(tempPath, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to plain replace", path);
            Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING);
        }

        syncDirectory(parent);

        long duration = System.currentTimeMillis() - start;
        log.info("DB saved on disk. Keys: {}, Size: {} bytes, Duration: {} ms", image.size(), bytes.length, duration);
    }

    private void backupExisting() {
        if (!Files.exists(path)) return;
        Path backup = backupPath(path);
        try {
            Files.copy(path, backup, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.warn("Failed to copy snapshot {} to backup {}: {}", path, backup, e.getMessage());
        }
    }

    private void syncDirectory(Path dir) {
        if (dir == null) return;
        try (FileChannel channel = FileChannel.open(dir, StandardOpenOption.READ)) {
            channel.force(true);
        } catch (IOException e) {
            log.debug("Directory fsync not supported for {}: {}", dir, e.getMessage());
        }
    }

    public Path getPath() {
        return path;
    }

    public static Path backupPath(Path path) {
        return path.resolveSibling(path.getFileName() + ".bak");
    }

    public static Path tempPath(Path path) {
        return path.resolveSibling(path.getFileName() + ".tmp");
    }
}
