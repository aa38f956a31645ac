package org.muma.mini.kv.snapshot;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.muma.mini.kv.MutableClock;
import org.muma.mini.kv.common.StringValue;
import org.muma.mini.kv.config.MiniKvConfig;
import org.muma.mini.kv.memory.MemoryManager;
import org.muma.mini.kv.store.Database;
import org.muma.mini.kv.store.Keyspace;
import org.muma.mini.kv.store.KeyspaceView;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SnapshotManagerTest {

    @TempDir
    Path dir;

    private Path path;
    private MutableClock clock;
    private Database db;
    private SnapshotManager manager;

    @BeforeEach
    void setUp() {
        path = dir.resolve("dump.json");
        clock = new MutableClock(1_700_000_000_000L);
        db = new Database(new Keyspace(new MemoryManager(), clock));
        manager = new SnapshotManager(path, List.of(new MiniKvConfig.SaveParam(1, 2)), db, clock);
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    private void set(String key, String value) {
        db.execute(ks -> ks.set(key, new StringValue(value)));
    }

    private void awaitBgsave() throws InterruptedException {
        awaitBgsave(manager);
    }

    private void awaitBgsave(SnapshotManager target) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (target.isBgsaveInProgress() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertFalse(target.isBgsaveInProgress(), "bgsave did not finish in time");
    }

    @Test
    void testSaveResetsDirtyAndUpdatesLastSave() throws Exception {
        set("a", "1");
        set("b", "2");
        clock.advance(Duration.ofSeconds(30));

        manager.save();

        assertTrue(Files.exists(path));
        assertEquals(0L, (long) db.read(KeyspaceView::dirty));
        assertEquals(clock.millis() / 1000, manager.getLastSaveTime());
        assertTrue(manager.verifyIntegrity());
    }

    @Test
    void testLoadRestoresDatabase() throws Exception {
        set("a", "1");
        db.execute(ks -> ks.setWithExpiry("t", new StringValue("2"), Duration.ofSeconds(100)));
        manager.save();

        Database other = new Database(new Keyspace(new MemoryManager(), clock));
        SnapshotManager second = new SnapshotManager(path, List.of(), other, clock);
        try {
            second.load();
            assertEquals(2, (int) other.read(KeyspaceView::size));
            assertEquals(new StringValue("1"), other.write(ks -> ks.get("a")));
            assertEquals(100_000L, (long) other.write(ks -> ks.ttl("t")));
        } finally {
            second.shutdown();
        }
    }

    @Test
    void testCronTriggersBackgroundSaveWhenRuleMatches() throws Exception {
        set("a", "1");
        clock.advance(Duration.ofSeconds(2));
        manager.serverCron();
        // 只有 1 次修改，不满足 "1 秒 2 次"
        assertFalse(manager.isBgsaveInProgress());
        assertFalse(Files.exists(path));

        set("b", "2");
        manager.serverCron();
        awaitBgsave();

        assertTrue(Files.exists(path));
        assertEquals(0L, (long) db.read(KeyspaceView::dirty));
    }

    @Test
    void testCronWaitsForElapsedSeconds() {
        set("a", "1");
        set("b", "2");
        manager.serverCron();
        assertFalse(manager.isBgsaveInProgress());
        assertFalse(Files.exists(path));
    }

    @Test
    void testBgsave() throws Exception {
        set("a", "1");
        assertTrue(manager.triggerBgsave());
        awaitBgsave();
        assertTrue(manager.verifyIntegrity());
    }

    @Test
    void testBgsaveLogsUnexpectedFailure() throws Exception {
        Database failing = mock(Database.class);
        when(failing.read(any())).thenThrow(new IllegalStateException("capture failed"));
        SnapshotManager failingManager = new SnapshotManager(path, List.of(), failing, clock);

        Logger logger = (Logger) LoggerFactory.getLogger(SnapshotManager.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            assertTrue(failingManager.triggerBgsave());
            awaitBgsave(failingManager);

            assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.ERROR
                    && e.getFormattedMessage().equals("Background save failed")));
            // 失败后标志已复位，可以再次触发
            assertTrue(failingManager.triggerBgsave());
            awaitBgsave(failingManager);
            assertFalse(Files.exists(path));
        } finally {
            failingManager.shutdown();
            logger.detachAppender(appender);
        }
    }

    @Test
    void testRecoverFromBackup() throws Exception {
        set("a", "1");
        manager.save();
        set("b", "2");
        manager.save();

        assertEquals(1, manager.recoverFromBackup());

        assertEquals(1, (int) db.read(KeyspaceView::size));
        assertNull(db.write(ks -> ks.get("b")));
        // 主文件被回写为备份内容
        SnapshotCodec codec = new SnapshotCodec();
        assertEquals(1, codec.decode(Files.readAllBytes(path)).size());
    }

    @Test
    void testRecoverWithoutBackupFails() throws Exception {
        set("a", "1");
        manager.save();
        assertThrows(SnapshotException.class, () -> manager.recoverFromBackup());
        assertEquals(1, (int) db.read(KeyspaceView::size));
    }

    @Test
    void testVerifyIntegrityDetectsTampering() throws Exception {
        assertFalse(manager.verifyIntegrity());
        set("a", "hello");
        manager.save();
        Files.writeString(path, Files.readString(path).replace("hello", "jello"));
        assertFalse(manager.verifyIntegrity());
    }

    @Test
    void testShutdownWritesFinalSnapshot() {
        set("a", "1");
        manager.shutdown();
        assertTrue(Files.exists(path));
    }
}
