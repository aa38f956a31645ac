package org.muma.mini.kv.command;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.muma.mini.kv.MutableClock;
import org.muma.mini.kv.command.impl.server.*;
import org.muma.mini.kv.command.impl.string.SetCommand;
import org.muma.mini.kv.config.MiniKvConfig;
import org.muma.mini.kv.memory.MemoryManager;
import org.muma.mini.kv.protocol.*;
import org.muma.mini.kv.pubsub.PubSubRegistry;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.server.ServerStats;
import org.muma.mini.kv.snapshot.SnapshotManager;
import org.muma.mini.kv.store.Database;
import org.muma.mini.kv.store.Keyspace;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ServerCommandTest {

    @TempDir
    Path dir;

    private MutableClock clock;
    private MiniKvConfig config;
    private Database db;
    private SnapshotManager snapshotManager;
    private RedisContext context;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_700_000_000_000L);
        config = new MiniKvConfig();
        db = new Database(new Keyspace(new MemoryManager(), clock));
        snapshotManager = new SnapshotManager(dir.resolve("dump.json"), List.of(), db, clock);
        context = new RedisContext(null, config, new PubSubRegistry(), snapshotManager, new ServerStats());
    }

    @AfterEach
    void tearDown() {
        snapshotManager.shutdown();
    }

    private RedisArray args(String... args) {
        RedisMessage[] msgs = new RedisMessage[args.length];
        for (int i = 0; i < args.length; i++) {
            msgs[i] = new BulkString(args[i]);
        }
        return new RedisArray(msgs);
    }

    private String asString(RedisMessage msg) {
        if (msg instanceof BulkString b) return b.asString();
        if (msg instanceof SimpleString s) return s.content();
        if (msg instanceof ErrorMessage e) return e.content();
        return null;
    }

    private long asLong(RedisMessage msg) {
        if (msg instanceof RedisInteger i) return i.value();
        throw new RuntimeException("Not an integer: " + msg);
    }

    private void set(String key, String value) {
        new SetCommand().execute(db, args("SET", key, value), context);
    }

    @Test
    void testPingEcho() {
        assertEquals(SimpleString.PONG, new PingCommand().execute(db, args("PING"), context));
        assertEquals("hi", asString(new PingCommand().execute(db, args("PING", "hi"), context)));
        assertEquals("hello", asString(new EchoCommand().execute(db, args("ECHO", "hello"), context)));
        assertTrue(new EchoCommand().execute(db, args("ECHO"), context) instanceof ErrorMessage);
    }

    @Test
    void testAuthWithoutPassword() {
        assertTrue(context.isAuthenticated());
        assertEquals("ERR Client sent AUTH, but no password is set",
                asString(new AuthCommand().execute(db, args("AUTH", "x"), context)));
    }

    @Test
    void testAuthWithPassword() {
        config.setRequirePass("secret");
        RedisContext client = new RedisContext(null, config, new PubSubRegistry(), snapshotManager, new ServerStats());
        assertFalse(client.isAuthenticated());

        assertEquals("ERR invalid password", asString(new AuthCommand().execute(db, args("AUTH", "guess"), client)));
        assertFalse(client.isAuthenticated());

        assertEquals("OK", asString(new AuthCommand().execute(db, args("AUTH", "secret"), client)));
        assertTrue(client.isAuthenticated());
    }

    @Test
    void testDbSizeAndFlushAll() {
        set("a", "1");
        set("b", "2");
        assertEquals(2, asLong(new DbSizeCommand().execute(db, args("DBSIZE"), context)));
        assertEquals("OK", asString(new FlushAllCommand().execute(db, args("FLUSHALL"), context)));
        assertEquals(0, asLong(new DbSizeCommand().execute(db, args("DBSIZE"), context)));
    }

    @Test
    void testMemoryReport() {
        set("a", "1");
        String report = asString(new MemoryCommand().execute(db, args("MEMORY"), context));
        assertTrue(report.contains("used_memory:"));
        assertTrue(report.contains("maxmemory_human:unlimited"));
        assertTrue(report.contains("maxmemory_policy:allkeys-lru"));
        assertTrue(report.contains("total_keys:1"));
    }

    @Test
    void testInfoSections() {
        set("a", "1");
        String all = asString(new InfoCommand().execute(db, args("INFO"), context));
        assertTrue(all.contains("# Server"));
        assertTrue(all.contains("# Memory"));
        assertTrue(all.contains("# Persistence"));
        assertTrue(all.contains("db0:keys=1,expires=0"));

        String keyspace = asString(new InfoCommand().execute(db, args("INFO", "keyspace"), context));
        assertFalse(keyspace.contains("# Server"));
        assertTrue(keyspace.startsWith("# Keyspace"));
    }

    @Test
    void testSaveLastSaveAndVerify() {
        set("a", "1");
        clock.advanceMillis(5_000);

        assertEquals("OK", asString(new SaveCommand().execute(db, args("SAVE"), context)));
        assertTrue(Files.exists(dir.resolve("dump.json")));
        assertEquals(clock.millis() / 1000, asLong(new LastSaveCommand().execute(db, args("LASTSAVE"), context)));
        assertEquals("OK snapshot checksum verified",
                asString(new VerifyIntegrityCommand().execute(db, args("VERIFY"), context)));
    }

    @Test
    void testVerifyWithoutSnapshotFails() {
        assertEquals("ERR snapshot integrity check failed",
                asString(new VerifyIntegrityCommand().execute(db, args("VERIFYINTEGRITY"), context)));
    }

    @Test
    void testRecoverFromBackup() {
        RecoverFromBackupCommand recover = new RecoverFromBackupCommand();
        assertTrue(asString(recover.execute(db, args("RECOVER"), context))
                .startsWith("ERR recovery from backup failed"));

        set("a", "1");
        new SaveCommand().execute(db, args("SAVE"), context);
        set("b", "2");
        new SaveCommand().execute(db, args("SAVE"), context);

        assertEquals("OK recovered 1 keys from backup", asString(recover.execute(db, args("RECOVER"), context)));
        assertEquals(1, asLong(new DbSizeCommand().execute(db, args("DBSIZE"), context)));
    }

    @Test
    void testBgsave() throws Exception {
        set("a", "1");
        assertEquals("Background saving started", asString(new BgSaveCommand().execute(db, args("BGSAVE"), context)));
        long deadline = System.currentTimeMillis() + 5000;
        while (snapshotManager.isBgsaveInProgress() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(Files.exists(dir.resolve("dump.json")));
    }
}
