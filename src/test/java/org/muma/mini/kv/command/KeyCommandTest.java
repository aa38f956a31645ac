package org.muma.mini.kv.command;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.mini.kv.MutableClock;
import org.muma.mini.kv.command.impl.key.*;
import org.muma.mini.kv.command.impl.string.SetCommand;
import org.muma.mini.kv.memory.MemoryManager;
import org.muma.mini.kv.protocol.*;
import org.muma.mini.kv.store.Database;
import org.muma.mini.kv.store.Keyspace;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KeyCommandTest {

    private MutableClock clock;
    private Database db;
    private SetCommand set;
    private DelCommand del;
    private ExistsCommand exists;
    private ExpireCommand expire;
    private TtlCommand ttl;
    private TtlCommand pttl;
    private PersistCommand persist;
    private TypeCommand type;
    private KeysCommand keys;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_700_000_000_000L);
        db = new Database(new Keyspace(new MemoryManager(), clock));
        set = new SetCommand();
        del = new DelCommand();
        exists = new ExistsCommand();
        expire = new ExpireCommand();
        ttl = new TtlCommand(false);
        pttl = new TtlCommand(true);
        persist = new PersistCommand();
        type = new TypeCommand();
        keys = new KeysCommand();
    }

    private RedisArray args(String... args) {
        RedisMessage[] msgs = new RedisMessage[args.length];
        for (int i = 0; i < args.length; i++) {
            msgs[i] = new BulkString(args[i]);
        }
        return new RedisArray(msgs);
    }

    private long asLong(RedisMessage msg) {
        if (msg instanceof RedisInteger i) return i.value();
        throw new RuntimeException("Not an integer: " + msg);
    }

    private List<String> asList(RedisMessage msg) {
        RedisArray array = (RedisArray) msg;
        List<String> result = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            result.add(array.argAt(i));
        }
        return result;
    }

    @Test
    void testDelAndExists() {
        set.execute(db, args("SET", "a", "1"), null);
        set.execute(db, args("SET", "b", "2"), null);

        assertEquals(2, asLong(exists.execute(db, args("EXISTS", "a", "b", "c"), null)));
        assertEquals(2, asLong(del.execute(db, args("DEL", "a", "b", "c"), null)));
        assertEquals(0, asLong(exists.execute(db, args("EXISTS", "a"), null)));
    }

    @Test
    void testExpiredKeyNotCountedByDel() {
        set.execute(db, args("SET", "a", "1", "PX", "10"), null);
        clock.advanceMillis(11);
        assertEquals(0, asLong(del.execute(db, args("DEL", "a"), null)));
    }

    @Test
    void testExpireTtlPersist() {
        assertEquals(-2, asLong(ttl.execute(db, args("TTL", "k"), null)));
        assertEquals(0, asLong(expire.execute(db, args("EXPIRE", "k", "10"), null)));

        set.execute(db, args("SET", "k", "v"), null);
        assertEquals(-1, asLong(ttl.execute(db, args("TTL", "k"), null)));
        assertEquals(1, asLong(expire.execute(db, args("EXPIRE", "k", "10"), null)));

        clock.advanceMillis(2_400);
        assertEquals(8, asLong(ttl.execute(db, args("TTL", "k"), null)));
        assertEquals(7_600, asLong(pttl.execute(db, args("PTTL", "k"), null)));

        assertEquals(1, asLong(persist.execute(db, args("PERSIST", "k"), null)));
        assertEquals(0, asLong(persist.execute(db, args("PERSIST", "k"), null)));
        assertEquals(-1, asLong(ttl.execute(db, args("TTL", "k"), null)));
    }

    @Test
    void testExpireNonPositiveDeletes() {
        set.execute(db, args("SET", "k", "v"), null);
        assertEquals(1, asLong(expire.execute(db, args("EXPIRE", "k", "0"), null)));
        assertEquals(0, asLong(exists.execute(db, args("EXISTS", "k"), null)));
        assertTrue(expire.execute(db, args("EXPIRE", "k", "soon"), null) instanceof ErrorMessage);
    }

    @Test
    void testExpireOutOfRangeRejected() {
        set.execute(db, args("SET", "k", "v"), null);

        RedisMessage reply = expire.execute(db, args("EXPIRE", "k", "9223372036854775"), null);
        assertEquals(new ErrorMessage("ERR invalid expire time in 'expire' command"), reply);
        assertEquals(-1, asLong(ttl.execute(db, args("TTL", "k"), null)));
        assertEquals(1, asLong(exists.execute(db, args("EXISTS", "k"), null)));

        assertTrue(expire.execute(db, args("EXPIRE", "k", String.valueOf(Long.MAX_VALUE)), null) instanceof ErrorMessage);
        assertEquals(1, asLong(exists.execute(db, args("EXISTS", "k"), null)));
    }

    @Test
    void testExpireLargeValueInRange() {
        set.execute(db, args("SET", "k", "v"), null);
        // 约 100 年
        assertEquals(1, asLong(expire.execute(db, args("EXPIRE", "k", "3153600000"), null)));
        clock.advance(Duration.ofDays(365));
        assertEquals(1, asLong(exists.execute(db, args("EXISTS", "k"), null)));
    }

    @Test
    void testType() {
        set.execute(db, args("SET", "s", "v"), null);
        assertEquals(new SimpleString("string"), type.execute(db, args("TYPE", "s"), null));
        assertEquals(new SimpleString("none"), type.execute(db, args("TYPE", "missing"), null));
    }

    @Test
    void testKeysPattern() {
        set.execute(db, args("SET", "user:1", "a"), null);
        set.execute(db, args("SET", "user:2", "b"), null);
        set.execute(db, args("SET", "order:1", "c"), null);
        set.execute(db, args("SET", "user:tmp", "d", "PX", "5"), null);
        clock.advanceMillis(10);

        assertEquals(List.of("user:1", "user:2"), asList(keys.execute(db, args("KEYS", "user:*"), null)));
        assertEquals(List.of("order:1", "user:1", "user:2"), asList(keys.execute(db, args("KEYS", "*"), null)));
        assertEquals(List.of("user:1"), asList(keys.execute(db, args("KEYS", "user:[1]"), null)));
    }
}
