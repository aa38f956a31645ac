package org.muma.mini.kv.command;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.mini.kv.memory.EvictionPolicy;
import org.muma.mini.kv.memory.MemoryManager;
import org.muma.mini.kv.protocol.*;
import org.muma.mini.kv.store.Database;
import org.muma.mini.kv.store.Keyspace;
import org.muma.mini.kv.store.WrongTypeException;

import static org.junit.jupiter.api.Assertions.*;

class CommandDispatcherTest {

    private CommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new CommandDispatcher(new Database());
    }

    private RedisArray args(String... args) {
        RedisMessage[] msgs = new RedisMessage[args.length];
        for (int i = 0; i < args.length; i++) {
            msgs[i] = new BulkString(args[i]);
        }
        return new RedisArray(msgs);
    }

    private RedisMessage run(CommandDispatcher d, String... argv) {
        return d.dispatch(argv[0], args(argv), null);
    }

    @Test
    void testCaseInsensitiveLookup() {
        assertEquals(SimpleString.OK, run(dispatcher, "set", "k", "v"));
        assertEquals("v", ((BulkString) run(dispatcher, "GeT", "k")).asString());
        assertTrue(dispatcher.isRegistered("hgetall"));
        assertTrue(dispatcher.isRegistered("VERIFY"));
        assertTrue(dispatcher.isRegistered("recover"));
        assertFalse(dispatcher.isRegistered("ZADD"));
    }

    @Test
    void testUnknownCommand() {
        assertEquals(new ErrorMessage("ERR unknown command 'FOO'"), run(dispatcher, "FOO", "bar"));
    }

    @Test
    void testWrongTypeMapped() {
        run(dispatcher, "LPUSH", "l", "a");
        assertEquals(new ErrorMessage(WrongTypeException.MESSAGE), run(dispatcher, "GET", "l"));
        assertEquals(new ErrorMessage(WrongTypeException.MESSAGE), run(dispatcher, "HSET", "l", "f", "v"));
    }

    @Test
    void testClientErrorMapped() {
        run(dispatcher, "SET", "s", "abc");
        assertEquals(new ErrorMessage("ERR value is not an integer or out of range"), run(dispatcher, "INCR", "s"));
    }

    @Test
    void testOutOfMemoryMapped() {
        Keyspace keyspace = new Keyspace(new MemoryManager(1200, EvictionPolicy.NO_EVICTION));
        CommandDispatcher bounded = new CommandDispatcher(new Database(keyspace));

        assertEquals(SimpleString.OK, run(bounded, "SET", "a", "1"));
        RedisMessage rejected = run(bounded, "SET", "big", "x".repeat(500));
        assertEquals(new ErrorMessage(CommandDispatcher.OOM_MESSAGE), rejected);
        assertEquals(new RedisInteger(1), run(bounded, "DBSIZE"));
        assertEquals(new RedisInteger(0), run(bounded, "EXISTS", "big"));
    }
}
