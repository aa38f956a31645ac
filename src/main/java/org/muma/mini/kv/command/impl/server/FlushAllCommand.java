package org.muma.mini.kv.command.impl.server;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.Database;
import org.muma.mini.kv.store.Keyspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class FlushAllCommand implements RedisCommand {

    private static final Logger log = LoggerFactory.getLogger(FlushAllCommand.class);

    @Override
    public RedisMessage execute(Database db, RedisArray args, RedisContext context) {
        if (args.size() != 1) return errorArgs("flushall");

        db.execute(Keyspace::clear);
        log.info("Keyspace flushed");
        return SimpleString.OK;
    }
}
