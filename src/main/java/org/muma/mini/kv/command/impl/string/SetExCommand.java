package org.muma.mini.kv.command.impl.string;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.common.StringValue;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.Database;

import java.time.Duration;

/**
 * SETEX key seconds value
 */
public class SetExCommand implements RedisCommand {

    @Override
    public RedisMessage execute(Database db, RedisArray args, RedisContext context) {
        if (args.size() != 4) return errorArgs("setex");

        String key = args.argAt(1);
        Long seconds = parseLong(args.argAt(2));
        if (seconds == null) return errorInt();
        Duration ttl = seconds > 0 ? toTtl(seconds, true) : null;
        if (ttl == null) return errorExpire("setex");

        StringValue value = new StringValue(args.argAt(3));
        db.execute(ks -> ks.setWithExpiry(key, value, ttl));
        return SimpleString.OK;
    }
}
