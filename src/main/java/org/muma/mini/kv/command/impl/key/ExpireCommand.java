package org.muma.mini.kv.command.impl.key;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.Database;

import java.time.Duration;

/**
 * EXPIRE key seconds。seconds <= 0 时直接删除
 */
public class ExpireCommand implements RedisCommand {

    @Override
    public RedisMessage execute(Database db, RedisArray args, RedisContext context) {
        if (args.size() != 3) return errorArgs("expire");

        String key = args.argAt(1);
        Long seconds = parseLong(args.argAt(2));
        if (seconds == null) return errorInt();
        Duration ttl = seconds > 0 ? toTtl(seconds, true) : Duration.ZERO;
        if (ttl == null) return errorExpire("expire");

        boolean applied = db.write(ks -> {
            if (seconds <= 0) {
                return ks.exists(key) && ks.delete(key);
            }
            return ks.expire(key, ttl);
        });
        return RedisInteger.of(applied);
    }
}
