package org.muma.mini.kv.command.impl.key;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.Database;

/**
 * TTL (秒) / PTTL (毫秒)。-1 表示没有过期时间，-2 表示 Key 不存在
 */
public class TtlCommand implements RedisCommand {

    private final boolean millis;

    public TtlCommand(boolean millis) {
        this.millis = millis;
    }

    @Override
    public RedisMessage execute(Database db, RedisArray args, RedisContext context) {
        if (args.size() != 2) return errorArgs(millis ? "pttl" : "ttl");

        long remaining = db.write(ks -> ks.ttl(args.argAt(1)));
        if (remaining < 0 || millis) {
            return new RedisInteger(remaining);
        }
        // 四舍五入到秒
        return new RedisInteger((remaining + 500) / 1000);
    }
}
