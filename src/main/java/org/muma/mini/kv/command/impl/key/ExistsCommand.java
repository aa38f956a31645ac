package org.muma.mini.kv.command.impl.key;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.Database;

/**
 * EXISTS key [key ...]，重复的 Key 重复计数
 */
public class ExistsCommand implements RedisCommand {

    @Override
    public RedisMessage execute(Database db, RedisArray args, RedisContext context) {
        if (args.size() < 2) return errorArgs("exists");

        long count = db.write(ks -> {
            long n = 0;
            for (int i = 1; i < args.size(); i++) {
                if (ks.exists(args.argAt(i))) n++;
            }
            return n;
        });
        return new RedisInteger(count);
    }
}
