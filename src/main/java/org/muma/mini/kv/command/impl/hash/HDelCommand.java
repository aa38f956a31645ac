package org.muma.mini.kv.command.impl.hash;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.common.HashValue;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.Database;

/**
 * HDEL key field [field ...]，字段全部删除后 Key 也被删除
 */
public class HDelCommand implements RedisCommand {

    @Override
    public RedisMessage execute(Database db, RedisArray args, RedisContext context) {
        if (args.size() < 3) return errorArgs("hdel");

        String key = args.argAt(1);
        long removed = db.write(ks -> {
            HashValue hash = ks.getAs(key, HashValue.class);
            if (hash == null) return 0L;
            long count = 0;
            for (int i = 2; i < args.size(); i++) {
                count += hash.remove(args.argAt(i));
            }
            if (hash.isEmpty()) {
                ks.delete(key);
            } else if (count > 0) {
                ks.update(key, hash);
            }
            return count;
        });
        return new RedisInteger(removed);
    }
}
