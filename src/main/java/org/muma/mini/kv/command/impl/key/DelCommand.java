package org.muma.mini.kv.command.impl.key;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.Database;

/**
 * DEL key [key ...]，返回实际删除的数量
 */
public class DelCommand implements RedisCommand {

    @Override
    public RedisMessage execute(Database db, RedisArray args, RedisContext context) {
        if (args.size() < 2) return errorArgs("del");

        long deleted = db.write(ks -> {
            long count = 0;
            for (int i = 1; i < args.size(); i++) {
                String key = args.argAt(i);
                // 已过期但尚未清理的 Key 不计数
                if (ks.exists(key) && ks.delete(key)) {
                    count++;
                }
            }
            return count;
        });
        return new RedisInteger(deleted);
    }
}
