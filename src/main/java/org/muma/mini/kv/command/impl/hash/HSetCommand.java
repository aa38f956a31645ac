package org.muma.mini.kv.command.impl.hash;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.common.HashValue;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.Database;

/**
 * HSET key field value [field value ...]，返回新增字段的数量
 */
public class HSetCommand implements RedisCommand {

    @Override
    public RedisMessage execute(Database db, RedisArray args, RedisContext context) {
        // 参数必须成对出现
        if (args.size() < 4 || args.size() % 2 != 0) return errorArgs("hset");

        String key = args.argAt(1);
        long added = db.write(ks -> {
            HashValue hash = ks.getAs(key, HashValue.class);
            if (hash == null) {
                hash = new HashValue();
            }
            long count = 0;
            for (int i = 2; i < args.size(); i += 2) {
                count += hash.put(args.argAt(i), args.argAt(i + 1));
            }
            ks.update(key, hash);
            return count;
        });
        return new RedisInteger(added);
    }
}
