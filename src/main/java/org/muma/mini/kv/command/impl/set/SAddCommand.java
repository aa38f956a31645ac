package org.muma.mini.kv.command.impl.set;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.common.SetValue;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.Database;

/**
 * SADD key member [member ...]，返回新增成员的数量
 */
public class SAddCommand implements RedisCommand {

    @Override
    public RedisMessage execute(Database db, RedisArray args, RedisContext context) {
        if (args.size() < 3) return errorArgs("sadd");

        String key = args.argAt(1);
        long added = db.write(ks -> {
            SetValue set = ks.getAs(key, SetValue.class);
            if (set == null) {
                set = new SetValue();
            }
            long count = 0;
            for (int i = 2; i < args.size(); i++) {
                count += set.add(args.argAt(i));
            }
            if (count > 0) {
                ks.update(key, set);
            }
            return count;
        });
        return new RedisInteger(added);
    }
}
