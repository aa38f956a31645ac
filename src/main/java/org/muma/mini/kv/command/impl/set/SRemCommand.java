package org.muma.mini.kv.command.impl.set;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.common.SetValue;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.Database;

public class SRemCommand implements RedisCommand {

    @Override
    public RedisMessage execute(Database db, RedisArray args, RedisContext context) {
        if (args.size() < 3) return errorArgs("srem");

        String key = args.argAt(1);
        long removed = db.write(ks -> {
            SetValue set = ks.getAs(key, SetValue.class);
            if (set == null) return 0L;
            long count = 0;
            for (int i = 2; i < args.size(); i++) {
                count += set.remove(args.argAt(i));
            }
            if (set.isEmpty()) {
                ks.delete(key);
            } else if (count > 0) {
                ks.update(key, set);
            }
            return count;
        });
        return new RedisInteger(removed);
    }
}
