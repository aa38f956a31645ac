package org.muma.mini.kv.command.impl.list;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.common.ListValue;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.Database;

public class RPopCommand implements RedisCommand {

    @Override
    public RedisMessage execute(Database db, RedisArray args, RedisContext context) {
        if (args.size() != 2) return errorArgs("rpop");

        String key = args.argAt(1);
        String element = db.write(ks -> {
            ListValue list = ks.getAs(key, ListValue.class);
            if (list == null) return null;
            String popped = list.rpop();
            // 列表为空时删除 Key
            if (list.isEmpty()) {
                ks.delete(key);
            } else {
                ks.update(key, list);
            }
            return popped;
        });
        return new BulkString(element);
    }
}
