package org.muma.mini.kv.command.impl.list;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.common.ListValue;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.Database;

/**
 * LRANGE key start stop，闭区间，支持负数下标
 */
public class LRangeCommand implements RedisCommand {

    @Override
    public RedisMessage execute(Database db, RedisArray args, RedisContext context) {
        if (args.size() != 4) return errorArgs("lrange");

        Long start = parseLong(args.argAt(2));
        Long stop = parseLong(args.argAt(3));
        if (start == null || stop == null) return errorInt();

        ListValue list = db.write(ks -> ks.getAs(args.argAt(1), ListValue.class));
        if (list == null) {
            return RedisArray.EMPTY;
        }
        return RedisArray.ofStrings(list.range(start, stop));
    }
}
