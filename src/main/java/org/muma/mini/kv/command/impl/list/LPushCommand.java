package org.muma.mini.kv.command.impl.list;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.common.ListValue;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.Database;

/**
 * LPUSH key element [element ...]
 * 从左侧 (头部) 依次插入，最后一个参数位于列表最前面，返回插入后的长度
 */
public class LPushCommand implements RedisCommand {

    @Override
    public RedisMessage execute(Database db, RedisArray args, RedisContext context) {
        if (args.size() < 3) return errorArgs("lpush");

        String key = args.argAt(1);
        long length = db.write(ks -> {
            ListValue list = ks.getAs(key, ListValue.class);
            if (list == null) {
                list = new ListValue();
            }
            for (int i = 2; i < args.size(); i++) {
                list.lpush(args.argAt(i));
            }
            ks.update(key, list);
            return (long) list.size();
        });
        return new RedisInteger(length);
    }
}
