package org.muma.mini.kv.command.impl.string;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.common.IntegerValue;
import org.muma.mini.kv.common.RedisValue;
import org.muma.mini.kv.common.StringValue;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.Database;
import org.muma.mini.kv.store.WrongTypeException;

public class GetCommand implements RedisCommand {

    @Override
    public RedisMessage execute(Database db, RedisArray args, RedisContext context) {
        if (args.size() != 2) return errorArgs("get");

        String key = args.argAt(1);
        // 惰性删除可能修改数据，走写锁
        RedisValue value = db.write(ks -> ks.get(key));
        if (value == null) {
            return BulkString.NULL;
        }

        return switch (value.type()) {
            case STRING -> new BulkString(((StringValue) value).value());
            case INTEGER -> new BulkString(String.valueOf(((IntegerValue) value).value()));
            default -> throw new WrongTypeException(key, value.type());
        };
    }
}
