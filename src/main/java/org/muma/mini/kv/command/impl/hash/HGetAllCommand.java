package org.muma.mini.kv.command.impl.hash;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.common.HashValue;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.Database;

import java.util.Map;

/**
 * HGETALL key，返回 [field1, value1, field2, value2 ...]
 */
public class HGetAllCommand implements RedisCommand {

    @Override
    public RedisMessage execute(Database db, RedisArray args, RedisContext context) {
        if (args.size() != 2) return errorArgs("hgetall");

        HashValue hash = db.write(ks -> ks.getAs(args.argAt(1), HashValue.class));
        if (hash == null) {
            return RedisArray.EMPTY;
        }

        Map<String, String> fields = hash.toMap();
        RedisMessage[] result = new RedisMessage[fields.size() * 2];
        int i = 0;
        for (Map.Entry<String, String> entry : fields.entrySet()) {
            result[i++] = new BulkString(entry.getKey());
            result[i++] = new BulkString(entry.getValue());
        }
        return new RedisArray(result);
    }
}
