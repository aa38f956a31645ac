package org.muma.mini.kv.command.impl.server;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.Database;
import org.muma.mini.kv.store.KeyspaceView;

import java.util.Map;

/**
 * MEMORY: 内存估算与淘汰策略，每行一个 field:value
 */
public class MemoryCommand implements RedisCommand {

    @Override
    public RedisMessage execute(Database db, RedisArray args, RedisContext context) {
        Map<String, String> info = db.read(KeyspaceView::memoryInfo);
        StringBuilder sb = new StringBuilder();
        info.forEach((k, v) -> sb.append(k).append(':').append(v).append("\r\n"));
        return new BulkString(sb.toString());
    }
}
