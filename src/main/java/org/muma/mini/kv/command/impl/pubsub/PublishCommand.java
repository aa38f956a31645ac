package org.muma.mini.kv.command.impl.pubsub;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.Database;

/**
 * PUBLISH channel message，返回成功投递的数量
 */
public class PublishCommand implements RedisCommand {

    @Override
    public RedisMessage execute(Database db, RedisArray args, RedisContext context) {
        if (args.size() != 3) return errorArgs("publish");
        return new RedisInteger(context.getPubSub().publish(args.argAt(1), args.argAt(2)));
    }
}
