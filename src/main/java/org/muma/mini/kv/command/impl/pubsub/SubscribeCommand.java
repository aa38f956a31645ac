package org.muma.mini.kv.command.impl.pubsub;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.pubsub.PubSubRegistry;
import org.muma.mini.kv.pubsub.SubscriberQueue;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.Database;

/**
 * SUBSCRIBE channel [channel ...]
 * 确认消息 ["subscribe", channel, count] 经由订阅队列发出，这里不直接回复
 */
public class SubscribeCommand implements RedisCommand {

    @Override
    public RedisMessage execute(Database db, RedisArray args, RedisContext context) {
        if (args.size() < 2) return errorArgs("subscribe");

        PubSubRegistry registry = context.getPubSub();
        SubscriberQueue subscriber = context.getOrCreateSubscriber();
        for (int i = 1; i < args.size(); i++) {
            registry.subscribe(subscriber.getId(), args.argAt(i));
        }
        return null;
    }
}
