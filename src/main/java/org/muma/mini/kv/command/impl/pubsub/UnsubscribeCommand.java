package org.muma.mini.kv.command.impl.pubsub;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.pubsub.PubSubMessage;
import org.muma.mini.kv.pubsub.PubSubRegistry;
import org.muma.mini.kv.pubsub.SubscriberQueue;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.Database;

import java.util.ArrayList;
import java.util.List;

/**
 * UNSUBSCRIBE [channel ...]，不带参数时退订全部
 */
public class UnsubscribeCommand implements RedisCommand {

    @Override
    public RedisMessage execute(Database db, RedisArray args, RedisContext context) {
        PubSubRegistry registry = context.getPubSub();
        SubscriberQueue subscriber = context.getOrCreateSubscriber();

        List<String> targets = new ArrayList<>();
        for (int i = 1; i < args.size(); i++) {
            targets.add(args.argAt(i));
        }
        if (targets.isEmpty()) {
            targets = registry.channelsOf(subscriber.getId());
        }

        if (targets.isEmpty()) {
            subscriber.offer(new PubSubMessage.Subscription("unsubscribe", null,
                    registry.subscriptionCount(subscriber.getId())));
            return null;
        }
        for (String channel : targets) {
            registry.unsubscribe(subscriber.getId(), channel);
        }
        return null;
    }
}
