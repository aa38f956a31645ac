package org.muma.mini.kv.command.impl.pubsub;

import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.pubsub.PubSubMessage;

/**
 * 订阅队列中的消息 -> RESP 数组
 */
public final class PubSubReplies {

    private PubSubReplies() {
    }

    public static RedisMessage toReply(PubSubMessage message) {
        if (message instanceof PubSubMessage.Message m) {
            return RedisArray.of(new BulkString("message"), new BulkString(m.channel()), new BulkString(m.payload()));
        }
        if (message instanceof PubSubMessage.PatternMessage p) {
            return RedisArray.of(new BulkString("pmessage"), new BulkString(p.pattern()),
                    new BulkString(p.channel()), new BulkString(p.payload()));
        }
        PubSubMessage.Subscription s = (PubSubMessage.Subscription) message;
        return RedisArray.of(new BulkString(s.kind()), new BulkString(s.name()), new RedisInteger(s.count()));
    }
}
