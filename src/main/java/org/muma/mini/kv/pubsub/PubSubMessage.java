package org.muma.mini.kv.pubsub;

/**
 * 投递到订阅者队列中的消息。订阅确认也走同一个队列，保证顺序
 */
public sealed interface PubSubMessage {

    /**
     * 精确频道匹配: ["message", channel, payload]
     */
    record Message(String channel, String payload) implements PubSubMessage {
    }

    /**
     * 模式匹配: ["pmessage", pattern, channel, payload]
     */
    record PatternMessage(String pattern, String channel, String payload) implements PubSubMessage {
    }

    /**
     * 订阅/退订确认: [kind, name, count]，kind 为 subscribe / unsubscribe / psubscribe / punsubscribe
     */
    record Subscription(String kind, String name, long count) implements PubSubMessage {
    }
}
