package org.muma.mini.kv.command;

import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.EventLoop;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.muma.mini.kv.command.impl.pubsub.*;
import org.muma.mini.kv.config.MiniKvConfig;
import org.muma.mini.kv.protocol.*;
import org.muma.mini.kv.pubsub.PubSubMessage;
import org.muma.mini.kv.pubsub.PubSubRegistry;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.Database;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class PubSubCommandTest {

    private Database db;
    private PubSubRegistry registry;
    private MiniKvConfig config;

    @BeforeEach
    void setUp() {
        db = new Database();
        registry = new PubSubRegistry();
        config = new MiniKvConfig();
    }

    // 辅助方法：构造参数
    private RedisArray args(String... args) {
        RedisMessage[] msgs = new RedisMessage[args.length];
        for (int i = 0; i < args.length; i++) msgs[i] = new BulkString(args[i]);
        return new RedisArray(msgs);
    }

    private List<String> flatten(Object reply) {
        RedisArray array = (RedisArray) reply;
        List<String> result = new ArrayList<>();
        for (RedisMessage m : array.elements()) {
            if (m instanceof BulkString b) result.add(b.asString());
            else if (m instanceof RedisInteger i) result.add(String.valueOf(i.value()));
            else fail("unexpected element " + m);
        }
        return result;
    }

    private RedisContext localContext() {
        return new RedisContext(null, config, registry, null, null);
    }

    /**
     * Mock 网络上下文: EventLoop 直接在当前线程执行任务
     */
    private ChannelHandlerContext mockNettyContext() {
        ChannelHandlerContext ctx = mock(ChannelHandlerContext.class);
        Channel channel = mock(Channel.class);
        EventLoop eventLoop = mock(EventLoop.class);
        when(ctx.channel()).thenReturn(channel);
        when(channel.isActive()).thenReturn(true);
        when(channel.eventLoop()).thenReturn(eventLoop);
        doAnswer(invocation -> {
            ((Runnable) invocation.getArgument(0)).run();
            return null;
        }).when(eventLoop).execute(any(Runnable.class));
        return ctx;
    }

    @Test
    void testSubscribePublishDeliversToConnection() {
        ChannelHandlerContext ctx = mockNettyContext();
        RedisContext subscriber = new RedisContext(ctx, config, registry, null, null);
        RedisContext publisher = localContext();

        assertNull(new SubscribeCommand().execute(db, args("SUBSCRIBE", "news", "weather"), subscriber));
        assertTrue(subscriber.isSubscriberMode());

        RedisMessage count = new PublishCommand().execute(db, args("PUBLISH", "news", "hello"), publisher);
        assertEquals(new RedisInteger(1), count);

        ArgumentCaptor<Object> written = ArgumentCaptor.forClass(Object.class);
        verify(ctx, times(3)).write(written.capture());
        verify(ctx, atLeastOnce()).flush();

        List<Object> replies = written.getAllValues();
        assertEquals(List.of("subscribe", "news", "1"), flatten(replies.get(0)));
        assertEquals(List.of("subscribe", "weather", "2"), flatten(replies.get(1)));
        assertEquals(List.of("message", "news", "hello"), flatten(replies.get(2)));
    }

    @Test
    void testPatternSubscription() {
        RedisContext subscriber = localContext();
        new PSubscribeCommand().execute(db, args("PSUBSCRIBE", "news.*"), subscriber);

        assertEquals(new RedisInteger(1),
                new PublishCommand().execute(db, args("PUBLISH", "news.tech", "java"), localContext()));

        List<PubSubMessage> messages = subscriber.getSubscriber().drain();
        assertEquals(List.of(
                new PubSubMessage.Subscription("psubscribe", "news.*", 1),
                new PubSubMessage.PatternMessage("news.*", "news.tech", "java")), messages);
        assertEquals(List.of("pmessage", "news.*", "news.tech", "java"),
                flatten(PubSubReplies.toReply(messages.get(1))));
    }

    @Test
    void testUnsubscribeAll() {
        RedisContext subscriber = localContext();
        new SubscribeCommand().execute(db, args("SUBSCRIBE", "a", "b"), subscriber);
        subscriber.getSubscriber().drain();

        assertNull(new UnsubscribeCommand().execute(db, args("UNSUBSCRIBE"), subscriber));
        assertFalse(subscriber.isSubscriberMode());

        List<PubSubMessage> acks = subscriber.getSubscriber().drain();
        assertEquals(2, acks.size());
        assertEquals(0, ((PubSubMessage.Subscription) acks.get(1)).count());

        // 没有任何订阅时仍然回复一条确认，频道为空
        new UnsubscribeCommand().execute(db, args("UNSUBSCRIBE"), subscriber);
        PubSubMessage.Subscription empty = (PubSubMessage.Subscription) subscriber.getSubscriber().poll();
        assertEquals(new PubSubMessage.Subscription("unsubscribe", null, 0), empty);
        RedisArray reply = (RedisArray) PubSubReplies.toReply(empty);
        assertTrue(((BulkString) reply.elements()[1]).isNull());
    }

    @Test
    void testPUnsubscribeSelected() {
        RedisContext subscriber = localContext();
        new PSubscribeCommand().execute(db, args("PSUBSCRIBE", "a*", "b*"), subscriber);
        new PUnsubscribeCommand().execute(db, args("PUNSUBSCRIBE", "a*"), subscriber);

        assertEquals(List.of("b*"), registry.patternsOf(subscriber.getSubscriber().getId()));
        assertEquals(new RedisInteger(1), new PubSubCommand().execute(db, args("PUBSUB", "NUMPAT"), localContext()));
    }

    @Test
    void testPubSubIntrospection() {
        RedisContext first = localContext();
        RedisContext second = localContext();
        new SubscribeCommand().execute(db, args("SUBSCRIBE", "news", "sports"), first);
        new SubscribeCommand().execute(db, args("SUBSCRIBE", "news"), second);

        PubSubCommand pubsub = new PubSubCommand();
        assertEquals(List.of("news", "sports"), flatten(pubsub.execute(db, args("PUBSUB", "CHANNELS"), first)));
        assertEquals(List.of("sports"), flatten(pubsub.execute(db, args("PUBSUB", "channels", "sp*"), first)));
        assertEquals(List.of("news", "2", "sports", "1", "none", "0"),
                flatten(pubsub.execute(db, args("PUBSUB", "NUMSUB", "news", "sports", "none"), first)));
        assertTrue(pubsub.execute(db, args("PUBSUB", "HELP"), first) instanceof ErrorMessage);
    }

    @Test
    void testCloseRemovesSubscriber() {
        RedisContext subscriber = localContext();
        new SubscribeCommand().execute(db, args("SUBSCRIBE", "news"), subscriber);
        subscriber.close();

        assertEquals(new RedisInteger(0),
                new PublishCommand().execute(db, args("PUBLISH", "news", "x"), localContext()));
        assertEquals(0, registry.subscriberCount());
    }

    @Test
    void testArgumentErrors() {
        assertTrue(new SubscribeCommand().execute(db, args("SUBSCRIBE"), localContext()) instanceof ErrorMessage);
        assertTrue(new PublishCommand().execute(db, args("PUBLISH", "ch"), localContext()) instanceof ErrorMessage);
    }
}
