package org.muma.mini.kv.server;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.mini.kv.command.CommandDispatcher;
import org.muma.mini.kv.config.MiniKvConfig;
import org.muma.mini.kv.protocol.CommandDecoder;
import org.muma.mini.kv.protocol.RespEncoder;
import org.muma.mini.kv.pubsub.PubSubRegistry;
import org.muma.mini.kv.store.Database;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class RedisCommandHandlerTest {

    private MiniKvConfig config;
    private CommandDispatcher dispatcher;
    private PubSubRegistry pubSub;
    private ServerStats stats;

    @BeforeEach
    void setUp() {
        config = new MiniKvConfig();
        dispatcher = new CommandDispatcher(new Database());
        pubSub = new PubSubRegistry();
        stats = new ServerStats();
    }

    private EmbeddedChannel newClient() {
        return new EmbeddedChannel(
                new CommandDecoder(),
                new RespEncoder(),
                new RedisCommandHandler(dispatcher, config, pubSub, null, stats));
    }

    private String send(EmbeddedChannel channel, String line) {
        channel.writeInbound(Unpooled.copiedBuffer(line + "\r\n", StandardCharsets.UTF_8));
        return output(channel);
    }

    // 读出所有已写出的字节
    private String output(EmbeddedChannel channel) {
        channel.runPendingTasks();
        StringBuilder sb = new StringBuilder();
        ByteBuf buf;
        while ((buf = channel.readOutbound()) != null) {
            sb.append(buf.toString(StandardCharsets.UTF_8));
            buf.release();
        }
        return sb.toString();
    }

    @Test
    void testInlineAndRespCommands() {
        EmbeddedChannel client = newClient();

        assertEquals("+PONG\r\n", send(client, "PING"));
        assertEquals("+OK\r\n", send(client, "SET greeting \"hello world\""));
        assertEquals("$11\r\nhello world\r\n", send(client, "GET greeting"));

        client.writeInbound(Unpooled.copiedBuffer("*2\r\n$6\r\nEXISTS\r\n$8\r\ngreeting\r\n", StandardCharsets.UTF_8));
        assertEquals(":1\r\n", output(client));

        assertEquals("-ERR unknown command 'NOPE'\r\n", send(client, "NOPE"));
        assertEquals("-ERR Protocol error: unbalanced quotes in request\r\n", send(client, "SET k \"open"));
        assertEquals("", send(client, ""));
        assertEquals(5, stats.getTotalCommands());
    }

    @Test
    void testAuthenticationGate() {
        config.setRequirePass("secret");
        EmbeddedChannel client = newClient();

        assertEquals("-NOAUTH Authentication required.\r\n", send(client, "GET k"));
        assertEquals("+PONG\r\n", send(client, "PING"));
        assertEquals("-ERR invalid password\r\n", send(client, "AUTH wrong"));
        assertEquals("+OK\r\n", send(client, "AUTH secret"));
        assertEquals("$-1\r\n", send(client, "GET k"));
    }

    @Test
    void testSubscriberModeAndDelivery() {
        EmbeddedChannel subscriber = newClient();
        EmbeddedChannel publisher = newClient();

        assertEquals("*3\r\n$9\r\nsubscribe\r\n$4\r\nnews\r\n:1\r\n", send(subscriber, "SUBSCRIBE news"));

        String rejected = send(subscriber, "GET k");
        assertTrue(rejected.startsWith("-ERR Can't execute 'get'"), rejected);
        assertEquals("+PONG\r\n", send(subscriber, "PING"));

        assertEquals(":1\r\n", send(publisher, "PUBLISH news hello"));
        assertEquals("*3\r\n$7\r\nmessage\r\n$4\r\nnews\r\n$5\r\nhello\r\n", output(subscriber));

        assertEquals("*3\r\n$11\r\nunsubscribe\r\n$4\r\nnews\r\n:0\r\n", send(subscriber, "UNSUBSCRIBE"));
        // 退出订阅模式后可以执行普通命令
        assertEquals("$-1\r\n", send(subscriber, "GET k"));
    }

    @Test
    void testDisconnectRemovesSubscriptions() {
        EmbeddedChannel subscriber = newClient();
        EmbeddedChannel publisher = newClient();
        send(subscriber, "PSUBSCRIBE news.*");
        assertEquals(2, stats.getConnectedClients());

        subscriber.close();

        assertEquals(1, stats.getConnectedClients());
        assertEquals(0, pubSub.subscriberCount());
        assertEquals(":0\r\n", send(publisher, "PUBLISH news.tech x"));
    }

    @Test
    void testQuitClosesConnection() {
        EmbeddedChannel client = newClient();
        assertEquals("+OK\r\n", send(client, "QUIT"));
        assertFalse(client.isOpen());
    }

    @Test
    void testProtocolErrorClosesConnection() {
        EmbeddedChannel client = newClient();
        client.writeInbound(Unpooled.copiedBuffer("*1\r\n:", StandardCharsets.UTF_8));
        assertTrue(output(client).startsWith("-ERR "));
        assertFalse(client.isOpen());
    }
}
