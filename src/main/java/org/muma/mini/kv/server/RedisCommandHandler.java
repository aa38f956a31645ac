package org.muma.mini.kv.server;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import org.muma.mini.kv.command.CommandDispatcher;
import org.muma.mini.kv.config.MiniKvConfig;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.pubsub.PubSubRegistry;
import org.muma.mini.kv.snapshot.SnapshotManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Set;

/**
 * 每个连接一个实例: 认证检查、订阅模式限制、QUIT，其余交给 CommandDispatcher
 */
public class RedisCommandHandler extends SimpleChannelInboundHandler<RedisMessage> {

    private static final Logger log = LoggerFactory.getLogger(RedisCommandHandler.class);

    // 未认证时允许执行的命令
    private static final Set<String> NO_AUTH_COMMANDS = Set.of("AUTH", "QUIT", "PING");
    // 订阅模式下允许执行的命令
    private static final Set<String> SUBSCRIBER_COMMANDS =
            Set.of("SUBSCRIBE", "UNSUBSCRIBE", "PSUBSCRIBE", "PUNSUBSCRIBE", "PING", "QUIT");

    private final CommandDispatcher dispatcher;
    private final MiniKvConfig config;
    private final PubSubRegistry pubSub;
    private final SnapshotManager snapshotManager;
    private final ServerStats stats;

    private RedisContext context;

    public RedisCommandHandler(CommandDispatcher dispatcher, MiniKvConfig config, PubSubRegistry pubSub,
                               SnapshotManager snapshotManager, ServerStats stats) {
        this.dispatcher = dispatcher;
        this.config = config;
        this.pubSub = pubSub;
        this.snapshotManager = snapshotManager;
        this.stats = stats;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        context = new RedisContext(ctx, config, pubSub, snapshotManager, stats);
        int clients = stats.clientConnected();
        log.info("Client connected: {}, total clients: {}", ctx.channel().remoteAddress(), clients);
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (context != null) {
            context.close();
        }
        int clients = stats.clientDisconnected();
        log.info("Client disconnected: {}, total clients: {}", ctx.channel().remoteAddress(), clients);
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RedisMessage msg) {
        if (msg instanceof RedisArray array) {
            handleCommand(ctx, array);
        } else if (msg instanceof ErrorMessage error) {
            // 解码阶段发现的协议错误
            ctx.writeAndFlush(error);
        } else {
            log.warn("Received non-array message: {}", msg);
            ctx.writeAndFlush(new ErrorMessage("ERR Protocol error: expected array"));
        }
    }

    private void handleCommand(ChannelHandlerContext ctx, RedisArray array) {
        if (array.size() == 0) return;

        String rawName = array.argAt(0);
        if (rawName == null) {
            ctx.writeAndFlush(new ErrorMessage("ERR Protocol error: command name must be string"));
            return;
        }
        String commandName = rawName.toUpperCase(Locale.ROOT);
        stats.commandProcessed();

        if (log.isDebugEnabled()) {
            log.debug("Execute Command: {} argc={} from {}", commandName, array.size() - 1, ctx.channel().remoteAddress());
        }

        if (!context.isAuthenticated() && !NO_AUTH_COMMANDS.contains(commandName)) {
            ctx.writeAndFlush(new ErrorMessage("NOAUTH Authentication required."));
            return;
        }

        if (context.isSubscriberMode() && !SUBSCRIBER_COMMANDS.contains(commandName)) {
            ctx.writeAndFlush(new ErrorMessage("ERR Can't execute '" + rawName.toLowerCase(Locale.ROOT)
                    + "': only (P)SUBSCRIBE / (P)UNSUBSCRIBE / PING / QUIT are allowed in this context"));
            return;
        }

        if ("QUIT".equals(commandName)) {
            ctx.writeAndFlush(SimpleString.OK).addListener(ChannelFutureListener.CLOSE);
            return;
        }

        RedisMessage response = dispatcher.dispatch(commandName, array, context);
        if (response != null) {
            ctx.writeAndFlush(response);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("Closing connection {} after error: {}", ctx.channel().remoteAddress(), cause.getMessage());
        ctx.writeAndFlush(new ErrorMessage("ERR " + cause.getMessage()))
                .addListener(ChannelFutureListener.CLOSE);
    }
}
