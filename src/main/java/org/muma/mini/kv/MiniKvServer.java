package org.muma.mini.kv;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import org.muma.mini.kv.config.MiniKvConfig;
import org.muma.mini.kv.protocol.CommandDecoder;
import org.muma.mini.kv.protocol.RespEncoder;
import org.muma.mini.kv.server.RedisServerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class MiniKvServer {

    private static final Logger log = LoggerFactory.getLogger(MiniKvServer.class);

    private final MiniKvConfig config;

    public MiniKvServer(MiniKvConfig config) {
        this.config = config;
    }

    public void start() throws InterruptedException {
        // 1. 组装模块并从快照恢复数据
        RedisServerContext serverContext = new RedisServerContext(config);
        serverContext.init();

        EventLoopGroup bossGroup = new NioEventLoopGroup(1);
        EventLoopGroup workerGroup = new NioEventLoopGroup();

        try {
            var bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    // 在 Boss 线程增加 Netty 自带的日志 Handler，可以看到 TCP 连接握手细节
                    .handler(new LoggingHandler(LogLevel.INFO))
                    // 开启 TCP_NODELAY (禁用 Nagle 算法)，降低延迟
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childOption(ChannelOption.SO_KEEPALIVE, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ch.pipeline()
                                    .addLast(new CommandDecoder())
                                    .addLast(new RespEncoder())
                                    .addLast(serverContext.newCommandHandler());
                        }
                    });

            log.info("Starting Mini-KV server on {}:{}", config.getHost(), config.getPort());
            ChannelFuture future = bootstrap.bind(config.getHost(), config.getPort()).sync();

            log.info("Mini-KV started successfully.");
            future.channel().closeFuture().sync();
        } catch (Exception e) {
            log.error("Failed to start server", e);
        } finally {
            bossGroup.shutdownGracefully();
            workerGroup.shutdownGracefully();
            serverContext.shutdown();
        }
    }

    public static void main(String[] args) throws InterruptedException {
        MiniKvConfig config = MiniKvConfig.fromArgs(args);
        log.info("Loaded configuration: {}", config);
        new MiniKvServer(config).start();
    }
}
