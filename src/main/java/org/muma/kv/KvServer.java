package org.muma.kv;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import org.muma.kv.command.CommandDispatcher;
import org.muma.kv.config.KvServerConfig;
import org.muma.kv.protocol.RespDecoder;
import org.muma.kv.protocol.RespEncoder;
import org.muma.kv.server.RedisCommandHandler;
import org.muma.kv.store.StorageEngine;
import org.muma.kv.store.impl.MemoryStorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Random;

public class KvServer {

    private static final Logger log = LoggerFactory.getLogger(KvServer.class);

    private final KvServerConfig config;
    private final StorageEngine storage;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public KvServer(KvServerConfig config) {
        this(config, createStorage(config));
    }

    public KvServer(KvServerConfig config, StorageEngine storage) {
        this.config = config;
        this.storage = storage;
    }

    static StorageEngine createStorage(KvServerConfig config) {
        Random random = config.getSkiplistSeed() != null ? new Random(config.getSkiplistSeed()) : new Random();
        return new MemoryStorageEngine(Clock.systemUTC(), random);
    }

    /**
     * Binds the listening socket. Returns once the port is open.
     */
    public Channel start() throws InterruptedException {
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(config.getWorkerThreads());

        CommandDispatcher dispatcher = new CommandDispatcher(storage, config.getSlowLogThresholdMillis());

        var bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .handler(new LoggingHandler(LogLevel.INFO))
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline()
                                .addLast(new RespDecoder())
                                .addLast(new RespEncoder())
                                .addLast(new RedisCommandHandler(dispatcher));
                    }
                });

        log.info("Starting KV server on port {}", config.getPort());
        try {
            ChannelFuture future = bootstrap.bind(config.getPort()).sync();
            serverChannel = future.channel();
        } catch (InterruptedException | RuntimeException e) {
            stop();
            throw e;
        }
        log.info("KV server started successfully on {}", serverChannel.localAddress());
        return serverChannel;
    }

    public void stop() {
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }
        log.info("KV server stopped.");
    }

    public static void main(String[] args) throws InterruptedException {
        KvServerConfig config = KvServerConfig.getInstance();
        config.load(args);

        KvServer server = new KvServer(config);
        Channel channel;
        try {
            channel = server.start();
        } catch (Exception e) {
            log.error("Failed to start server", e);
            System.exit(1);
            return;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "kv-shutdown"));
        channel.closeFuture().sync();
    }
}
