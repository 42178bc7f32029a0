package org.muma.respkv;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import org.muma.respkv.config.ServerConfig;
import org.muma.respkv.replication.ReplicaHandshakeException;
import org.muma.respkv.server.RedisServerContext;
import org.muma.respkv.server.RedisServerInitializer;
import org.muma.respkv.utils.ThreadUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

public class RespKvServer {

    private static final Logger log = LoggerFactory.getLogger(RespKvServer.class);

    private final ServerConfig config;
    private final RedisServerContext context;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public RespKvServer(ServerConfig config) {
        this.config = config;
        this.context = new RedisServerContext(config);
    }

    /**
     * 启动服务器 (不阻塞)
     *
     * @return 实际监听的端口 (配置为 0 时由系统分配)
     */
    public int start() throws InterruptedException, ReplicaHandshakeException {
        // 1. Slave 握手必须在监听之前完成，失败则不启动
        context.init();

        bossGroup = new NioEventLoopGroup(1, ThreadUtils.namedThreadFactory("respkv-boss"));
        workerGroup = new NioEventLoopGroup(config.getWorkerThreads(), ThreadUtils.namedThreadFactory("respkv-worker"));

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                // 在 Boss 线程增加 Netty 自带的日志 Handler，可以看到 TCP 连接建立细节
                .handler(new LoggingHandler(LogLevel.DEBUG))
                // 开启 TCP_NODELAY (禁用 Nagle 算法)，降低延迟
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new RedisServerInitializer(context.getDispatcher()));

        log.info("Starting resp-kv server on {}:{}", config.getBindHost(), config.getPort());
        serverChannel = bootstrap.bind(config.getBindHost(), config.getPort()).sync().channel();

        int boundPort = ((InetSocketAddress) serverChannel.localAddress()).getPort();
        log.info("resp-kv server started successfully on port {}", boundPort);
        return boundPort;
    }

    public void awaitTermination() throws InterruptedException {
        serverChannel.closeFuture().sync();
    }

    public void stop() {
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        context.shutdown();
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }
        log.info("resp-kv server stopped.");
    }

    public RedisServerContext getContext() {
        return context;
    }

    public static void main(String[] args) throws InterruptedException {
        // 1. 初始化配置并解析参数
        ServerConfig config = ServerConfig.load(args);
        RespKvServer server = new RespKvServer(config);
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "respkv-shutdown"));

        try {
            server.start();
        } catch (ReplicaHandshakeException e) {
            log.error("Replica handshake failed, server will not start: {}", e.getMessage());
            System.exit(1);
            return;
        }
        server.awaitTermination();
    }
}
