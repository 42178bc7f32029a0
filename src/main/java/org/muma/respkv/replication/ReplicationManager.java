package org.muma.respkv.replication;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import lombok.Getter;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.protocol.RespDecoder;
import org.muma.respkv.protocol.RespEncoder;
import org.muma.respkv.rdb.EmptyRdb;
import org.muma.respkv.utils.ThreadUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 复制管理器 (Slave 角色)
 * <p>
 * 启动时在开始监听之前执行一次握手：PING -> REPLCONF listening-port -> REPLCONF capa psync2 -> PSYNC ? -1。
 * 严格按顺序，每步收到预期回复才发下一步，任何一步失败整个握手失败，不重试。
 */
public class ReplicationManager {

    private static final Logger log = LoggerFactory.getLogger(ReplicationManager.class);

    private final ReplicationMetadata metadata;
    private final int listeningPort;
    private final int connectTimeoutMs;
    private final long handshakeTimeoutMs;

    private final CompletableFuture<Void> handshakeFuture = new CompletableFuture<>();

    @Getter
    private volatile ReplState state = ReplState.NONE;

    // 全量同步时 Master 告知的复制 ID 与偏移量
    @Getter
    private volatile String masterReplId;
    @Getter
    private volatile long masterReplOffset = -1;

    private volatile Channel masterChannel;
    private EventLoopGroup group;

    public ReplicationManager(ReplicationMetadata metadata, int listeningPort, int connectTimeoutMs, long handshakeTimeoutMs) {
        this.metadata = metadata;
        this.listeningPort = listeningPort;
        this.connectTimeoutMs = connectTimeoutMs;
        this.handshakeTimeoutMs = handshakeTimeoutMs;
    }

    /**
     * 连接 Master 并完成握手，阻塞直到成功或失败
     */
    public void handshake() throws ReplicaHandshakeException, InterruptedException {
        if (!metadata.isSlave()) {
            throw new IllegalStateException("Server is not configured as a replica");
        }
        String host = metadata.getMasterHost();
        int port = metadata.getMasterPort();
        log.info("Starting replication handshake with master {}:{}", host, port);

        state = ReplState.CONNECTING;
        group = new NioEventLoopGroup(1, ThreadUtils.daemonThreadFactory("respkv-replica"));

        Bootstrap b = new Bootstrap();
        b.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline()
                                .addLast(new RespDecoder())
                                .addLast(new RespEncoder())
                                .addLast(new RedisSlaveHandler(ReplicationManager.this));
                    }
                });

        ChannelFuture connectFuture = b.connect(host, port).await();
        if (!connectFuture.isSuccess()) {
            failHandshake("Failed to connect to master " + host + ":" + port, connectFuture.cause());
        }

        try {
            handshakeFuture.get(handshakeTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            shutdown();
            Throwable cause = e.getCause();
            if (cause instanceof ReplicaHandshakeException rhe) {
                throw rhe;
            }
            throw new ReplicaHandshakeException("Replication handshake failed", cause);
        } catch (TimeoutException e) {
            failHandshake("Replication handshake timed out after " + handshakeTimeoutMs + "ms while " + state);
            shutdown();
            throw new ReplicaHandshakeException("Replication handshake timed out after " + handshakeTimeoutMs + "ms");
        }
        log.info("Replication handshake completed. Master replid: {}, offset: {}", masterReplId, masterReplOffset);
    }

    public void shutdown() {
        Channel ch = masterChannel;
        if (ch != null) {
            ch.close();
        }
        if (group != null) {
            group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
        }
    }

    CompletableFuture<Void> handshakeFuture() {
        return handshakeFuture;
    }

    // --- Callbacks for Handler ---

    void onMasterConnected(Channel channel) {
        log.info("Connected to master {}", channel.remoteAddress());
        this.masterChannel = channel;
        sendPing();
    }

    void onMasterDisconnected() {
        if (state == ReplState.CONNECTED) {
            log.warn("Connection to master closed");
        } else {
            failHandshake("Master closed the connection while " + state);
        }
    }

    // --- State Actions ---

    void sendPing() {
        state = ReplState.RECEIVE_PONG;
        writeToMaster(RedisArray.ofBulk("PING"));
    }

    void sendReplConfPort() {
        state = ReplState.SEND_PORT;
        writeToMaster(RedisArray.ofBulk("REPLCONF", "listening-port", String.valueOf(listeningPort)));
    }

    void sendReplConfCapa() {
        state = ReplState.SEND_CAPA;
        writeToMaster(RedisArray.ofBulk("REPLCONF", "capa", "psync2"));
    }

    void sendPsync() {
        state = ReplState.RECEIVE_PSYNC;
        writeToMaster(RedisArray.ofBulk("PSYNC", "?", "-1"));
    }

    void handleFullResync(String replId, long offset) {
        log.info("Full resync triggered. Master replid: {}, offset: {}", replId, offset);
        this.masterReplId = replId;
        this.masterReplOffset = offset;
        state = ReplState.TRANSFER;
    }

    void handleSnapshot(byte[] rdb) {
        // 快照内容本身不解析也不加载
        if (!EmptyRdb.hasRdbHeader(rdb)) {
            log.warn("Snapshot from master does not start with an RDB header ({} bytes)", rdb.length);
        }
        log.info("Received snapshot from master: {} bytes", rdb.length);
        state = ReplState.CONNECTED;
        handshakeFuture.complete(null);
    }

    void failHandshake(String reason) {
        failHandshake(reason, null);
    }

    void failHandshake(String reason, Throwable cause) {
        if (!handshakeFuture.isDone()) {
            state = ReplState.FAILED;
            log.error("Replication handshake failed: {}", reason);
            handshakeFuture.completeExceptionally(new ReplicaHandshakeException(reason, cause));
        }
        Channel ch = masterChannel;
        if (ch != null) {
            ch.close();
        }
    }

    private void writeToMaster(RedisMessage msg) {
        Channel ch = masterChannel;
        if (ch == null || !ch.isActive()) {
            failHandshake("Connection to master is not active");
            return;
        }
        ch.writeAndFlush(msg).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                failHandshake("Failed to write to master: " + msg, future.cause());
            }
        });
    }
}
