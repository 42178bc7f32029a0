package org.muma.respkv.replication;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.ErrorMessage;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.protocol.RespDecoder;
import org.muma.respkv.protocol.SimpleString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Slave 端的 Netty Handler
 * 负责处理 Master 发回的握手响应和 RDB 数据。每一步收到预期回复后才发下一步。
 */
public class RedisSlaveHandler extends SimpleChannelInboundHandler<RedisMessage> {

    private static final Logger log = LoggerFactory.getLogger(RedisSlaveHandler.class);
    private final ReplicationManager manager;

    public RedisSlaveHandler(ReplicationManager manager) {
        this.manager = manager;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        manager.onMasterConnected(ctx.channel());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        manager.onMasterDisconnected();
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RedisMessage msg) {
        ReplState state = manager.getState();

        // 握手完成后 Master 传播过来的命令 (增量复制未实现)
        if (state == ReplState.CONNECTED) {
            log.debug("Dropping frame from master after handshake: {}", msg);
            return;
        }

        // 错误处理：握手期间任何错误回复都直接终止
        if (msg instanceof ErrorMessage err) {
            manager.failHandshake("Master responded error while " + state + ": " + err.content());
            return;
        }

        switch (state) {
            case RECEIVE_PONG -> {
                if (!isSimple(msg, "PONG")) {
                    unexpected(state, msg);
                    return;
                }
                log.info("Master PONG received.");
                manager.sendReplConfPort();
            }
            case SEND_PORT -> { // 等待 Port 的 OK
                if (!isSimple(msg, "OK")) {
                    unexpected(state, msg);
                    return;
                }
                manager.sendReplConfCapa();
            }
            case SEND_CAPA -> { // 等待 Capa 的 OK
                if (!isSimple(msg, "OK")) {
                    unexpected(state, msg);
                    return;
                }
                manager.sendPsync();
            }
            case RECEIVE_PSYNC -> handlePsyncReply(ctx, msg);
            case TRANSFER -> {
                // 解码器已切到快照模式，这里收到的就是 RDB 内容
                if (!(msg instanceof BulkString rdb) || rdb.isNull()) {
                    unexpected(state, msg);
                    return;
                }
                manager.handleSnapshot(rdb.content());
            }
            default -> unexpected(state, msg);
        }
    }

    // Master 回复 +FULLRESYNC <replid> <offset>
    private void handlePsyncReply(ChannelHandlerContext ctx, RedisMessage msg) {
        if (!(msg instanceof SimpleString ss) || !ss.content().startsWith("FULLRESYNC")) {
            unexpected(ReplState.RECEIVE_PSYNC, msg);
            return;
        }
        String[] parts = ss.content().split(" ");
        if (parts.length != 3) {
            unexpected(ReplState.RECEIVE_PSYNC, msg);
            return;
        }
        long offset;
        try {
            offset = Long.parseLong(parts[2]);
        } catch (NumberFormatException e) {
            unexpected(ReplState.RECEIVE_PSYNC, msg);
            return;
        }

        // 下一帧是不带 CRLF 结尾的 RDB，必须在解码器读它之前切换模式
        ctx.pipeline().get(RespDecoder.class).expectSnapshotPayload();
        manager.handleFullResync(parts[1], offset);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Replication link error: {}", cause.getMessage());
        manager.failHandshake("Replication link error: " + cause.getMessage(), cause);
    }

    private void unexpected(ReplState state, RedisMessage msg) {
        manager.failHandshake("Unexpected reply from master while " + state + ": " + msg);
    }

    private static boolean isSimple(RedisMessage msg, String expected) {
        return msg instanceof SimpleString ss && expected.equalsIgnoreCase(ss.content());
    }
}
