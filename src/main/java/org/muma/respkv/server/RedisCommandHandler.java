package org.muma.respkv.server;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import org.muma.respkv.command.CommandDispatcher;
import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.ErrorMessage;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisInteger;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.protocol.RespProtocolException;
import org.muma.respkv.protocol.SimpleString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * 单个客户端连接的会话：解码出的每个请求帧 -> 分发 -> 写回复。
 * 每个连接一个实例，所有实例共享同一个 Dispatcher (也就共享同一个 Store)。
 */
public class RedisCommandHandler extends SimpleChannelInboundHandler<RedisMessage> {

    private static final Logger log = LoggerFactory.getLogger(RedisCommandHandler.class);

    // 当前连接的客户端数量
    private static final AtomicInteger connectedClients = new AtomicInteger();

    private final CommandDispatcher dispatcher;

    public RedisCommandHandler(CommandDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        log.info("Client connected: {}, total clients: {}", ctx.channel().remoteAddress(), connectedClients.incrementAndGet());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        log.info("Client disconnected: {}, total clients: {}", ctx.channel().remoteAddress(), connectedClients.decrementAndGet());
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RedisMessage msg) {
        if (msg instanceof RedisArray array) {
            handleCommand(ctx, array);
        } else {
            log.warn("Received non-array message: {}", msg);
            ctx.writeAndFlush(new ErrorMessage("ERR protocol error: expected array"));
        }
    }

    private void handleCommand(ChannelHandlerContext ctx, RedisArray array) {
        RedisMessage[] elements = array.elements();
        if (elements.length == 0) {
            ctx.writeAndFlush(new ErrorMessage("ERR protocol error: empty command"));
            return;
        }

        if (!(elements[0] instanceof BulkString cmdNameBulk) || cmdNameBulk.isNull()) {
            ctx.writeAndFlush(new ErrorMessage("ERR protocol error: command name must be string"));
            return;
        }

        String commandName = cmdNameBulk.asString();
        if (log.isDebugEnabled()) {
            String argsLog = Arrays.stream(elements).skip(1).map(this::convertToString).collect(Collectors.joining(", "));
            log.debug("Execute Command: {} args=[{}]", commandName, argsLog);
        }

        RedisMessage response = dispatcher.dispatch(commandName, array, ctx);
        if (response != null) {
            ctx.writeAndFlush(response);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        // 解码错误说明流已经错位，I/O 错误说明连接已坏，两种都只能关掉当前连接
        if (cause instanceof RespProtocolException) {
            log.error("Protocol error from {}, closing connection: {}", ctx.channel().remoteAddress(), cause.getMessage());
        } else {
            log.error("Connection error from {}, closing connection", ctx.channel().remoteAddress(), cause);
        }
        ctx.close();
    }

    private String convertToString(RedisMessage msg) {
        if (msg instanceof BulkString b) return b.asString();
        if (msg instanceof SimpleString s) return s.content();
        if (msg instanceof RedisInteger i) return String.valueOf(i.value());
        return "<?>";
    }
}
