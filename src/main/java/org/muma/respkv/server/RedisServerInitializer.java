package org.muma.respkv.server;

import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import org.muma.respkv.command.CommandDispatcher;
import org.muma.respkv.protocol.RdbPayloadEncoder;
import org.muma.respkv.protocol.RespDecoder;
import org.muma.respkv.protocol.RespEncoder;

/**
 * 每个新连接的 pipeline: 解码 -> (编码) -> 会话处理
 */
public class RedisServerInitializer extends ChannelInitializer<Channel> {

    private final CommandDispatcher dispatcher;

    public RedisServerInitializer(CommandDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    protected void initChannel(Channel ch) {
        ch.pipeline()
                .addLast(new RespDecoder())
                .addLast(new RdbPayloadEncoder())
                .addLast(new RespEncoder())
                .addLast(new RedisCommandHandler(dispatcher));
    }
}
