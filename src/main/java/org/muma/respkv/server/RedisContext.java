package org.muma.respkv.server;

import io.netty.channel.ChannelHandlerContext;

/**
 * 命令执行上下文
 * 封装了与当前连接相关的环境信息
 */
public class RedisContext {

    private final ChannelHandlerContext nettyCtx;

    public RedisContext(ChannelHandlerContext nettyCtx) {
        this.nettyCtx = nettyCtx;
    }

    public ChannelHandlerContext getNettyCtx() {
        return nettyCtx;
    }
}
