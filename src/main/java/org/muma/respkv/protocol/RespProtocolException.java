package org.muma.respkv.protocol;

import io.netty.handler.codec.DecoderException;

/**
 * RESP 解码失败。
 * 流已经错位，无法恢复，连接必须关闭。
 */
public class RespProtocolException extends DecoderException {

    public RespProtocolException(String message) {
        super(message);
    }

    public RespProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
