package org.muma.respkv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

/**
 * 全量同步快照编码: $&lt;len&gt;\r\n&lt;bytes&gt;，注意末尾没有 CRLF
 */
public class RdbPayloadEncoder extends MessageToByteEncoder<RdbPayload> {

    @Override
    protected void encode(ChannelHandlerContext ctx, RdbPayload msg, ByteBuf out) {
        out.writeByte('$');
        RespEncoder.writeNumber(out, msg.content().length);
        out.writeBytes(msg.content());
    }
}
