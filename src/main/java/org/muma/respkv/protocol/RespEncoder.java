package org.muma.respkv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

import java.nio.charset.StandardCharsets;

public class RespEncoder extends MessageToByteEncoder<RedisMessage> {

    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] NULL_LENGTH = "-1".getBytes(StandardCharsets.US_ASCII);

    @Override
    protected void encode(ChannelHandlerContext ctx, RedisMessage msg, ByteBuf out) {
        writeMessage(out, msg);
    }

    /**
     * 递归写入任意帧，数组元素复用同一套逻辑
     */
    public static void writeMessage(ByteBuf out, RedisMessage msg) {
        if (msg instanceof SimpleString s) {
            out.writeByte('+');
            out.writeBytes(s.content().getBytes(StandardCharsets.UTF_8));
            out.writeBytes(CRLF);
        } else if (msg instanceof ErrorMessage e) {
            out.writeByte('-');
            out.writeBytes(e.content().getBytes(StandardCharsets.UTF_8));
            out.writeBytes(CRLF);
        } else if (msg instanceof RedisInteger i) {
            out.writeByte(':');
            writeNumber(out, i.value());
        } else if (msg instanceof BulkString b) {
            out.writeByte('$');
            if (b.isNull()) {
                out.writeBytes(NULL_LENGTH);
                out.writeBytes(CRLF);
            } else {
                writeNumber(out, b.content().length);
                out.writeBytes(b.content());
                out.writeBytes(CRLF);
            }
        } else if (msg instanceof RedisArray a) {
            out.writeByte('*');
            writeNumber(out, a.elements().length);
            for (RedisMessage element : a.elements()) {
                writeMessage(out, element);
            }
        }
    }

    // 数字 + CRLF，用于长度头和整数帧
    static void writeNumber(ByteBuf out, long value) {
        out.writeBytes(Long.toString(value).getBytes(StandardCharsets.US_ASCII));
        out.writeBytes(CRLF);
    }
}
