package org.muma.respkv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class RespEncoderTest {

    private String encode(Object msg) {
        EmbeddedChannel channel = new EmbeddedChannel(new RdbPayloadEncoder(), new RespEncoder());
        assertTrue(channel.writeOutbound(msg));
        ByteBuf buf = channel.readOutbound();
        try {
            return buf.toString(StandardCharsets.ISO_8859_1);
        } finally {
            buf.release();
            channel.finishAndReleaseAll();
        }
    }

    @Test
    void testReplyShapes() {
        assertEquals("+OK\r\n", encode(new SimpleString("OK")));
        assertEquals("-ERR bad\r\n", encode(new ErrorMessage("ERR bad")));
        assertEquals(":-7\r\n", encode(new RedisInteger(-7)));
        assertEquals("$3\r\nhey\r\n", encode(new BulkString("hey")));
        assertEquals("$0\r\n\r\n", encode(new BulkString(new byte[0])));
        assertEquals("$-1\r\n", encode(BulkString.NULL));
        assertEquals("*0\r\n", encode(new RedisArray(new RedisMessage[0])));
        assertEquals("*3\r\n$8\r\nREPLCONF\r\n$4\r\ncapa\r\n$6\r\npsync2\r\n",
                encode(RedisArray.ofBulk("REPLCONF", "capa", "psync2")));
    }

    @Test
    void testLengthCountsBytesNotChars() {
        // "é" 是 2 个 UTF-8 字节
        assertEquals("$2\r\nÃ©\r\n", encode(new BulkString("é")));
    }

    @Test
    void testRdbPayloadHasNoTrailingTerminator() {
        assertEquals("$5\r\nREDIS", encode(new RdbPayload("REDIS".getBytes(StandardCharsets.US_ASCII))));
    }

    @Test
    void testEncodedFramesDecodeToEqualFrames() {
        RedisMessage original = new RedisArray(new RedisMessage[]{
                new SimpleString("PONG"),
                new RedisInteger(Long.MIN_VALUE),
                new BulkString(new byte[]{0, '\r', '\n', (byte) 0xff}),
                new BulkString(new byte[0]),
                BulkString.NULL,
                new RedisArray(new RedisMessage[]{new ErrorMessage("ERR nested"), new RedisArray(new RedisMessage[0])})
        });

        EmbeddedChannel decoder = new EmbeddedChannel(new RespDecoder());
        decoder.writeInbound(Unpooled.copiedBuffer(encode(original), StandardCharsets.ISO_8859_1));
        assertEquals(original, decoder.readInbound());
        assertFalse(decoder.finish());
    }
}
