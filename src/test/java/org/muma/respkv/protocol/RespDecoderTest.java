package org.muma.respkv.protocol;

import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class RespDecoderTest {

    private RespDecoder decoder;
    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        decoder = new RespDecoder();
        channel = new EmbeddedChannel(decoder);
    }

    @AfterEach
    void tearDown() {
        // 出错的用例里缓冲区残留垃圾数据，只关闭不检查异常
        channel.close();
    }

    // --- 辅助方法 ---
    private void feed(String wire) {
        channel.writeInbound(Unpooled.copiedBuffer(wire, StandardCharsets.ISO_8859_1));
    }

    private RedisMessage decodeOne(String wire) {
        feed(wire);
        RedisMessage msg = channel.readInbound();
        assertNotNull(msg, "expected a complete frame for: " + wire);
        return msg;
    }

    @Test
    void testSimpleTypes() {
        assertEquals(new SimpleString("OK"), decodeOne("+OK\r\n"));
        assertEquals(new ErrorMessage("ERR something bad"), decodeOne("-ERR something bad\r\n"));
        assertEquals(new RedisInteger(1000), decodeOne(":1000\r\n"));
        assertEquals(new RedisInteger(-42), decodeOne(":-42\r\n"));
        assertEquals(new RedisInteger(Long.MAX_VALUE), decodeOne(":" + Long.MAX_VALUE + "\r\n"));
        assertEquals(new SimpleString(""), decodeOne("+\r\n"));
    }

    @Test
    void testBulkStrings() {
        assertEquals(new BulkString("hello"), decodeOne("$5\r\nhello\r\n"));

        // 空串与 null 是两回事
        BulkString empty = (BulkString) decodeOne("$0\r\n\r\n");
        assertFalse(empty.isNull());
        assertEquals(0, empty.content().length);

        BulkString nil = (BulkString) decodeOne("$-1\r\n");
        assertTrue(nil.isNull());
    }

    @Test
    void testBulkStringIsBinarySafe() {
        BulkString bulk = (BulkString) decodeOne("$4\r\na\r\nb\r\n");
        assertArrayEquals(new byte[]{'a', '\r', '\n', 'b'}, bulk.content());
    }

    @Test
    void testArrays() {
        RedisMessage msg = decodeOne("*2\r\n$4\r\nECHO\r\n$3\r\nhey\r\n");
        assertEquals(RedisArray.ofBulk("ECHO", "hey"), msg);

        RedisArray empty = (RedisArray) decodeOne("*0\r\n");
        assertEquals(0, empty.size());

        RedisMessage nested = decodeOne("*3\r\n:1\r\n*2\r\n+a\r\n$-1\r\n-ERR x\r\n");
        RedisArray expected = new RedisArray(new RedisMessage[]{
                new RedisInteger(1),
                new RedisArray(new RedisMessage[]{new SimpleString("a"), BulkString.NULL}),
                new ErrorMessage("ERR x")
        });
        assertEquals(expected, nested);
    }

    @Test
    void testFrameSplitAcrossPackets() {
        feed("*2\r\n$4\r\nEC");
        assertNull(channel.readInbound(), "incomplete frame must not be emitted");

        feed("HO\r\n$3\r\nhe");
        assertNull(channel.readInbound());

        feed("y\r\n");
        assertEquals(RedisArray.ofBulk("ECHO", "hey"), channel.readInbound());
    }

    @Test
    void testPipelinedFramesInOnePacket() {
        feed("*1\r\n$4\r\nPING\r\n*1\r\n$4\r\nPING\r\n+OK\r\n");
        assertEquals(RedisArray.ofBulk("PING"), channel.readInbound());
        assertEquals(RedisArray.ofBulk("PING"), channel.readInbound());
        assertEquals(new SimpleString("OK"), channel.readInbound());
        assertNull(channel.readInbound());
    }

    @Test
    void testBulkLongerThanDeclaredLengthFails() {
        assertThrows(RespProtocolException.class, () -> feed("$3\r\nhello\r\n"));
    }

    @Test
    void testBulkShorterThanDeclaredLengthIsNeverTruncated() {
        // 声明 5 字节，实际只有 "hey"：解码器只会继续等待，连接关闭时报错
        feed("$5\r\nhey\r\n");
        assertNull(channel.readInbound());
        assertThrows(RespProtocolException.class, channel::finish);
    }

    @Test
    void testUnknownTypeByteFails() {
        RespProtocolException e = assertThrows(RespProtocolException.class, () -> feed("!oops\r\n"));
        assertTrue(e.getMessage().contains("'!'"));
    }

    @Test
    void testInvalidIntegerFails() {
        RespProtocolException e = assertThrows(RespProtocolException.class, () -> feed(":12a\r\n"));
        assertInstanceOf(NumberFormatException.class, e.getCause());
    }

    @Test
    void testInvalidHeadersFail() {
        assertThrows(RespProtocolException.class, () -> feed("$-2\r\n"));
    }

    @Test
    void testNullArrayIsRejected() {
        assertThrows(RespProtocolException.class, () -> feed("*-1\r\n"));
    }

    @Test
    void testLineWithoutCarriageReturnFails() {
        assertThrows(RespProtocolException.class, () -> feed("+OK\n"));
    }

    @Test
    void testOverlongLineFails() {
        String garbage = "+" + "a".repeat(RespDecoder.MAX_LINE_LENGTH + 10);
        assertThrows(RespProtocolException.class, () -> feed(garbage));
    }

    @Test
    void testConnectionClosedMidFrameFails() {
        feed("*2\r\n$4\r\nECHO\r\n");
        assertNull(channel.readInbound());
        assertThrows(RespProtocolException.class, channel::finish);
    }

    @Test
    void testCleanCloseAfterCompleteFrames() {
        feed("+OK\r\n");
        assertTrue(channel.finish());
        assertEquals(new SimpleString("OK"), channel.readInbound());
    }

    @Test
    void testHugeDeclaredBulkTrickledByteByByteStaysCheap() {
        // 声明 500MB，只发几个字节：每次 replay 都不能分配 payload 大小的数组
        feed("*2\r\n$3\r\nSET\r\n$500000000\r\n");
        assertTimeout(Duration.ofSeconds(2), () -> {
            for (int i = 0; i < 40; i++) {
                feed("x");
            }
        });
        assertNull(channel.readInbound());
        assertTrue(channel.isOpen());
    }

    @Test
    void testHugeDeclaredArrayTrickledStaysCheap() {
        feed("*1000000\r\n");
        assertTimeout(Duration.ofSeconds(2), () -> {
            for (int i = 0; i < 40; i++) {
                feed(":1\r\n");
            }
        });
        assertNull(channel.readInbound());
    }

    @Test
    void testLargeBulkInSmallChunks() {
        byte[] payload = new byte[64 * 1024];
        Arrays.fill(payload, (byte) 'a');
        String body = new String(payload, StandardCharsets.ISO_8859_1);
        String wire = "$" + payload.length + "\r\n" + body + "\r\n";

        for (int from = 0; from < wire.length(); from += 1000) {
            feed(wire.substring(from, Math.min(wire.length(), from + 1000)));
        }

        BulkString bulk = channel.readInbound();
        assertNotNull(bulk);
        assertArrayEquals(payload, bulk.content());
    }

    @Test
    void testSnapshotPayloadMode() {
        decoder.expectSnapshotPayload();
        // 快照没有结尾 CRLF，后面紧跟的帧必须按普通模式解析
        feed("$5\r\nREDIS+OK\r\n");

        assertEquals(new BulkString("REDIS"), channel.readInbound());
        assertEquals(new SimpleString("OK"), channel.readInbound());
    }

    @Test
    void testSnapshotPayloadSplitAcrossPackets() {
        decoder.expectSnapshotPayload();
        feed("$5\r\nRE");
        assertNull(channel.readInbound());

        feed("DIS");
        assertEquals(new BulkString("REDIS"), channel.readInbound());
    }

    @Test
    void testSnapshotPayloadRequiresBulkHeader() {
        decoder.expectSnapshotPayload();
        assertThrows(RespProtocolException.class, () -> feed("+FULLRESYNC\r\n"));
    }
}
