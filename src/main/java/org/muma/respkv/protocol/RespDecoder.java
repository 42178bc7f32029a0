package org.muma.respkv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ReplayingDecoder;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * RESP 协议解码器
 * 状态机逻辑由 ReplayingDecoder 自动处理：数据不够时抛出 Signal 并回滚到帧起点，等待更多字节。
 * <p>
 * 每次 decode 只产出一个完整的帧。格式错误一律抛出 {@link RespProtocolException}。
 */
public class RespDecoder extends ReplayingDecoder<Void> {

    // RESP 协议常量
    private static final byte PLUS_BYTE = '+';
    private static final byte MINUS_BYTE = '-';
    private static final byte COLON_BYTE = ':';
    private static final byte DOLLAR_BYTE = '$';
    private static final byte ASTERISK_BYTE = '*';

    // 回车换行
    private static final byte CR = '\r';
    private static final byte LF = '\n';

    // 与 Redis 的限制保持一致
    static final int MAX_LINE_LENGTH = 64 * 1024;
    static final int MAX_BULK_LENGTH = 512 * 1024 * 1024;
    static final int MAX_ARRAY_LENGTH = 1024 * 1024;

    // 最短的数组元素是 "+\r\n"
    private static final int MIN_ELEMENT_LENGTH = 3;

    // 仅 Slave 端使用：+FULLRESYNC 之后的下一帧是不带结尾 CRLF 的 RDB 数据
    private boolean snapshotPayloadExpected;

    /**
     * 让下一帧按全量同步快照格式 ($len\r\n&lt;bytes&gt;) 解析，解析完成后自动回到普通模式。
     * 必须在 EventLoop 线程中调用 (通常是后面的 Handler 收到 +FULLRESYNC 时)。
     */
    public void expectSnapshotPayload() {
        this.snapshotPayloadExpected = true;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        if (snapshotPayloadExpected) {
            out.add(decodeSnapshotPayload(in));
            // 只有完整读完才会走到这里，数据不够时 replay 会保留标记
            snapshotPayloadExpected = false;
            return;
        }
        out.add(readNextObject(in));
    }

    @Override
    protected void decodeLast(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        // 连接关闭时还有半个帧没读完，视为协议错误而不是静默丢弃
        int pending = actualReadableBytes();
        if (pending > 0) {
            throw new RespProtocolException("Connection closed in the middle of a frame, " + pending + " bytes pending");
        }
    }

    // 递归读取下一个完整的 RedisMessage
    private RedisMessage readNextObject(ByteBuf in) {
        byte type = in.readByte();
        return switch (type) {
            case PLUS_BYTE -> new SimpleString(readLine(in));
            case MINUS_BYTE -> new ErrorMessage(readLine(in));
            case COLON_BYTE -> new RedisInteger(readLong(in));
            case DOLLAR_BYTE -> decodeBulkString(in);
            case ASTERISK_BYTE -> decodeArray(in);
            default -> throw new RespProtocolException("Unknown RESP type byte: " + describe(type));
        };
    }

    // 解析 BulkString: $<length>\r\n<data>\r\n
    private BulkString decodeBulkString(ByteBuf in) {
        long length = readLong(in);
        if (length == -1) {
            return BulkString.NULL;
        }
        checkLength(length, MAX_BULK_LENGTH, "bulk string");

        // readSlice 先检查可读字节数，数据没到齐时直接 replay，不会提前分配 length 大小的数组
        byte[] content = ByteBufUtil.getBytes(in.readSlice((int) length));

        // 声明长度之后必须紧跟 CRLF，否则说明长度与实际数据不符
        if (in.readByte() != CR || in.readByte() != LF) {
            throw new RespProtocolException("Bulk string payload does not match declared length " + length);
        }
        return new BulkString(content);
    }

    // 解析 Array: *<count>\r\n<element1>...<elementN>
    private RedisArray decodeArray(ByteBuf in) {
        long count = readLong(in);
        checkLength(count, MAX_ARRAY_LENGTH, "array");
        requireReadable(in, count * MIN_ELEMENT_LENGTH);

        RedisMessage[] elements = new RedisMessage[(int) count];
        for (int i = 0; i < elements.length; i++) {
            elements[i] = readNextObject(in);
        }
        return new RedisArray(elements);
    }

    // 解析快照: $<length>\r\n<data> (没有结尾 CRLF)
    private BulkString decodeSnapshotPayload(ByteBuf in) {
        byte type = in.readByte();
        if (type != DOLLAR_BYTE) {
            throw new RespProtocolException("Expected snapshot payload header, got type byte " + describe(type));
        }
        long length = readLong(in);
        checkLength(length, MAX_BULK_LENGTH, "snapshot payload");

        return new BulkString(ByteBufUtil.getBytes(in.readSlice((int) length)));
    }

    // 读取一行（不含 \r\n）。在 ReplayingDecoder 中找不到 \n 会触发 replay
    private String readLine(ByteBuf in) {
        int lfIndex = in.bytesBefore(MAX_LINE_LENGTH + 2, LF);
        if (lfIndex < 0) {
            throw new RespProtocolException("Line exceeds " + MAX_LINE_LENGTH + " bytes without terminator");
        }
        if (lfIndex == 0 || in.getByte(in.readerIndex() + lfIndex - 1) != CR) {
            throw new RespProtocolException("Line is not terminated by CRLF");
        }

        byte[] line = new byte[lfIndex - 1];
        in.readBytes(line);
        in.skipBytes(2);

        for (byte b : line) {
            if (b == CR) {
                throw new RespProtocolException("Unexpected CR inside line");
            }
        }
        return new String(line, StandardCharsets.UTF_8);
    }

    // 读取并解析长整型
    private long readLong(ByteBuf in) {
        String s = readLine(in);
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new RespProtocolException("Invalid integer: '" + s + "'", e);
        }
    }

    // 探测最后一个字节：不够时 ReplayingDecoder 的 buffer 会触发 replay
    private static void requireReadable(ByteBuf in, long bytes) {
        if (bytes > 0) {
            in.getByte((int) (in.readerIndex() + bytes - 1));
        }
    }

    private static void checkLength(long length, int max, String what) {
        if (length < 0 || length > max) {
            throw new RespProtocolException("Invalid " + what + " length: " + length);
        }
    }

    private static String describe(byte b) {
        return b >= 0x20 && b < 0x7f ? "'" + (char) b + "'" : String.format("0x%02x", b & 0xff);
    }
}
