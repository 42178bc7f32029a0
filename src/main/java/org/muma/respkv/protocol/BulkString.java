package org.muma.respkv.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

// 4. 批量字符串 ($) - 支持 null (表示 $-1)
public record BulkString(byte[] content) implements RedisMessage {

    public static final BulkString NULL = new BulkString((byte[]) null);

    public BulkString(String s) {
        this(s == null ? null : s.getBytes(StandardCharsets.UTF_8));
    }

    public String asString() {
        return content == null ? null : new String(content, StandardCharsets.UTF_8);
    }

    public boolean isNull() {
        return content == null;
    }

    // record 默认按引用比较数组，这里改成按内容比较
    @Override
    public boolean equals(Object o) {
        return o instanceof BulkString other && Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return content == null ? "BulkString[null]" : "BulkString[" + asString() + "]";
    }
}
