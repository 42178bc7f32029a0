package org.muma.respkv.store;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Map 的 Key：按字节内容比较，不做任何字符集解码 (二进制安全)
 */
public record ByteKey(byte[] bytes) {

    public ByteKey {
        if (bytes == null) {
            throw new IllegalArgumentException("Key must not be null");
        }
    }

    // 复制一份，调用方之后修改数组不会影响已存入的 Key
    public static ByteKey copyOf(byte[] bytes) {
        return new ByteKey(bytes.clone());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ByteKey other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    // 仅用于日志
    @Override
    public String toString() {
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
