package org.muma.respkv.protocol;

import java.util.Arrays;

// 5. 数组 (*) - 客户端请求总是以数组形式到达
public record RedisArray(RedisMessage[] elements) implements RedisMessage {

    public RedisArray {
        if (elements == null) {
            throw new IllegalArgumentException("Array elements must not be null");
        }
    }

    public static RedisArray ofBulk(String... parts) {
        RedisMessage[] msgs = new RedisMessage[parts.length];
        for (int i = 0; i < parts.length; i++) {
            msgs[i] = new BulkString(parts[i]);
        }
        return new RedisArray(msgs);
    }

    public int size() {
        return elements.length;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RedisArray other && Arrays.equals(elements, other.elements);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(elements);
    }

    @Override
    public String toString() {
        return "RedisArray" + Arrays.toString(elements);
    }
}
