package org.muma.respkv.store;

import java.time.Duration;

public interface StorageEngine {

    /**
     * 写入或覆盖。Key 按原始字节比较。expireAfter 为 null 表示永不过期 (会清掉旧的过期时间)
     */
    void set(byte[] key, byte[] value, Duration expireAfter);

    default void set(byte[] key, byte[] value) {
        set(key, value, null);
    }

    /**
     * 读取。不存在或已过期都返回 null
     */
    byte[] get(byte[] key);

    /**
     * 物理条目数，包含已过期但尚未被读到的 Key
     */
    int size();
}
