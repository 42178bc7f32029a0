package org.muma.respkv.store;

import lombok.Getter;
import lombok.ToString;

/**
 * 存储条目：值 + 可选的绝对过期时间
 */
@Getter
@ToString
public class StoreEntry {

    // 过期时间 (-1 表示不过期)
    public static final long NO_EXPIRE = -1;

    private final byte[] value;

    // 毫秒时间戳
    private final long expireAt;

    public StoreEntry(byte[] value, long expireAt) {
        this.value = value;
        this.expireAt = expireAt;
    }

    public boolean hasExpiry() {
        return expireAt != NO_EXPIRE;
    }

    // 过期时间必须严格大于 now 才算存活
    public boolean isExpired(long now) {
        return expireAt != NO_EXPIRE && expireAt <= now;
    }
}
