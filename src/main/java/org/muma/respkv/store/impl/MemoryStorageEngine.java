package org.muma.respkv.store.impl;

import org.muma.respkv.store.ByteKey;
import org.muma.respkv.store.StorageEngine;
import org.muma.respkv.store.StoreEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * 内存存储引擎
 * <p>
 * Key 按原始字节比较 (二进制安全)。整个 Map 由一把互斥锁保护，每次 get/set 只在 Map 操作期间持锁。
 * 过期采用惰性删除：读到过期 Key 时顺手删掉，没有后台清理线程。
 */
public class MemoryStorageEngine implements StorageEngine {

    private static final Logger log = LoggerFactory.getLogger(MemoryStorageEngine.class);

    private final Map<ByteKey, StoreEntry> memoryDb = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    // 毫秒时钟，测试时可替换
    private final LongSupplier clock;

    public MemoryStorageEngine() {
        this(System::currentTimeMillis);
    }

    public MemoryStorageEngine(LongSupplier clock) {
        this.clock = clock;
    }

    @Override
    public void set(byte[] key, byte[] value, Duration expireAfter) {
        long expireAt = StoreEntry.NO_EXPIRE;
        if (expireAfter != null) {
            long now = clock.getAsLong();
            long ttl = expireAfter.toMillis();
            // 超大 TTL 截断，避免溢出成负数后被当成已过期
            expireAt = ttl > Long.MAX_VALUE - now ? Long.MAX_VALUE : now + ttl;
        }
        StoreEntry entry = new StoreEntry(value, expireAt);
        ByteKey mapKey = ByteKey.copyOf(key);

        lock.lock();
        try {
            memoryDb.put(mapKey, entry);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public byte[] get(byte[] key) {
        ByteKey mapKey = new ByteKey(key);
        lock.lock();
        try {
            StoreEntry entry = memoryDb.get(mapKey);
            if (entry == null) {
                return null;
            }
            // 惰性删除 (Lazy Expiration)
            if (entry.isExpired(clock.getAsLong())) {
                memoryDb.remove(mapKey);
                log.debug("Lazy expired key: {}", mapKey);
                return null;
            }
            return entry.getValue();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return memoryDb.size();
        } finally {
            lock.unlock();
        }
    }
}
