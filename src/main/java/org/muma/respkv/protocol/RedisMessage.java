package org.muma.respkv.protocol;

// 密封接口，限制实现类 (RESP 的五种帧)
public sealed interface RedisMessage permits
        SimpleString, ErrorMessage, RedisInteger, BulkString, RedisArray {
}
