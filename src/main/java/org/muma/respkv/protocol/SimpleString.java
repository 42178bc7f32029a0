package org.muma.respkv.protocol;

// 1. 简单字符串 (+) - 状态回复，如 +OK
public record SimpleString(String content) implements RedisMessage {
}
