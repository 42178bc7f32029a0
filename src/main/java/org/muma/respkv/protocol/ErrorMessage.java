package org.muma.respkv.protocol;

// 2. 错误 (-) - 如 -ERR unknown command
public record ErrorMessage(String content) implements RedisMessage {
}
