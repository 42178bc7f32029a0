package org.muma.respkv.protocol;

/**
 * 全量同步时跟在 +FULLRESYNC 后面的快照数据。
 * 线上格式: $<len>\r\n<bytes>，末尾没有 CRLF，所以不属于 RedisMessage。
 */
public record RdbPayload(byte[] content) {
}
