package org.muma.respkv.replication;

/**
 * Slave 端握手状态机
 */
public enum ReplState {
    NONE,               // 非 Slave (Master 模式) 或尚未开始
    CONNECTING,         // TCP 连接中
    RECEIVE_PONG,       // 已发 PING，等待 PONG
    SEND_PORT,          // 已发 REPLCONF listening-port，等待 OK
    SEND_CAPA,          // 已发 REPLCONF capa psync2，等待 OK
    RECEIVE_PSYNC,      // 已发 PSYNC ? -1，等待 +FULLRESYNC
    TRANSFER,           // 正在接收 RDB
    CONNECTED,          // 全量同步完成
    FAILED              // 握手失败，不重试
}
