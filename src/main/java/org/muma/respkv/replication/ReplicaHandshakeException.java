package org.muma.respkv.replication;

/**
 * 与 Master 的握手失败 (回复不符、I/O 错误、超时)
 */
public class ReplicaHandshakeException extends Exception {

    public ReplicaHandshakeException(String message) {
        super(message);
    }

    public ReplicaHandshakeException(String message, Throwable cause) {
        super(message, cause);
    }
}
