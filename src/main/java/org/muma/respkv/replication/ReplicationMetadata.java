package org.muma.respkv.replication;

import lombok.Getter;
import lombok.ToString;
import org.muma.respkv.config.ServerConfig;

/**
 * 复制元数据
 * 启动时根据配置计算一次，之后只读，所有连接共享。
 */
@Getter
@ToString
public class ReplicationMetadata {

    public enum Role {
        MASTER("master"),
        SLAVE("slave");

        @Getter
        private final String infoName;

        Role(String infoName) {
            this.infoName = infoName;
        }
    }

    // 配置了主节点就是 Slave，否则是 Master
    private final Role role;

    // 自身复制 ID (作为 Master 时用)
    private final String replId;

    // 复制偏移量 (当前不会推进)
    private final long replOffset;

    // Master 的 Host/Port (仅 Slave 模式有效)
    private final String masterHost;
    private final int masterPort;

    public ReplicationMetadata(String replId, long replOffset, String masterHost, int masterPort) {
        this.role = masterHost == null ? Role.MASTER : Role.SLAVE;
        this.replId = replId;
        this.replOffset = replOffset;
        this.masterHost = masterHost;
        this.masterPort = masterPort;
    }

    public static ReplicationMetadata from(ServerConfig config) {
        return new ReplicationMetadata(config.getReplicationId(), 0,
                config.getReplicaOfHost(), config.getReplicaOfPort());
    }

    public static ReplicationMetadata master(String replId) {
        return new ReplicationMetadata(replId, 0, null, -1);
    }

    public boolean isSlave() {
        return role == Role.SLAVE;
    }
}
