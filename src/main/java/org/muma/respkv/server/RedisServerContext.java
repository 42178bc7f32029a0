package org.muma.respkv.server;

import lombok.Getter;
import org.muma.respkv.command.CommandDispatcher;
import org.muma.respkv.config.ServerConfig;
import org.muma.respkv.replication.ReplicaHandshakeException;
import org.muma.respkv.replication.ReplicationManager;
import org.muma.respkv.replication.ReplicationMetadata;
import org.muma.respkv.store.StorageEngine;
import org.muma.respkv.store.impl.MemoryStorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 服务器上下文
 * 负责组装各个模块，管理生命周期。Store 在这里创建一次，之后传给每个连接。
 */
public class RedisServerContext {

    private static final Logger log = LoggerFactory.getLogger(RedisServerContext.class);

    @Getter
    private final ServerConfig config;
    @Getter
    private final StorageEngine storage;
    @Getter
    private final ReplicationMetadata replicationMetadata;
    @Getter
    private final CommandDispatcher dispatcher;

    // 仅 Slave 模式下非 null
    @Getter
    private final ReplicationManager replicationManager;

    public RedisServerContext(ServerConfig config) {
        config.validate();
        this.config = config;

        // 1. Storage
        this.storage = new MemoryStorageEngine();

        // 2. Replication (角色在启动时确定，之后不变)
        this.replicationMetadata = ReplicationMetadata.from(config);
        this.replicationManager = replicationMetadata.isSlave()
                ? new ReplicationManager(replicationMetadata, config.getPort(),
                config.getReplicaConnectTimeoutMs(), config.getReplicaHandshakeTimeoutMs())
                : null;

        // 3. Dispatcher
        this.dispatcher = new CommandDispatcher(storage, replicationMetadata);
    }

    /**
     * 核心初始化流程：Slave 必须先完成握手，才能开始接受客户端连接
     */
    public void init() throws ReplicaHandshakeException, InterruptedException {
        log.info("Server role: {}, replid: {}", replicationMetadata.getRole().getInfoName(), replicationMetadata.getReplId());
        if (replicationManager != null) {
            replicationManager.handshake();
        }
    }

    public void shutdown() {
        if (replicationManager != null) {
            replicationManager.shutdown();
        }
    }
}
