package org.muma.respkv.command.impl.server;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.replication.ReplicationMetadata;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;

/**
 * INFO [section]
 * 目前只实现了 replication 段；不带参数时也返回它，其它段返回空串 (与 Redis 对未知段的处理一致)。
 */
public class InfoCommand implements RedisCommand {

    private final ReplicationMetadata metadata;

    public InfoCommand(ReplicationMetadata metadata) {
        this.metadata = metadata;
    }

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() > 2) {
            return errorArgs("info");
        }
        if (args.size() == 2 && !"replication".equalsIgnoreCase(stringArg(args, 1))) {
            return new BulkString("");
        }
        return new BulkString(replicationSection());
    }

    private String replicationSection() {
        // 三行 key:value，行间 CRLF，末尾不带换行
        return "role:" + metadata.getRole().getInfoName() + "\r\n"
                + "master_replid:" + metadata.getReplId() + "\r\n"
                + "master_repl_offset:" + metadata.getReplOffset();
    }
}
