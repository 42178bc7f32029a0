package org.muma.respkv.command.impl.replication;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.protocol.SimpleString;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * REPLCONF &lt;option&gt; &lt;value&gt; ...
 * 用于主从握手阶段交换信息。
 */
public class ReplConfCommand implements RedisCommand {

    private static final Logger log = LoggerFactory.getLogger(ReplConfCommand.class);

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        // 无论 Slave 发什么配置，Master 都说 OK
        if (args.size() >= 3 && "listening-port".equalsIgnoreCase(stringArg(args, 1))) {
            log.info("Replica announced listening-port {}", stringArg(args, 2));
        }
        return new SimpleString("OK");
    }
}
