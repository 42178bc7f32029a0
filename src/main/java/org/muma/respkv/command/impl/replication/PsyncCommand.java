package org.muma.respkv.command.impl.replication;

import io.netty.channel.ChannelHandlerContext;
import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.protocol.RdbPayload;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.protocol.SimpleString;
import org.muma.respkv.rdb.EmptyRdb;
import org.muma.respkv.replication.ReplicationMetadata;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PSYNC &lt;replid&gt; &lt;offset&gt;
 * 不支持增量，全部 Full Resync：回复 +FULLRESYNC 后紧跟一个空 RDB。
 */
public class PsyncCommand implements RedisCommand {

    private static final Logger log = LoggerFactory.getLogger(PsyncCommand.class);

    private final ReplicationMetadata metadata;

    public PsyncCommand(ReplicationMetadata metadata) {
        this.metadata = metadata;
    }

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        String fullResync = "FULLRESYNC " + metadata.getReplId() + " " + metadata.getReplOffset();
        ChannelHandlerContext ctx = context.getNettyCtx();

        // 两段必须连续写出，中间不能插入别的回复
        ctx.write(new SimpleString(fullResync));
        ctx.writeAndFlush(new RdbPayload(EmptyRdb.content()));

        log.info("Full resync sent to {}: {}", ctx.channel().remoteAddress(), fullResync);
        return null;
    }
}
