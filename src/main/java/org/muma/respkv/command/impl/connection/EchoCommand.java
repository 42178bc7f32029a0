package org.muma.respkv.command.impl.connection;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;

public class EchoCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() != 2) return errorArgs("echo");
        return bulkArg(args, 1);
    }
}
