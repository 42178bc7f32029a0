package org.muma.respkv.command.impl.connection;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.protocol.SimpleString;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;

/**
 * PING [message]
 */
public class PingCommand implements RedisCommand {

    private static final SimpleString PONG = new SimpleString("PONG");

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        return switch (args.size()) {
            case 1 -> PONG;
            case 2 -> bulkArg(args, 1);
            default -> errorArgs("ping");
        };
    }
}
