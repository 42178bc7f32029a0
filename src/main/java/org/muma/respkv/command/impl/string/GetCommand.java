package org.muma.respkv.command.impl.string;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;

public class GetCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() != 2) {
            return errorArgs("get");
        }

        byte[] value = storage.get(bulkArg(args, 1).content());
        if (value == null) {
            return BulkString.NULL; // Nil (不存在或已过期)
        }
        return new BulkString(value);
    }
}
