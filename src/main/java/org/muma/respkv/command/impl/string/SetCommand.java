package org.muma.respkv.command.impl.string;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.protocol.ErrorMessage;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.protocol.SimpleString;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;

import java.time.Duration;
import java.util.Locale;

public class SetCommand implements RedisCommand {

    private static final SimpleString OK = new SimpleString("OK");

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        // 格式: SET key value [PX milliseconds]
        if (args.size() < 3) {
            return errorArgs("set");
        }

        byte[] key = bulkArg(args, 1).content();
        byte[] value = bulkArg(args, 2).content();

        // --- 1. 参数解析阶段 ---
        Duration expireAfter = null;
        for (int i = 3; i < args.size(); i++) {
            String opt = stringArg(args, i).toUpperCase(Locale.ROOT);
            if (!"PX".equals(opt) || expireAfter != null || i + 1 >= args.size()) {
                return errorSyntax();
            }
            long millis;
            try {
                millis = Long.parseLong(stringArg(args, ++i));
            } catch (NumberFormatException e) {
                return errorInt();
            }
            if (millis <= 0) {
                return new ErrorMessage("ERR invalid expire time in 'set' command");
            }
            expireAfter = Duration.ofMillis(millis);
        }

        // --- 2. 写入阶段 (无 PX 时会清掉旧的过期时间) ---
        storage.set(key, value, expireAfter);
        return OK;
    }
}
