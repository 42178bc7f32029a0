package org.muma.respkv.command;

import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.ErrorMessage;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;

public interface RedisCommand {

    /**
     * 执行命令，传入存储引擎和参数 (args[0] 是命令名本身)
     *
     * @return 回复帧；返回 null 表示命令已经自己写出了回复
     */
    RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context);

    /**
     * 辅助工具：快速构建参数个数错误
     */
    default ErrorMessage errorArgs(String cmd) {
        return new ErrorMessage("ERR wrong number of arguments for '" + cmd + "' command");
    }

    /**
     * 辅助工具：快速构建数值错误
     */
    default ErrorMessage errorInt() {
        return new ErrorMessage("ERR value is not an integer or out of range");
    }

    default ErrorMessage errorSyntax() {
        return new ErrorMessage("ERR syntax error");
    }

    /**
     * 取第 index 个参数，必须是非 null 的 BulkString。
     * 类型不对抛 IllegalArgumentException，由 Dispatcher 转成 -ERR 回复。
     */
    default BulkString bulkArg(RedisArray args, int index) {
        RedisMessage msg = args.elements()[index];
        if (msg instanceof BulkString bulk && !bulk.isNull()) {
            return bulk;
        }
        throw new IllegalArgumentException("Protocol error: argument " + index + " must be a bulk string");
    }

    default String stringArg(RedisArray args, int index) {
        return bulkArg(args, index).asString();
    }
}
