package org.muma.respkv.command;

import io.netty.channel.ChannelHandlerContext;
import org.muma.respkv.command.impl.connection.EchoCommand;
import org.muma.respkv.command.impl.connection.PingCommand;
import org.muma.respkv.command.impl.replication.PsyncCommand;
import org.muma.respkv.command.impl.replication.ReplConfCommand;
import org.muma.respkv.command.impl.server.InfoCommand;
import org.muma.respkv.command.impl.string.GetCommand;
import org.muma.respkv.command.impl.string.SetCommand;
import org.muma.respkv.protocol.ErrorMessage;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.replication.ReplicationMetadata;
import org.muma.respkv.server.RedisContext;
import org.muma.respkv.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 命令分发器，全进程一个实例，所有连接共享。
 * <p>
 * 参数错误和未知命令都转成 -ERR 回复，不会断开连接。
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private final Map<String, RedisCommand> commandMap = new HashMap<>();
    private final StorageEngine storage;
    private final ReplicationMetadata metadata;

    public CommandDispatcher(StorageEngine storage, ReplicationMetadata metadata) {
        this.storage = storage;
        this.metadata = metadata;
        this.initCommandRegistry();
    }

    /**
     * 初始化命令注册表，按类别注册
     */
    private void initCommandRegistry() {
        registerConnectionCommands();
        registerStringCommands();
        registerServerCommands();
        registerReplicationCommands();

        log.info("CommandDispatcher initialized. Total commands registered: {}", commandMap.size());
    }

    private void registerConnectionCommands() {
        commandMap.put("PING", new PingCommand());
        commandMap.put("ECHO", new EchoCommand());
    }

    private void registerStringCommands() {
        commandMap.put("SET", new SetCommand());
        commandMap.put("GET", new GetCommand());
    }

    private void registerServerCommands() {
        commandMap.put("INFO", new InfoCommand(metadata));
    }

    private void registerReplicationCommands() {
        commandMap.put("REPLCONF", new ReplConfCommand());
        commandMap.put("PSYNC", new PsyncCommand(metadata));
    }

    /**
     * 核心分发逻辑
     *
     * @return 回复帧；null 表示命令已自行写出回复
     */
    public RedisMessage dispatch(String commandName, RedisArray args, ChannelHandlerContext nettyCtx) {
        // 1. 查找命令 (命令名大小写不敏感)
        String cmdUpper = commandName.toUpperCase(Locale.ROOT);
        RedisCommand command = commandMap.get(cmdUpper);

        if (command == null) {
            log.warn("Command not found: {}", commandName);
            return new ErrorMessage("ERR unknown command '" + commandName + "'");
        }

        // 2. 执行并监控耗时
        long startTime = System.nanoTime();
        try {
            RedisContext context = new RedisContext(nettyCtx);
            RedisMessage response = command.execute(storage, args, context);

            // 记录慢日志 (超过 10ms)
            long duration = (System.nanoTime() - startTime) / 1000_000; // ms
            if (duration > 10) {
                log.warn("Slow command detected: {} cost {}ms", cmdUpper, duration);
            } else if (log.isDebugEnabled()) {
                log.debug("Command executed: {} cost {}ms", cmdUpper, duration);
            }

            return response;

        } catch (IllegalArgumentException | IllegalStateException e) {
            // 预期内的业务错误 (如参数类型错误)
            log.warn("Command execution failed (Client Error): {} - {}", cmdUpper, e.getMessage());
            return new ErrorMessage("ERR " + e.getMessage());

        } catch (Exception e) {
            // 意料之外的系统错误
            log.error("Internal Server Error processing command: {}", cmdUpper, e);
            return new ErrorMessage("ERR internal server error");
        }
    }
}
