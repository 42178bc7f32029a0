package org.muma.respkv.config;

import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;

/**
 * 全局配置
 * 优先级: 命令行参数 > 环境变量 > 配置文件 (respkv.properties) > 默认值
 * <p>
 * 进程启动时构建一次，之后只读。
 */
@Getter
@Setter
public class ServerConfig {

    private static final Logger log = LoggerFactory.getLogger(ServerConfig.class);

    public static final String DEFAULT_CONFIG_FILE = "respkv.properties";
    public static final String DEFAULT_REPLICATION_ID = "8371b4fb1155b71f4a04d3e1bc3e18c4a990aeeb";

    // --- Core Settings ---
    private String bindHost = "0.0.0.0";
    private int port = 6379;
    private int workerThreads = 0; // 0 = Netty default

    // --- Replication ---
    private String replicaOfHost = null;
    private int replicaOfPort = -1;
    private String replicationId = DEFAULT_REPLICATION_ID;

    // 握手加固：连接超时 + 整体超时，不重试
    private int replicaConnectTimeoutMs = 5000;
    private int replicaHandshakeTimeoutMs = 10000;

    private String configFilePath = DEFAULT_CONFIG_FILE;

    /**
     * 完整加载流程：配置文件 -> 环境变量 -> 命令行
     */
    public static ServerConfig load(String[] args) {
        ServerConfig config = new ServerConfig();
        config.configFilePath = findConfigPath(args);
        config.loadConfig(config.configFilePath);
        config.applyEnvOverrides(System.getenv());
        config.parseArgs(args);
        config.validate();
        log.info("ServerConfig initialized: {}", config);
        return config;
    }

    public boolean isReplica() {
        return replicaOfHost != null;
    }

    /**
     * 跨字段校验。Slave 在监听之前握手，REPLCONF listening-port 只能上报配置的端口，所以不能是 0
     */
    public void validate() {
        if (isReplica() && port == 0) {
            throw new IllegalArgumentException("An explicit listening port is required when replicaof is set");
        }
    }

    // --- Loading Logic ---

    public void parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--config" -> this.configFilePath = requireValue(args, ++i, arg);
                case "--port" -> this.port = parsePort(requireValue(args, ++i, arg), true);
                case "--bind" -> this.bindHost = requireValue(args, ++i, arg);
                case "--replicaof" -> {
                    String target = requireValue(args, ++i, arg);
                    // 兼容 --replicaof "host port" 和 --replicaof host port 两种写法
                    if (!target.trim().contains(" ") && i + 1 < args.length && !args[i + 1].startsWith("--")) {
                        target = target + " " + args[++i];
                    }
                    applyReplicaOf(target);
                }
                default -> throw new IllegalArgumentException("Unknown argument: " + arg);
            }
        }
    }

    public void loadConfig(String path) {
        Properties props = loadProperties(path);

        String bind = props.getProperty("server.bind");
        if (bind != null && !bind.isBlank()) {
            this.bindHost = bind.trim();
        }
        this.port = getInt(props, "server.port", this.port);
        this.workerThreads = getInt(props, "server.worker_threads", this.workerThreads);
        this.replicaConnectTimeoutMs = getInt(props, "replica.connect_timeout_ms", this.replicaConnectTimeoutMs);
        this.replicaHandshakeTimeoutMs = getInt(props, "replica.handshake_timeout_ms", this.replicaHandshakeTimeoutMs);

        String replId = props.getProperty("replication.id");
        if (replId != null && !replId.isBlank()) {
            this.replicationId = replId.trim();
        }

        // 格式: replicaof <host> <port> (中间用空格分隔)
        String replicaOf = props.getProperty("replicaof", "");
        if (!replicaOf.isBlank()) {
            try {
                applyReplicaOf(replicaOf);
            } catch (IllegalArgumentException e) {
                log.warn("Invalid replicaof config '{}': {}", replicaOf, e.getMessage());
            }
        }
    }

    public void applyEnvOverrides(Map<String, String> env) {
        String envBind = env.get("RESPKV_BIND");
        if (envBind != null) {
            this.bindHost = envBind;
            log.info("Bind host overridden by ENV: {}", envBind);
        }

        String envPort = env.get("RESPKV_PORT");
        if (envPort != null) {
            this.port = parsePort(envPort, true);
            log.info("Port overridden by ENV: {}", this.port);
        }

        String envReplicaOf = env.get("RESPKV_REPLICAOF");
        if (envReplicaOf != null) {
            applyReplicaOf(envReplicaOf);
            log.info("Replicaof overridden by ENV: {}:{}", replicaOfHost, replicaOfPort);
        }
    }

    private void applyReplicaOf(String target) {
        String[] parts = target.trim().split("\\s+");
        if (parts.length != 2) {
            throw new IllegalArgumentException("replicaof expects '<host> <port>', got '" + target + "'");
        }
        this.replicaOfHost = parts[0];
        this.replicaOfPort = parsePort(parts[1], false);
    }

    private Properties loadProperties(String path) {
        Properties props = new Properties();
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            // 如果是 classpath 资源
            if (is != null) {
                props.load(is);
                log.info("Loaded config from classpath: {}", path);
            } else {
                // 尝试作为文件系统路径加载
                try (InputStream fis = new FileInputStream(path)) {
                    props.load(fis);
                    log.info("Loaded config from file: {}", path);
                } catch (IOException e) {
                    log.warn("Config file not found: {}, using defaults.", path);
                }
            }
        } catch (IOException e) {
            log.error("Error loading config", e);
        }
        return props;
    }

    private int getInt(Properties props, String key, int defaultValue) {
        String val = props.getProperty(key);
        if (val == null || val.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid value '{}' for {}, using default {}.", val, key, defaultValue);
            return defaultValue;
        }
    }

    private static String findConfigPath(String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config".equals(args[i])) {
                return args[i + 1];
            }
        }
        return DEFAULT_CONFIG_FILE;
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }

    // allowZero: 监听端口可以是 0 (随机端口)，主节点端口不行
    private static int parsePort(String value, boolean allowZero) {
        int port;
        try {
            port = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port: " + value, e);
        }
        int min = allowZero ? 0 : 1;
        if (port < min || port > 65535) {
            throw new IllegalArgumentException("Port out of range: " + port);
        }
        return port;
    }

    @Override
    public String toString() {
        return "Config{bind=" + bindHost + ", port=" + port
                + ", replicaof=" + (isReplica() ? replicaOfHost + ":" + replicaOfPort : "none") + "}";
    }
}
