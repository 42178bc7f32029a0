package org.muma.respkv.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ServerConfigTest {

    @Test
    void testDefaults() {
        ServerConfig config = new ServerConfig();
        assertEquals(6379, config.getPort());
        assertFalse(config.isReplica());
        assertEquals(ServerConfig.DEFAULT_REPLICATION_ID, config.getReplicationId());
        assertEquals(40, config.getReplicationId().length());
    }

    @Test
    void testParseArgs() {
        ServerConfig config = new ServerConfig();
        config.parseArgs(new String[]{"--port", "6380", "--replicaof", "localhost 6379"});

        assertEquals(6380, config.getPort());
        assertTrue(config.isReplica());
        assertEquals("localhost", config.getReplicaOfHost());
        assertEquals(6379, config.getReplicaOfPort());
    }

    @Test
    void testReplicaOfAsTwoTokens() {
        ServerConfig config = new ServerConfig();
        config.parseArgs(new String[]{"--replicaof", "127.0.0.1", "7000", "--bind", "127.0.0.1"});

        assertEquals("127.0.0.1", config.getReplicaOfHost());
        assertEquals(7000, config.getReplicaOfPort());
        assertEquals("127.0.0.1", config.getBindHost());
    }

    @Test
    void testInvalidArgs() {
        ServerConfig config = new ServerConfig();
        assertThrows(IllegalArgumentException.class, () -> config.parseArgs(new String[]{"--port", "abc"}));
        assertThrows(IllegalArgumentException.class, () -> config.parseArgs(new String[]{"--port", "70000"}));
        assertThrows(IllegalArgumentException.class, () -> config.parseArgs(new String[]{"--port"}));
        assertThrows(IllegalArgumentException.class, () -> config.parseArgs(new String[]{"--replicaof", "host 0"}));
        assertThrows(IllegalArgumentException.class, () -> config.parseArgs(new String[]{"--verbose"}));
    }

    @Test
    void testLoadPropertiesFile() {
        ServerConfig config = new ServerConfig();
        config.loadConfig("respkv-test.properties");

        assertEquals("127.0.0.1", config.getBindHost());
        assertEquals(7001, config.getPort());
        assertEquals(2, config.getWorkerThreads());
        assertEquals("10.0.0.5", config.getReplicaOfHost());
        assertEquals(6390, config.getReplicaOfPort());
        assertEquals("0123456789abcdef0123456789abcdef01234567", config.getReplicationId());
        assertEquals(2500, config.getReplicaHandshakeTimeoutMs());
        // 非法值只告警，保留默认值
        assertEquals(5000, config.getReplicaConnectTimeoutMs());
    }

    @Test
    void testMissingFileKeepsDefaults() {
        ServerConfig config = new ServerConfig();
        config.loadConfig("does-not-exist.properties");
        assertEquals(6379, config.getPort());
        assertFalse(config.isReplica());
    }

    @Test
    void testPriorityArgsOverEnvOverFile() {
        ServerConfig config = new ServerConfig();
        config.loadConfig("respkv-test.properties");
        config.applyEnvOverrides(Map.of("RESPKV_PORT", "7002", "RESPKV_REPLICAOF", "master.local 6400"));

        assertEquals(7002, config.getPort());
        assertEquals("master.local", config.getReplicaOfHost());

        config.parseArgs(new String[]{"--port", "7003"});
        assertEquals(7003, config.getPort());
        assertEquals(6400, config.getReplicaOfPort());
    }

    @Test
    void testReplicaRequiresExplicitPort() {
        ServerConfig config = new ServerConfig();
        config.parseArgs(new String[]{"--port", "0"});
        config.validate();

        config.parseArgs(new String[]{"--replicaof", "localhost 6379"});
        assertThrows(IllegalArgumentException.class, config::validate);

        config.parseArgs(new String[]{"--port", "6380"});
        config.validate();
    }
}
