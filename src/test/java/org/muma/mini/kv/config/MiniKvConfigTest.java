package org.muma.mini.kv.config;

import org.junit.jupiter.api.Test;
import org.muma.mini.kv.memory.EvictionPolicy;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MiniKvConfigTest {

    @Test
    void testDefaults() {
        MiniKvConfig config = new MiniKvConfig();
        assertEquals("127.0.0.1", config.getHost());
        assertEquals(6379, config.getPort());
        assertFalse(config.isAuthRequired());
        assertEquals(0, config.getMaxMemory());
        assertEquals(EvictionPolicy.ALLKEYS_LRU, config.getMaxMemoryPolicy());
        assertEquals(Path.of(".", "dump.json"), config.getSnapshotPath());
        assertEquals(List.of(
                new MiniKvConfig.SaveParam(900, 1),
                new MiniKvConfig.SaveParam(300, 10),
                new MiniKvConfig.SaveParam(60, 10000)), config.getSaveParams());
    }

    @Test
    void testLoadFromClasspathFile() {
        MiniKvConfig config = new MiniKvConfig();
        config.loadConfig("minikv-test.properties");

        assertEquals("0.0.0.0", config.getHost());
        assertEquals(7000, config.getPort());
        assertEquals("secret", config.getRequirePass());
        assertTrue(config.isAuthRequired());
        assertEquals(2 * 1024 * 1024, config.getMaxMemory());
        assertEquals(EvictionPolicy.VOLATILE_LFU, config.getMaxMemoryPolicy());
        assertEquals(Path.of("/tmp/minikv", "test.json"), config.getSnapshotPath());
        assertEquals(List.of(new MiniKvConfig.SaveParam(60, 5)), config.getSaveParams());
    }

    @Test
    void testMissingFileKeepsDefaults() {
        MiniKvConfig config = new MiniKvConfig();
        config.loadConfig("does-not-exist.properties");
        assertEquals(6379, config.getPort());
    }

    @Test
    void testEnvironmentOverridesFile() {
        MiniKvConfig config = new MiniKvConfig();
        config.loadConfig("minikv-test.properties");
        config.setEnvironment(Map.of(
                "MINIKV_PORT", "7001",
                "MINIKV_MAXMEMORY", "512kb",
                "MINIKV_MAXMEMORY_POLICY", "allkeys-random"));
        config.applyEnvOverrides();

        assertEquals(7001, config.getPort());
        assertEquals(512 * 1024, config.getMaxMemory());
        assertEquals(EvictionPolicy.ALLKEYS_RANDOM, config.getMaxMemoryPolicy());
        // 未被覆盖的保持文件中的值
        assertEquals("0.0.0.0", config.getHost());
    }

    @Test
    void testArgsOverrideEverything() {
        MiniKvConfig config = MiniKvConfig.fromArgs(new String[]{
                "--config", "minikv-test.properties",
                "--port", "7100",
                "--maxmemory", "1gb",
                "--maxmemory-policy", "noeviction",
                "--dir", "data",
                "--dbfilename", "kv.json"});

        assertEquals(7100, config.getPort());
        assertEquals(1024L * 1024 * 1024, config.getMaxMemory());
        assertEquals(EvictionPolicy.NO_EVICTION, config.getMaxMemoryPolicy());
        assertEquals(Path.of("data", "kv.json"), config.getSnapshotPath());
        assertEquals("secret", config.getRequirePass());
    }

    @Test
    void testInvalidValues() {
        MiniKvConfig config = new MiniKvConfig();
        config.parseArgs(new String[]{"--port", "abc", "--maxmemory", "lots"});
        assertEquals(6379, config.getPort());
        assertEquals(0, config.getMaxMemory());

        // 非法淘汰策略终止启动
        assertThrows(IllegalArgumentException.class,
                () -> config.parseArgs(new String[]{"--maxmemory-policy", "fifo"}));
        config.setEnvironment(Map.of("MINIKV_MAXMEMORY_POLICY", "lru"));
        assertThrows(IllegalArgumentException.class, config::applyEnvOverrides);
    }

    @Test
    void testParseSize() {
        assertEquals(100, MiniKvConfig.parseSize("100"));
        assertEquals(100, MiniKvConfig.parseSize("100b"));
        assertEquals(2048, MiniKvConfig.parseSize("2KB"));
        assertEquals(100L * 1024 * 1024, MiniKvConfig.parseSize(" 100mb "));
        assertEquals(1024L * 1024 * 1024, MiniKvConfig.parseSize("1gb"));
        assertThrows(NumberFormatException.class, () -> MiniKvConfig.parseSize("-1mb"));
        assertThrows(NumberFormatException.class, () -> MiniKvConfig.parseSize("big"));
    }

    @Test
    void testParseSaveParams() {
        assertTrue(MiniKvConfig.parseSaveParams("  ").isEmpty());
        assertEquals(List.of(new MiniKvConfig.SaveParam(10, 2)), MiniKvConfig.parseSaveParams("10 2"));
        assertThrows(IllegalArgumentException.class, () -> MiniKvConfig.parseSaveParams("10 2 30"));
    }
}
