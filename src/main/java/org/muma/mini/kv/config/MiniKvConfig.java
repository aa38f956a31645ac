package org.muma.mini.kv.config;

import lombok.Getter;
import lombok.Setter;
import org.muma.mini.kv.memory.EvictionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * 服务配置
 * 优先级: 命令行参数 > 环境变量 > 配置文件 (minikv.properties) > 默认值
 * <p>
 * maxmemory-policy 取值非法时直接抛出异常，终止启动
 */
@Getter
@Setter
public class MiniKvConfig {

    private static final Logger log = LoggerFactory.getLogger(MiniKvConfig.class);

    public static final String DEFAULT_CONFIG_FILE = "minikv.properties";
    public static final String DEFAULT_SAVE = "900 1 300 10 60 10000";

    // --- Network ---
    private String host = "127.0.0.1";
    private int port = 6379;

    // --- Auth ---
    private String requirePass = null;

    // --- Memory ---
    private long maxMemory = 0;
    private EvictionPolicy maxMemoryPolicy = EvictionPolicy.ALLKEYS_LRU;

    // --- Snapshot ---
    private String dir = ".";
    private String dbFilename = "dump.json";
    private List<SaveParam> saveParams = parseSaveParams(DEFAULT_SAVE);

    private String configFilePath = DEFAULT_CONFIG_FILE;

    /**
     * save &lt;seconds&gt; &lt;changes&gt;: seconds 秒内至少 changes 次修改则触发保存
     */
    public record SaveParam(long seconds, long changes) {
    }

    // 测试与环境变量注入
    private Map<String, String> environment = System.getenv();

    // --- Loading Logic ---

    /**
     * 完整加载流程: 先找 --config，读文件，再叠加环境变量，最后叠加命令行参数
     */
    public static MiniKvConfig fromArgs(String[] args) {
        MiniKvConfig config = new MiniKvConfig();
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config".equals(args[i])) {
                config.setConfigFilePath(args[i + 1]);
            }
        }
        config.loadConfig(config.getConfigFilePath());
        config.applyEnvOverrides();
        config.parseArgs(args);
        log.info("MiniKvConfig initialized: {}", config);
        return config;
    }

    public void parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (i + 1 >= args.length) {
                log.warn("Ignoring argument without value: {}", arg);
                break;
            }
            switch (arg) {
                case "--config" -> i++;
                case "--host" -> this.host = args[++i];
                case "--port" -> this.port = parseInt(args[++i], this.port, arg);
                case "--requirepass" -> this.requirePass = args[++i];
                case "--maxmemory" -> this.maxMemory = parseMemory(args[++i], this.maxMemory, arg);
                case "--maxmemory-policy" -> this.maxMemoryPolicy = EvictionPolicy.fromName(args[++i]);
                case "--dir" -> this.dir = args[++i];
                case "--dbfilename" -> this.dbFilename = args[++i];
                default -> log.warn("Unknown argument: {}", arg);
            }
        }
    }

    public void loadConfig(String path) {
        Properties props = loadProperties(path);

        this.host = props.getProperty("server.host", this.host);
        this.port = parseInt(props.getProperty("server.port"), this.port, "server.port");
        this.requirePass = props.getProperty("requirepass", this.requirePass);

        this.maxMemory = parseMemory(props.getProperty("maxmemory"), this.maxMemory, "maxmemory");
        String policy = props.getProperty("maxmemory-policy");
        if (policy != null) {
            this.maxMemoryPolicy = EvictionPolicy.fromName(policy);
        }

        this.dir = props.getProperty("dir", this.dir);
        this.dbFilename = props.getProperty("dbfilename", this.dbFilename);

        String save = props.getProperty("save");
        if (save != null) {
            try {
                this.saveParams = parseSaveParams(save);
            } catch (IllegalArgumentException e) {
                log.warn("Invalid save config '{}', using default '{}'", save, DEFAULT_SAVE);
            }
        }
    }

    private Properties loadProperties(String path) {
        Properties props = new Properties();
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            if (is != null) {
                props.load(is);
                log.info("Loaded config from classpath: {}", path);
                return props;
            }
        } catch (IOException e) {
            log.error("Error loading config from classpath: {}", path, e);
        }

        try (InputStream fis = new FileInputStream(path)) {
            props.load(fis);
            log.info("Loaded config from file: {}", path);
        } catch (IOException e) {
            log.warn("Config file not found: {}, using defaults.", path);
        }
        return props;
    }

    public void applyEnvOverrides() {
        String envHost = environment.get("MINIKV_HOST");
        if (envHost != null) {
            this.host = envHost;
        }
        String envPort = environment.get("MINIKV_PORT");
        if (envPort != null) {
            this.port = parseInt(envPort, this.port, "MINIKV_PORT");
            log.info("Port overridden by ENV: {}", this.port);
        }
        String envPass = environment.get("MINIKV_REQUIREPASS");
        if (envPass != null) {
            this.requirePass = envPass;
        }
        String envMaxMemory = environment.get("MINIKV_MAXMEMORY");
        if (envMaxMemory != null) {
            this.maxMemory = parseMemory(envMaxMemory, this.maxMemory, "MINIKV_MAXMEMORY");
        }
        String envPolicy = environment.get("MINIKV_MAXMEMORY_POLICY");
        if (envPolicy != null) {
            this.maxMemoryPolicy = EvictionPolicy.fromName(envPolicy);
        }
    }

    public Path getSnapshotPath() {
        return Path.of(dir, dbFilename);
    }

    public boolean isAuthRequired() {
        return requirePass != null && !requirePass.isEmpty();
    }

    // 解析 save 配置，例如 "900 1 300 10 60 10000"；空串表示关闭自动保存
    static List<SaveParam> parseSaveParams(String value) {
        List<SaveParam> params = new ArrayList<>();
        String trimmed = value.trim();
        if (trimmed.isEmpty()) return params;

        String[] parts = trimmed.split("\\s+");
        if (parts.length % 2 != 0) {
            throw new IllegalArgumentException("save expects <seconds> <changes> pairs");
        }
        for (int i = 0; i < parts.length; i += 2) {
            params.add(new SaveParam(Long.parseLong(parts[i]), Long.parseLong(parts[i + 1])));
        }
        return params;
    }

    // 辅助：解析带单位的大小 (100mb, 1gb)
    static long parseSize(String sizeStr) {
        String s = sizeStr.toLowerCase(Locale.ROOT).trim();
        long multiplier = 1;
        if (s.endsWith("kb")) {
            multiplier = 1024;
            s = s.substring(0, s.length() - 2);
        } else if (s.endsWith("mb")) {
            multiplier = 1024 * 1024;
            s = s.substring(0, s.length() - 2);
        } else if (s.endsWith("gb")) {
            multiplier = 1024L * 1024 * 1024;
            s = s.substring(0, s.length() - 2);
        } else if (s.endsWith("b")) {
            s = s.substring(0, s.length() - 1);
        }
        long value = Long.parseLong(s.trim());
        if (value < 0) {
            throw new NumberFormatException("negative size: " + sizeStr);
        }
        return value * multiplier;
    }

    private long parseMemory(String value, long defaultValue, String name) {
        if (value == null) return defaultValue;
        try {
            return parseSize(value);
        } catch (NumberFormatException e) {
            log.warn("Invalid {} value '{}', using {}", name, value, defaultValue);
            return defaultValue;
        }
    }

    private int parseInt(String value, int defaultValue, String name) {
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid {} value '{}', using {}", name, value, defaultValue);
            return defaultValue;
        }
    }

    @Override
    public String toString() {
        return "Config{host=" + host + ", port=" + port
                + ", auth=" + isAuthRequired()
                + ", maxmemory=" + maxMemory
                + ", policy=" + maxMemoryPolicy.configName()
                + ", snapshot=" + getSnapshotPath() + "}";
    }
}
