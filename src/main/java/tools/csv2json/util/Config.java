package tools.csv2json.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * 读取通用配置（csv2json.properties）。
 * 查找顺序：系统属性 &gt; 工作目录下的 csv2json.properties &gt; classpath 中的 csv2json.properties &gt; 默认值。
 */
public class Config {
    private static final Logger log = LoggerFactory.getLogger(Config.class);
    public static final String FILE_NAME = "csv2json.properties";
    public static final String KEY_MAX_LINE_LENGTH = "scan.maxLineLength";
    public static final String KEY_EXIT_ON_ERROR = "run.exitOnError";
    public static final String KEY_MAX_OUTPUT_LENGTH = "output.maxLineLength";
    public static final int DEFAULT_MAX_LINE_LENGTH = 4096;
    public static final int DEFAULT_MAX_OUTPUT_LENGTH = 4096;
    private static final Properties PROPS = new Properties();

    static {
        loadFromClasspath();
        loadFromWorkingDir();
    }

    private Config() {
    }

    private static void loadFromClasspath() {
        try (InputStream in = Config.class.getClassLoader().getResourceAsStream(FILE_NAME)) {
            if (in != null) {
                PROPS.load(in);
                log.debug("已从 classpath 读取 {}", FILE_NAME);
            }
        } catch (Exception e) {
            log.warn("读取 classpath 配置失败: {}", e.getMessage());
        }
    }

    private static void loadFromWorkingDir() {
        Path path = Path.of(FILE_NAME);
        if (!Files.exists(path)) {
            return;
        }
        try (InputStream in = Files.newInputStream(path)) {
            Properties override = new Properties();
            override.load(in);
            PROPS.putAll(override);
            log.debug("已加载工作目录下的 {}，覆盖默认配置", FILE_NAME);
        } catch (Exception e) {
            log.warn("读取工作目录配置失败: {}", e.getMessage());
        }
    }

    public static String getRawProperty(String key) {
        String sys = System.getProperty(key);
        if (sys != null && !sys.isBlank()) {
            return sys.trim();
        }
        String raw = PROPS.getProperty(key);
        return raw == null ? null : raw.trim();
    }

    /**
     * 单行输入的最大字符数，超出时终止运行。
     */
    public static int getMaxLineLength() {
        int configured = parseIntOrDefault(KEY_MAX_LINE_LENGTH, DEFAULT_MAX_LINE_LENGTH);
        if (configured < 1) {
            log.warn("配置 {}={} 无效，使用默认值 {}", KEY_MAX_LINE_LENGTH, configured, DEFAULT_MAX_LINE_LENGTH);
            return DEFAULT_MAX_LINE_LENGTH;
        }
        return configured;
    }

    /**
     * 单行 JSON 输出的最大字符数，0 表示不限制。
     */
    public static int getMaxOutputLength() {
        int configured = parseIntOrDefault(KEY_MAX_OUTPUT_LENGTH, DEFAULT_MAX_OUTPUT_LENGTH);
        if (configured < 0) {
            log.warn("配置 {}={} 无效，使用默认值 {}", KEY_MAX_OUTPUT_LENGTH, configured, DEFAULT_MAX_OUTPUT_LENGTH);
            return DEFAULT_MAX_OUTPUT_LENGTH;
        }
        return configured;
    }

    public static boolean isExitOnError() {
        String raw = getRawProperty(KEY_EXIT_ON_ERROR);
        if (raw == null || raw.isBlank()) {
            return false;
        }
        return switch (raw.toUpperCase()) {
            case "TRUE", "YES", "ON" -> true;
            case "FALSE", "NO", "OFF" -> false;
            default -> {
                log.warn("配置项解析失败，使用默认值 false: {}={}", KEY_EXIT_ON_ERROR, raw);
                yield false;
            }
        };
    }

    private static int parseIntOrDefault(String key, int defaultValue) {
        String raw = getRawProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            log.warn("配置项解析失败，使用默认值 {}: {}={}", defaultValue, key, raw);
            return defaultValue;
        }
    }
}
