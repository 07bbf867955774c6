package com.sqlshell.config;

import com.sqlshell.CommonConstant;
import com.sqlshell.session.SessionSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;

/**
 * ShellConfig - 运行配置
 *
 * 从classpath中的 sqlshell.properties 读取,同名的JVM系统属性优先。
 *
 * 配置项:
 * - sqlshell.settings.file: 连接参数持久化文件
 * - sqlshell.jdbc.url: JDBC URL模板,支持 {host} {port} {database} {protocol} 占位符
 * - sqlshell.timer.seconds: -t 选项的计时时长
 * - sqlshell.default.*: 交互式提示时使用的默认值
 * - sqlshell.container.prefix: "#x" 形式主机地址的前缀
 *
 * 使用示例:
 * <pre>
 * ShellConfig config = ShellConfig.load();
 * SessionSettings settings = config.defaultSettings();
 * </pre>
 */
public class ShellConfig {

    private static final Logger logger = LoggerFactory.getLogger(ShellConfig.class);

    public static final String SETTINGS_FILE = "sqlshell.settings.file";
    public static final String JDBC_URL = "sqlshell.jdbc.url";
    public static final String TIMER_SECONDS = "sqlshell.timer.seconds";
    public static final String DEFAULT_DATABASE = "sqlshell.default.database";
    public static final String DEFAULT_HOST = "sqlshell.default.host";
    public static final String DEFAULT_PORT = "sqlshell.default.port";
    public static final String DEFAULT_PROTOCOL = "sqlshell.default.protocol";
    public static final String DEFAULT_USER = "sqlshell.default.user";
    public static final String DEFAULT_PASSWORD = "sqlshell.default.password";
    public static final String DEFAULT_MAXROWS = "sqlshell.default.maxrows";
    public static final String CONTAINER_PREFIX = "sqlshell.container.prefix";

    private final Properties properties;

    /**
     * 使用给定属性创建配置(测试中直接构造)
     *
     * @param overrides 属性,未给出的项使用内置默认值
     */
    public ShellConfig(Properties overrides) {
        this.properties = builtInDefaults();
        if (overrides != null) {
            this.properties.putAll(overrides);
        }
    }

    /**
     * 加载配置: 内置默认值 → sqlshell.properties → 系统属性
     *
     * @return 配置
     */
    public static ShellConfig load() {
        Properties props = new Properties();
        try (InputStream in = ShellConfig.class.getClassLoader()
                .getResourceAsStream(CommonConstant.CONFIG_RESOURCE)) {
            if (in != null) {
                props.load(in);
            } else {
                logger.debug("未找到 {},使用内置默认值", CommonConstant.CONFIG_RESOURCE);
            }
        } catch (IOException e) {
            logger.warn("读取 {} 失败,使用内置默认值: {}", CommonConstant.CONFIG_RESOURCE, e.getMessage());
        }

        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("sqlshell.")) {
                props.setProperty(key, System.getProperty(key));
            }
        }
        return new ShellConfig(props);
    }

    private static Properties builtInDefaults() {
        Properties defaults = new Properties();
        defaults.setProperty(SETTINGS_FILE, "sqlshell-connect.json");
        defaults.setProperty(JDBC_URL, "jdbc:db2://{host}:{port}/{database}");
        defaults.setProperty(TIMER_SECONDS, "1");
        defaults.setProperty(DEFAULT_DATABASE, "SAMPLE");
        defaults.setProperty(DEFAULT_HOST, "localhost");
        defaults.setProperty(DEFAULT_PORT, "50000");
        defaults.setProperty(DEFAULT_PROTOCOL, "TCPIP");
        defaults.setProperty(DEFAULT_USER, "DB2INST1");
        defaults.setProperty(DEFAULT_PASSWORD, "password");
        defaults.setProperty(DEFAULT_MAXROWS, "10");
        defaults.setProperty(CONTAINER_PREFIX, "172.17.0.");
        return defaults;
    }

    /**
     * 启动时的会话参数: 数据库名为空,表示尚未尝试连接
     *
     * @return 新的SessionSettings
     */
    public SessionSettings defaultSettings() {
        SessionSettings settings = new SessionSettings();
        settings.setDatabase("");
        settings.setHostname(getDefaultHost());
        settings.setPort(getDefaultPort());
        settings.setProtocol(get(DEFAULT_PROTOCOL));
        settings.setUid(getDefaultUser());
        settings.setPwd(getDefaultPassword());
        settings.setMaxrows(getDefaultMaxRows());
        return settings;
    }

    public Path getSettingsFile() {
        return Paths.get(get(SETTINGS_FILE));
    }

    public String getJdbcUrlTemplate() {
        return get(JDBC_URL);
    }

    public Duration getTimerDuration() {
        return Duration.ofMillis(Math.round(Double.parseDouble(get(TIMER_SECONDS)) * 1000));
    }

    public String getDefaultDatabase() {
        return get(DEFAULT_DATABASE);
    }

    public String getDefaultHost() {
        return get(DEFAULT_HOST);
    }

    public String getDefaultPort() {
        return get(DEFAULT_PORT);
    }

    public String getDefaultUser() {
        return get(DEFAULT_USER);
    }

    public String getDefaultPassword() {
        return get(DEFAULT_PASSWORD);
    }

    public int getDefaultMaxRows() {
        return Integer.parseInt(get(DEFAULT_MAXROWS).trim());
    }

    public String getContainerPrefix() {
        return get(CONTAINER_PREFIX);
    }

    private String get(String key) {
        return properties.getProperty(key).trim();
    }
}
