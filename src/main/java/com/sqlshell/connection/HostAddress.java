package com.sqlshell.connection;

/**
 * 提示输入的主机地址: "ip:port" 或 "#x:port"
 *
 * "#x" 是容器地址的简写,例如前缀为 172.17.0. 时 "#2" 表示 172.17.0.2。
 * 省略端口时使用默认端口。
 */
public class HostAddress {

    private final String host;
    private final String port;

    private HostAddress(String host, String port) {
        this.host = host;
        this.port = port;
    }

    /**
     * @param input 用户输入(非空)
     * @param containerPrefix "#x" 展开用的前缀
     * @param defaultPort 未给出端口时的端口
     */
    public static HostAddress parse(String input, String containerPrefix, String defaultPort) {
        String[] parts = input.trim().split(":", 2);
        String host = parts[0];
        String port = parts.length > 1 && !parts[1].isBlank() ? parts[1].trim() : defaultPort;
        if (host.startsWith("#")) {
            host = containerPrefix + host.substring(1);
        }
        return new HostAddress(host, port);
    }

    public String getHost() {
        return host;
    }

    public String getPort() {
        return port;
    }
}
