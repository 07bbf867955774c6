package com.sqlshell.connection;

/**
 * ConfigurationException - CONNECT 语句缺少必需的参数
 *
 * 连接请求被放弃,已保存的参数不受影响。
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
