package com.sqlshell.connection;

/**
 * SettingsStoreException - 连接参数读写失败
 *
 * 只报告,不影响已经成功的连接。
 */
public class SettingsStoreException extends RuntimeException {

    public SettingsStoreException(String message) {
        super(message);
    }

    public SettingsStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
