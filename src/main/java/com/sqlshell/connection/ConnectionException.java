package com.sqlshell.connection;

/**
 * ConnectionException - 无法建立或重新建立数据库会话
 *
 * 不是致命错误: 报告给用户,清空内存中的数据库名,下次连接时重新提示。
 */
public class ConnectionException extends RuntimeException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
