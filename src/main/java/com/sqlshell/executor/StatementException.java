package com.sqlshell.executor;

/**
 * StatementException - 单条语句执行失败
 *
 * message是已经去掉驱动前缀的可读信息。
 * 只影响当前语句,同一批次的其余语句继续执行。
 */
public class StatementException extends RuntimeException {

    public StatementException(String message) {
        super(message);
    }

    public StatementException(String message, Throwable cause) {
        super(message, cause);
    }
}
