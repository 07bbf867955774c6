package com.sqlshell.executor;

import com.sqlshell.connection.ConnectionException;
import com.sqlshell.session.SessionSettings;

/**
 * 按连接参数建立新的Executor
 */
public interface ExecutorFactory {

    /**
     * 建立连接
     *
     * @param settings 连接参数
     * @return 已连接的Executor
     * @throws ConnectionException 无法建立会话
     */
    Executor connect(SessionSettings settings);
}
