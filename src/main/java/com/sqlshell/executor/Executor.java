package com.sqlshell.executor;

import com.sqlshell.result.QueryResult;

/**
 * Executor - 数据库连接句柄
 *
 * 对分派器只暴露两种执行方式: 取结果集的查询,以及不取结果集的命令。
 * 实现负责把驱动错误转换为 {@link StatementException}。
 *
 * 同一时刻只有一个Executor,被所有调用复用,从不并发访问。
 */
public interface Executor extends AutoCloseable {

    /**
     * 执行并取回全部结果
     *
     * @param sql 单条语句
     * @return 结果集;语句没有结果集时返回 {@link QueryResult#empty()}
     * @throws StatementException 执行失败
     */
    QueryResult runQuery(String sql);

    /**
     * 执行,不取结果集
     *
     * @param sql 单条语句
     * @throws StatementException 执行失败
     */
    void runCommand(String sql);

    /**
     * 释放连接,不抛受检异常
     */
    @Override
    void close();
}
