package com.sqlshell.executor;

import com.sqlshell.result.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * JdbcExecutor - 基于JDBC连接的Executor
 *
 * 每条语句使用一个新的java.sql.Statement,执行完立即关闭。
 * 提交粒度交给驱动的autocommit。
 *
 * LOB列在读取当前行时转换成值: 字符LOB取文本,二进制列取十六进制串,
 * 结果集关闭后不再持有驱动的句柄。
 */
public class JdbcExecutor implements Executor {

    private static final Logger logger = LoggerFactory.getLogger(JdbcExecutor.class);

    private final Connection connection;

    public JdbcExecutor(Connection connection) {
        if (connection == null) {
            throw new IllegalArgumentException("Connection cannot be null");
        }
        this.connection = connection;
    }

    @Override
    public QueryResult runQuery(String sql) {
        try (Statement statement = connection.createStatement()) {
            if (!statement.execute(sql)) {
                logger.debug("语句没有返回结果集: {}", sql);
                return QueryResult.empty();
            }
            try (ResultSet resultSet = statement.getResultSet()) {
                return read(resultSet);
            }
        } catch (SQLException e) {
            throw new StatementException(SqlErrorFormatter.format(e), e);
        }
    }

    @Override
    public void runCommand(String sql) {
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
        } catch (SQLException e) {
            throw new StatementException(SqlErrorFormatter.format(e), e);
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            logger.warn("关闭JDBC连接失败: {}", SqlErrorFormatter.format(e));
        }
    }

    private QueryResult read(ResultSet resultSet) throws SQLException {
        ResultSetMetaData metaData = resultSet.getMetaData();
        int columnCount = metaData.getColumnCount();

        List<String> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(metaData.getColumnLabel(i));
        }

        List<List<Object>> rows = new ArrayList<>();
        while (resultSet.next()) {
            List<Object> row = new ArrayList<>(columnCount);
            for (int i = 1; i <= columnCount; i++) {
                row.add(readValue(resultSet, i, metaData.getColumnType(i)));
            }
            rows.add(row);
        }
        return new QueryResult(columns, rows);
    }

    private static Object readValue(ResultSet resultSet, int column, int sqlType) throws SQLException {
        switch (sqlType) {
            case Types.CLOB:
            case Types.NCLOB:
            case Types.LONGVARCHAR:
            case Types.LONGNVARCHAR:
            case Types.SQLXML:
                return resultSet.getString(column);
            case Types.BLOB:
            case Types.BINARY:
            case Types.VARBINARY:
            case Types.LONGVARBINARY:
                byte[] bytes = resultSet.getBytes(column);
                return bytes == null ? null : HexFormat.of().withUpperCase().formatHex(bytes);
            default:
                return resultSet.getObject(column);
        }
    }
}
