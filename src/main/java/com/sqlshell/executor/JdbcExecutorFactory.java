package com.sqlshell.executor;

import com.sqlshell.config.ShellConfig;
import com.sqlshell.connection.ConnectionException;
import com.sqlshell.session.SessionSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * 通过DriverManager建立JDBC连接
 *
 * URL由模板生成,例如默认的 {@code jdbc:db2://{host}:{port}/{database}}。
 */
public class JdbcExecutorFactory implements ExecutorFactory {

    private static final Logger logger = LoggerFactory.getLogger(JdbcExecutorFactory.class);

    private final String urlTemplate;

    public JdbcExecutorFactory(ShellConfig config) {
        this(config.getJdbcUrlTemplate());
    }

    public JdbcExecutorFactory(String urlTemplate) {
        if (urlTemplate == null || urlTemplate.isBlank()) {
            throw new IllegalArgumentException("JDBC URL template cannot be empty");
        }
        this.urlTemplate = urlTemplate;
    }

    @Override
    public Executor connect(SessionSettings settings) {
        String url = buildUrl(settings);
        logger.info("连接数据库: {}", url);
        Connection connection;
        try {
            connection = DriverManager.getConnection(url, settings.getUid(), settings.getPwd());
        } catch (SQLException e) {
            throw new ConnectionException(SqlErrorFormatter.format(e), e);
        }
        try {
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            new JdbcExecutor(connection).close();
            throw new ConnectionException(SqlErrorFormatter.format(e), e);
        }
        return new JdbcExecutor(connection);
    }

    String buildUrl(SessionSettings settings) {
        return urlTemplate
                .replace("{host}", nullToEmpty(settings.getHostname()))
                .replace("{port}", nullToEmpty(settings.getPort()))
                .replace("{database}", nullToEmpty(settings.getDatabase()))
                .replace("{protocol}", nullToEmpty(settings.getProtocol()));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
