package com.sqlshell.connection;

import com.sqlshell.CommonConstant;
import com.sqlshell.config.ShellConfig;
import com.sqlshell.executor.Executor;
import com.sqlshell.executor.ExecutorFactory;
import com.sqlshell.session.Session;
import com.sqlshell.session.SessionSettings;
import com.sqlshell.shell.HelpPrinter;
import com.sqlshell.shell.MessagePrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * ConnectionManager - 连接管理
 *
 * 状态机:
 * <pre>
 *                 CONNECT ... / 自动连接 / 复用上次参数
 * Disconnected ------------------------------------------> Connected
 *      ^                                                      |
 *      +------------- CONNECT RESET / 重连失败 ----------------+
 * </pre>
 *
 * 连接总是在参数副本上尝试:
 * - 成功: 副本成为会话参数并持久化
 * - 失败: 报告错误,清空内存中的数据库名,下次连接时重新提示
 *
 * 所以会话参数里永远不会留下失败连接的参数。
 */
public class ConnectionManager {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionManager.class);

    private final Session session;
    private final ExecutorFactory executorFactory;
    private final SettingsStore settingsStore;
    private final PromptProvider prompts;
    private final HelpPrinter help;
    private final MessagePrinter printer;
    private final ShellConfig config;

    public ConnectionManager(Session session,
                             ExecutorFactory executorFactory,
                             SettingsStore settingsStore,
                             PromptProvider prompts,
                             HelpPrinter help,
                             MessagePrinter printer,
                             ShellConfig config) {
        if (session == null || executorFactory == null || settingsStore == null
                || prompts == null || help == null || printer == null || config == null) {
            throw new IllegalArgumentException("ConnectionManager collaborators cannot be null");
        }
        this.session = session;
        this.executorFactory = executorFactory;
        this.settingsStore = settingsStore;
        this.prompts = prompts;
        this.help = help;
        this.printer = printer;
        this.config = config;
    }

    /**
     * 启动时读取上次成功连接的参数,读取失败时保留默认值
     */
    public void loadSettings() {
        try {
            settingsStore.load().ifPresent(settings -> {
                session.setSettings(settings);
                logger.info("已加载上次的连接参数: {}", settings);
            });
        } catch (SettingsStoreException e) {
            logger.warn("读取连接参数失败,使用默认值: {}", e.getMessage());
        }
    }

    /**
     * 处理 CONNECT 语句
     *
     * @param directiveText 以 CONNECT 开头的文本
     */
    public void connect(String directiveText) {
        ConnectDirective directive;
        try {
            directive = ConnectDirective.parse(directiveText);
        } catch (ConfigurationException e) {
            printer.error(e.getMessage());
            return;
        }

        // CONNECT 总是先断开当前连接
        session.detach();

        if (directive.isReset()) {
            reset();
            return;
        }

        SessionSettings candidate = session.getSettings().copy();
        if (directive.isBare()) {
            logger.debug("CONNECT 没有参数,复用当前参数");
        }
        apply(directive, candidate);
        doConnect(candidate);
    }

    /**
     * 执行非CONNECT语句前确保已连接
     *
     * @return 是否已连接
     */
    public boolean ensureConnected() {
        if (session.isConnected()) {
            return true;
        }
        return doConnect(session.getSettings().copy());
    }

    /**
     * CONNECT RESET: 断开,恢复默认参数,删除持久化记录
     */
    public void reset() {
        session.detach();
        session.setSettings(config.defaultSettings());
        try {
            settingsStore.clear();
        } catch (SettingsStoreException e) {
            printer.error(e.getMessage());
        }
        printer.success("Connection reset.");
    }

    private void apply(ConnectDirective directive, SessionSettings candidate) {
        if (directive.getDatabase() != null) {
            candidate.setDatabase(directive.getDatabase());
        }
        if (directive.getUser() != null) {
            candidate.setUid(directive.getUser());
        }
        if (directive.getPassword() != null) {
            if (CommonConstant.PASSWORD_PLACEHOLDER.equals(directive.getPassword())) {
                candidate.setPwd(orDefault(prompts.promptMasked(passwordPrompt()), config.getDefaultPassword()));
            } else {
                candidate.setPwd(directive.getPassword());
            }
        }
        if (directive.getHost() != null) {
            candidate.setHostname(directive.getHost());
        }
        if (directive.getPort() != null) {
            candidate.setPort(directive.getPort());
        }
    }

    private boolean doConnect(SessionSettings candidate) {
        if (!candidate.hasDatabase()) {
            help.printConnectionHelp();
            promptForSettings(candidate);
        }

        logger.info("尝试连接: {}", candidate);
        try {
            Executor executor = executorFactory.connect(candidate);
            session.attach(executor, candidate);
        } catch (ConnectionException e) {
            logger.debug("连接失败", e);
            printer.error(e.getMessage());
            session.detach();
            session.getSettings().setDatabase("");
            return false;
        }

        try {
            settingsStore.save(candidate);
        } catch (SettingsStoreException e) {
            printer.error(e.getMessage());
        }
        printer.success("Connection successful.");
        return true;
    }

    private void promptForSettings(SessionSettings candidate) {
        String defaultDatabase = config.getDefaultDatabase();
        candidate.setDatabase(orDefault(
                prompts.prompt("Enter the database name [" + defaultDatabase + "]: "), defaultDatabase));

        String defaultHostPort = config.getDefaultHost() + ":" + config.getDefaultPort();
        String hostPort = orDefault(prompts.prompt(
                "Enter the HOST IP address and PORT in the form ip:port or #x:port [" + defaultHostPort + "]: "),
                defaultHostPort);
        HostAddress address = HostAddress.parse(hostPort, config.getContainerPrefix(), config.getDefaultPort());
        candidate.setHostname(address.getHost());
        candidate.setPort(address.getPort());

        String defaultUser = config.getDefaultUser();
        candidate.setUid(orDefault(
                prompts.prompt("Enter Userid on the database system [" + defaultUser + "]: "), defaultUser)
                .toUpperCase(Locale.ROOT));

        candidate.setPwd(orDefault(prompts.promptMasked(passwordPrompt()), config.getDefaultPassword()));

        int defaultMaxRows = config.getDefaultMaxRows();
        String maxRows = prompts.prompt("Maximum rows displayed [" + defaultMaxRows + "]: ");
        candidate.setMaxrows(defaultMaxRows);
        if (maxRows != null && !maxRows.isBlank()) {
            try {
                int rows = Integer.parseInt(maxRows.trim());
                // 正数或 -1(不限制)
                if (rows > 0 || rows == CommonConstant.UNLIMITED_ROWS) {
                    candidate.setMaxrows(rows);
                } else {
                    printer.error("Invalid number of rows: " + rows + ", using " + defaultMaxRows);
                }
            } catch (NumberFormatException e) {
                printer.error("Invalid number of rows: " + maxRows.trim() + ", using " + defaultMaxRows);
            }
        }
    }

    private String passwordPrompt() {
        return "Password [" + config.getDefaultPassword() + "]: ";
    }

    private static String orDefault(String value, String defaultValue) {
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }
}
