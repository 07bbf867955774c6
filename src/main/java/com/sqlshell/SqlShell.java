package com.sqlshell;

import com.sqlshell.chart.ConsoleDataViewer;
import com.sqlshell.chart.TextChartRenderer;
import com.sqlshell.config.ShellConfig;
import com.sqlshell.connection.ConnectionManager;
import com.sqlshell.connection.ConsolePromptProvider;
import com.sqlshell.connection.JsonFileSettingsStore;
import com.sqlshell.executor.ExecutionDispatcher;
import com.sqlshell.executor.JdbcExecutorFactory;
import com.sqlshell.executor.JsonRowFormatter;
import com.sqlshell.parser.OptionParser;
import com.sqlshell.parser.StatementClassifier;
import com.sqlshell.parser.StatementSplitter;
import com.sqlshell.sample.SampleDataLoader;
import com.sqlshell.session.Session;
import com.sqlshell.shell.HelpPrinter;
import com.sqlshell.shell.MessagePrinter;
import com.sqlshell.shell.Shell;
import com.sqlshell.shell.SqlFrontEnd;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

/**
 * SQL Shell - 主入口
 *
 * <pre>
 * java -jar sql-shell.jar              交互模式
 * java -jar sql-shell.jar script.sql   把文件作为一个语句块执行后退出
 * </pre>
 *
 * 组件装配顺序:
 * ShellConfig → Session → ConnectionManager → ExecutionDispatcher → SqlFrontEnd → Shell
 */
public class SqlShell {

    private static final Logger logger = LoggerFactory.getLogger(SqlShell.class);

    public static void main(String[] args) throws IOException {
        ShellConfig config = ShellConfig.load();
        PrintStream out = System.out;
        MessagePrinter printer = new MessagePrinter(out);
        HelpPrinter help = new HelpPrinter(printer, config);

        try (Terminal terminal = TerminalBuilder.builder().system(true).build();
             Session session = new Session(config.defaultSettings())) {
            LineReader reader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .appName("sqlshell")
                    .history(new DefaultHistory())
                    .build();

            ConnectionManager connectionManager = new ConnectionManager(session,
                    new JdbcExecutorFactory(config),
                    new JsonFileSettingsStore(config.getSettingsFile()),
                    new ConsolePromptProvider(reader),
                    help,
                    printer,
                    config);
            connectionManager.loadSettings();

            ExecutionDispatcher dispatcher = new ExecutionDispatcher(session,
                    new StatementClassifier(),
                    new JsonRowFormatter(),
                    new TextChartRenderer(out),
                    new ConsoleDataViewer(out),
                    printer,
                    config.getTimerDuration());

            SqlFrontEnd frontEnd = new SqlFrontEnd(session,
                    new OptionParser(),
                    new StatementSplitter(),
                    dispatcher,
                    connectionManager,
                    new SampleDataLoader(printer),
                    help);
            Shell shell = new Shell(frontEnd, reader, printer);

            if (args.length > 0) {
                logger.info("执行脚本: {}", args[0]);
                String script = Files.readString(Paths.get(args[0]), StandardCharsets.UTF_8);
                shell.display(frontEnd.execute("", script));
                return;
            }

            printer.success("SQL Shell loaded. Type ? for help, exit to quit.");
            shell.run();
        }
    }
}
