package com.sqlshell.shell;

import com.sqlshell.connection.ConnectionManager;
import com.sqlshell.executor.ExecutionDispatcher;
import com.sqlshell.executor.ExecutionResult;
import com.sqlshell.parser.InvocationOptions;
import com.sqlshell.parser.OptionParser;
import com.sqlshell.parser.ParsedLine;
import com.sqlshell.parser.StatementSplitter;
import com.sqlshell.sample.SampleDataLoader;
import com.sqlshell.session.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * SqlFrontEnd - 一次调用的入口
 *
 * 两种形式:
 * - 单行: execute("-q SELECT * FROM T", null),选项和一条语句在同一行
 * - 块:   execute("-d", "stmt1 @ stmt2 @"),行中只有选项,块中的语句按分隔符拆分
 *
 * 流程:
 * <pre>
 * 帮助("?" / "? CONNECT" / 空输入) → 返回
 * 解析选项 → CONNECT ? 交给ConnectionManager后返回
 * 确保已连接 → -sampledata ? 加载示例数据后返回
 * 拆分 → 分类 → 分派 → 返回最后一条语句的结果
 * </pre>
 *
 * 调用之间串行执行,共享同一个连接。
 */
public class SqlFrontEnd {

    private static final Logger logger = LoggerFactory.getLogger(SqlFrontEnd.class);

    private final Session session;
    private final OptionParser optionParser;
    private final StatementSplitter splitter;
    private final ExecutionDispatcher dispatcher;
    private final ConnectionManager connectionManager;
    private final SampleDataLoader sampleDataLoader;
    private final HelpPrinter help;

    public SqlFrontEnd(Session session,
                       OptionParser optionParser,
                       StatementSplitter splitter,
                       ExecutionDispatcher dispatcher,
                       ConnectionManager connectionManager,
                       SampleDataLoader sampleDataLoader,
                       HelpPrinter help) {
        this.session = session;
        this.optionParser = optionParser;
        this.splitter = splitter;
        this.dispatcher = dispatcher;
        this.connectionManager = connectionManager;
        this.sampleDataLoader = sampleDataLoader;
        this.help = help;
    }

    /**
     * 执行一次调用
     *
     * @param line 选项行(单行形式时还包含语句)
     * @param block 块内容,单行形式为null
     * @return 最后一条语句的结果;帮助、CONNECT、未连接时为NONE
     */
    public synchronized ExecutionResult execute(String line, String block) {
        String parms = line == null ? "" : line.trim();

        if (parms.isEmpty() && (block == null || block.isBlank())) {
            help.printOptionsHelp();
            return ExecutionResult.none();
        }
        if (parms.equals("?")) {
            help.printOptionsHelp();
            return ExecutionResult.none();
        }
        if (isConnectHelp(parms)) {
            help.printConnectionHelp();
            return ExecutionResult.none();
        }

        ParsedLine parsed = optionParser.parse(parms);
        if (parsed.isConnect()) {
            connectionManager.connect(parsed.getRemainder());
            return ExecutionResult.none();
        }

        if (!connectionManager.ensureConnected()) {
            return ExecutionResult.none();
        }

        InvocationOptions options = parsed.getOptions();
        if (options.isSampleData()) {
            sampleDataLoader.load(session.getExecutor(), options.isQuiet());
            return ExecutionResult.none();
        }

        List<String> fragments;
        if (block == null) {
            fragments = splitter.splitLine(parsed.getRemainder());
        } else {
            if (!parsed.getRemainder().isEmpty()) {
                logger.debug("块输入时忽略选项行中的文本: {}", parsed.getRemainder());
            }
            fragments = splitter.split(block, options.getDelimiter());
        }
        return dispatcher.dispatch(fragments, options, block != null);
    }

    private static boolean isConnectHelp(String parms) {
        String[] words = parms.split("\\s+");
        return words.length == 2 && words[0].equals("?") && words[1].toUpperCase(Locale.ROOT).equals("CONNECT");
    }
}
