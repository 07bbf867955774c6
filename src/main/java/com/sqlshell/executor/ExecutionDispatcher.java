package com.sqlshell.executor;

import com.sqlshell.CommonConstant;
import com.sqlshell.chart.ChartException;
import com.sqlshell.chart.ChartRenderer;
import com.sqlshell.chart.ChartType;
import com.sqlshell.chart.DataViewer;
import com.sqlshell.parser.InvocationOptions;
import com.sqlshell.parser.PlotMode;
import com.sqlshell.parser.Statement;
import com.sqlshell.parser.StatementClassifier;
import com.sqlshell.result.QueryResult;
import com.sqlshell.session.Session;
import com.sqlshell.shell.MessagePrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * ExecutionDispatcher - 执行分派器
 *
 * 对每条语句按固定优先级选择执行方式,各分支互斥:
 * <pre>
 * 计时(-t) → 绘图(-pb/-pp/-pl/-i) → 查询: JSON(-j) → 数组(-r) → 表格
 *                                  → 命令
 * </pre>
 *
 * 批次语义:
 * - 语句严格按顺序执行,后面的DDL/DML可能依赖前面的语句
 * - 单条语句失败只报告错误,其余语句继续执行,已执行的语句由驱动autocommit提交
 * - 只返回最后一条语句的结果,中间查询的结果在产生副作用后丢弃
 * - 块输入不逐条确认,结束时如果没有任何输出,只打印一次 "Command completed."
 */
public class ExecutionDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionDispatcher.class);

    private final Session session;
    private final StatementClassifier classifier;
    private final JsonRowFormatter jsonFormatter;
    private final ChartRenderer chartRenderer;
    private final DataViewer dataViewer;
    private final MessagePrinter printer;
    private final Duration timerDuration;

    public ExecutionDispatcher(Session session,
                               StatementClassifier classifier,
                               JsonRowFormatter jsonFormatter,
                               ChartRenderer chartRenderer,
                               DataViewer dataViewer,
                               MessagePrinter printer,
                               Duration timerDuration) {
        if (session == null || classifier == null || jsonFormatter == null
                || chartRenderer == null || dataViewer == null || printer == null) {
            throw new IllegalArgumentException("Dispatcher collaborators cannot be null");
        }
        if (timerDuration == null || timerDuration.isNegative() || timerDuration.isZero()) {
            throw new IllegalArgumentException("Timer duration must be positive");
        }
        this.session = session;
        this.classifier = classifier;
        this.jsonFormatter = jsonFormatter;
        this.chartRenderer = chartRenderer;
        this.dataViewer = dataViewer;
        this.printer = printer;
        this.timerDuration = timerDuration;
    }

    /**
     * 依次执行一批语句
     *
     * @param fragments 拆分得到的原始片段(空白片段跳过)
     * @param options 本次调用的选项
     * @param blockForm 是否为块输入
     * @return 最后一条语句的结果;没有可执行的语句时为NONE
     */
    public ExecutionResult dispatch(List<String> fragments, InvocationOptions options, boolean blockForm) {
        ExecutionResult last = ExecutionResult.none();
        boolean output = false;
        boolean succeeded = false;

        for (String fragment : fragments) {
            Statement statement = classifier.classify(fragment, options.getResultShape());
            if (statement == null) {
                continue;
            }
            logger.debug("执行 {}", statement);

            last = execute(statement, options, blockForm);
            output |= last.producedOutput();
            succeeded |= !last.isFailed();
        }

        if (blockForm && succeeded && !output) {
            printer.success(CommonConstant.COMMAND_COMPLETED);
        }
        return last;
    }

    /**
     * 执行单条语句,错误在这里捕获并报告
     */
    ExecutionResult execute(Statement statement, InvocationOptions options, boolean blockForm) {
        try {
            if (options.isTimer()) {
                return runTimed(statement, options);
            }
            if (options.getPlotMode() != PlotMode.NONE) {
                return runPlot(statement, options.getPlotMode());
            }
            if (statement.isQuery()) {
                if (options.isJson()) {
                    return runJson(statement);
                }
                if (options.isReturnArray()) {
                    return ExecutionResult.rows(executor().runQuery(statement.getSql()).toArray());
                }
                int limit = options.isAllRows() ? CommonConstant.UNLIMITED_ROWS : session.getSettings().getMaxrows();
                return ExecutionResult.table(executor().runQuery(statement.getSql()), limit);
            }
            return runCommand(statement, options, blockForm);
        } catch (StatementException | MalformedJsonException | ChartException e) {
            logger.debug("语句执行失败: {}", statement, e);
            printer.error(e.getMessage());
            return ExecutionResult.failed(e.getMessage());
        }
    }

    /**
     * 在固定时长内反复执行,返回完成的次数
     */
    private ExecutionResult runTimed(Statement statement, InvocationOptions options) {
        Executor executor = executor();
        long deadline = System.nanoTime() + timerDuration.toNanos();
        int count = 0;
        while (System.nanoTime() < deadline) {
            if (statement.isQuery()) {
                executor.runQuery(statement.getSql());
            } else {
                executor.runCommand(statement.getSql());
            }
            count++;
        }

        if (!options.isQuiet()) {
            printer.success("Total iterations in " + formatSeconds(timerDuration) + " second(s): " + count);
        }
        return ExecutionResult.iterations(count);
    }

    private ExecutionResult runPlot(Statement statement, PlotMode mode) {
        QueryResult result = executor().runQuery(statement.getSql());
        switch (mode) {
            case BAR:
                chartRenderer.render(ChartType.BAR, result);
                break;
            case PIE:
                chartRenderer.render(ChartType.PIE, result);
                break;
            case LINE:
                chartRenderer.render(ChartType.LINE, result);
                break;
            case INTERACTIVE:
                dataViewer.show(result);
                break;
            default:
                throw new IllegalStateException("Unexpected plot mode: " + mode);
        }
        return ExecutionResult.plot();
    }

    /**
     * 只格式化第一列;多行之间空一行,每行前输出行号
     */
    private ExecutionResult runJson(Statement statement) {
        QueryResult result = executor().runQuery(statement.getSql());
        if (result.getColumnCount() == 0) {
            throw new MalformedJsonException("Statement returned no columns to format as JSON");
        }

        int rowCount = 0;
        for (List<Object> row : result.getRows()) {
            Object value = row.get(0);
            String formatted = jsonFormatter.format(value == null ? null : value.toString());
            rowCount++;
            if (rowCount > 1) {
                printer.println();
            }
            printer.println("Row: " + rowCount);
            printer.println(formatted);
        }
        return ExecutionResult.json(rowCount);
    }

    private ExecutionResult runCommand(Statement statement, InvocationOptions options, boolean blockForm) {
        executor().runCommand(statement.getSql());
        if (!blockForm && !options.isQuiet()) {
            printer.success(CommonConstant.COMMAND_COMPLETED);
        }
        return ExecutionResult.command();
    }

    private Executor executor() {
        return session.getExecutor();
    }

    static String formatSeconds(Duration duration) {
        long millis = duration.toMillis();
        if (millis % 1000 == 0) {
            return String.valueOf(millis / 1000);
        }
        return String.valueOf(millis / 1000.0);
    }
}
