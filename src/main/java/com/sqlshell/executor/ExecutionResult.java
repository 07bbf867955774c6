package com.sqlshell.executor;

import com.sqlshell.result.QueryResult;

import java.util.List;

/**
 * ExecutionResult - 一条语句(或一次调用)的结果
 *
 * 一次调用只把最后一条语句的结果返回给调用方。
 *
 * <pre>
 * TABLE       普通查询,带列名的表格,displayLimit为显示行数
 * ROWS        -r 选项,不带列名的嵌套列表
 * ITERATIONS  -t 选项,计时内的执行次数
 * JSON        -j 选项,已打印,value为打印的行数
 * PLOT        绘图或交给查看器,没有文本返回值
 * COMMAND     命令执行成功
 * FAILED      执行失败,错误已报告
 * NONE        没有执行任何语句(帮助、CONNECT、空输入)
 * </pre>
 */
public class ExecutionResult {

    public enum Kind {
        TABLE, ROWS, ITERATIONS, JSON, PLOT, COMMAND, FAILED, NONE
    }

    private static final ExecutionResult NONE = new ExecutionResult(Kind.NONE, null, 0, null);
    private static final ExecutionResult COMMAND = new ExecutionResult(Kind.COMMAND, null, 0, null);
    private static final ExecutionResult PLOT = new ExecutionResult(Kind.PLOT, null, 0, null);

    private final Kind kind;
    private final Object value;
    private final int displayLimit;
    private final String error;

    private ExecutionResult(Kind kind, Object value, int displayLimit, String error) {
        this.kind = kind;
        this.value = value;
        this.displayLimit = displayLimit;
        this.error = error;
    }

    public static ExecutionResult table(QueryResult result, int displayLimit) {
        return new ExecutionResult(Kind.TABLE, result, displayLimit, null);
    }

    public static ExecutionResult rows(List<List<Object>> rows) {
        return new ExecutionResult(Kind.ROWS, rows, 0, null);
    }

    public static ExecutionResult iterations(int count) {
        return new ExecutionResult(Kind.ITERATIONS, count, 0, null);
    }

    public static ExecutionResult json(int rowCount) {
        return new ExecutionResult(Kind.JSON, rowCount, 0, null);
    }

    public static ExecutionResult plot() {
        return PLOT;
    }

    public static ExecutionResult command() {
        return COMMAND;
    }

    public static ExecutionResult failed(String error) {
        return new ExecutionResult(Kind.FAILED, null, 0, error);
    }

    public static ExecutionResult none() {
        return NONE;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * 表格结果
     *
     * @throws IllegalStateException 不是TABLE
     */
    public QueryResult getTable() {
        requireKind(Kind.TABLE);
        return (QueryResult) value;
    }

    public int getDisplayLimit() {
        return displayLimit;
    }

    @SuppressWarnings("unchecked")
    public List<List<Object>> getRows() {
        requireKind(Kind.ROWS);
        return (List<List<Object>>) value;
    }

    public int getIterations() {
        requireKind(Kind.ITERATIONS);
        return (Integer) value;
    }

    public int getJsonRowCount() {
        requireKind(Kind.JSON);
        return (Integer) value;
    }

    public String getError() {
        return error;
    }

    public boolean isFailed() {
        return kind == Kind.FAILED;
    }

    /**
     * 是否已经产生了输出(表格、数组、JSON、图表、计时)
     */
    public boolean producedOutput() {
        return kind != Kind.COMMAND && kind != Kind.FAILED && kind != Kind.NONE;
    }

    private void requireKind(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Result is " + kind + ", not " + expected);
        }
    }

    @Override
    public String toString() {
        return "ExecutionResult{" + kind + (error != null ? ", error=" + error : "") + "}";
    }
}
