package com.sqlshell.chart;

import com.sqlshell.CommonConstant;
import com.sqlshell.result.QueryResult;

import java.io.PrintStream;

/**
 * 控制台下的查看器: 打印不截断的完整表格
 */
public class ConsoleDataViewer implements DataViewer {

    private final PrintStream out;

    public ConsoleDataViewer(PrintStream out) {
        this.out = out;
    }

    @Override
    public void show(QueryResult result) {
        out.println(result.render(CommonConstant.UNLIMITED_ROWS));
    }
}
