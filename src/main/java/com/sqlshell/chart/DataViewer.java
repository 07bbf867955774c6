package com.sqlshell.chart;

import com.sqlshell.result.QueryResult;

/**
 * 交互式数据查看器(-i 选项),拿到的是未截断的完整结果
 */
public interface DataViewer {

    void show(QueryResult result);
}
