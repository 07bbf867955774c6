package com.sqlshell.chart;

import com.sqlshell.result.QueryResult;

/**
 * 图表渲染能力
 *
 * 第一列作为标签,第二列作为数值;只有一列时用行号作标签。
 */
public interface ChartRenderer {

    /**
     * 渲染图表
     *
     * @param type 图表类型
     * @param result 完整结果集
     * @throws ChartException 数据无法绘制
     */
    void render(ChartType type, QueryResult result);
}
