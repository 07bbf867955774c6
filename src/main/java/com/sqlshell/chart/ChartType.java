package com.sqlshell.chart;

/**
 * 图表类型
 */
public enum ChartType {
    BAR, PIE, LINE
}
