package com.sqlshell.chart;

/**
 * ChartException - 结果集无法绘制成图表
 */
public class ChartException extends RuntimeException {

    public ChartException(String message) {
        super(message);
    }
}
