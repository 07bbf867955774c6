package com.sqlshell.chart;

import com.sqlshell.result.QueryResult;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * TextChartRenderer - 控制台字符图表
 *
 * 柱状图:
 * <pre>
 * SALARY by WORKDEPT
 * A00 | ######################################## 152750.0
 * B01 | ######################### 94250.0
 * </pre>
 *
 * 饼图按各标签占总和的百分比输出,折线图画在固定高度的字符网格上。
 */
public class TextChartRenderer implements ChartRenderer {

    private static final int DEFAULT_WIDTH = 40;
    private static final int LINE_HEIGHT = 10;

    private final PrintStream out;
    private final int width;

    public TextChartRenderer(PrintStream out) {
        this(out, DEFAULT_WIDTH);
    }

    public TextChartRenderer(PrintStream out, int width) {
        if (width <= 0) {
            throw new IllegalArgumentException("Chart width must be positive");
        }
        this.out = out;
        this.width = width;
    }

    @Override
    public void render(ChartType type, QueryResult result) {
        Series series = Series.of(result);
        switch (type) {
            case BAR:
                renderBar(series);
                break;
            case PIE:
                renderPie(series);
                break;
            case LINE:
                renderLine(series);
                break;
            default:
                throw new ChartException("Unsupported chart type: " + type);
        }
    }

    private void renderBar(Series series) {
        out.println(series.title());
        double max = 0;
        for (double v : series.values) {
            max = Math.max(max, Math.abs(v));
        }
        int labelWidth = series.labelWidth();
        for (int i = 0; i < series.size(); i++) {
            double v = series.values.get(i);
            int length = max == 0 ? 0 : (int) Math.round(Math.abs(v) / max * width);
            char mark = v < 0 ? '-' : '#';
            out.println(pad(series.labels.get(i), labelWidth) + " | "
                    + String.valueOf(mark).repeat(length) + " " + v);
        }
    }

    private void renderPie(Series series) {
        double total = 0;
        for (double v : series.values) {
            if (v < 0) {
                throw new ChartException("Pie chart cannot contain negative values: " + v);
            }
            total += v;
        }
        if (total == 0) {
            throw new ChartException("Pie chart needs at least one positive value");
        }

        out.println(series.valueTitle);
        int labelWidth = series.labelWidth();
        for (int i = 0; i < series.size(); i++) {
            double share = series.values.get(i) / total;
            int length = (int) Math.round(share * width);
            out.println(pad(series.labels.get(i), labelWidth) + " "
                    + String.format(Locale.ROOT, "%5.1f%%", share * 100) + " " + "*".repeat(length));
        }
    }

    private void renderLine(Series series) {
        out.println(series.title());
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (double v : series.values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }

        // 网格: 每个点占2列
        char[][] grid = new char[LINE_HEIGHT][series.size() * 2];
        for (char[] row : grid) {
            Arrays.fill(row, ' ');
        }
        for (int i = 0; i < series.size(); i++) {
            int level = max == min ? 0 : (int) Math.round((series.values.get(i) - min) / (max - min) * (LINE_HEIGHT - 1));
            grid[LINE_HEIGHT - 1 - level][i * 2] = '*';
        }

        String top = String.valueOf(max);
        String bottom = String.valueOf(min);
        int axisWidth = Math.max(top.length(), bottom.length());
        for (int r = 0; r < LINE_HEIGHT; r++) {
            String axis = r == 0 ? top : r == LINE_HEIGHT - 1 ? bottom : "";
            out.println(pad(axis, axisWidth) + " |" + new String(grid[r]).stripTrailing());
        }
        out.println(" ".repeat(axisWidth) + " +" + "-".repeat(series.size() * 2));

        List<String> legend = new ArrayList<>();
        for (int i = 0; i < series.size(); i++) {
            legend.add((i + 1) + "=" + series.labels.get(i));
        }
        out.println(series.labelTitle + ": " + String.join(", ", legend));
    }

    private static String pad(String text, int width) {
        return text.length() >= width ? text : text + " ".repeat(width - text.length());
    }

    /**
     * 从结果集抽出的标签/数值序列
     */
    static class Series {

        final String labelTitle;
        final String valueTitle;
        final List<String> labels = new ArrayList<>();
        final List<Double> values = new ArrayList<>();

        private Series(String labelTitle, String valueTitle) {
            this.labelTitle = labelTitle;
            this.valueTitle = valueTitle;
        }

        static Series of(QueryResult result) {
            if (result.getColumnCount() == 0 || result.getRowCount() == 0) {
                throw new ChartException("Nothing to plot: the result set is empty");
            }

            boolean labelled = result.getColumnCount() >= 2;
            int valueColumn = labelled ? 1 : 0;
            Series series = new Series(labelled ? result.getColumns().get(0) : "ROW",
                    result.getColumns().get(valueColumn));
            for (int i = 0; i < result.getRowCount(); i++) {
                Object label = labelled ? result.getValue(i, 0) : i;
                series.labels.add(label == null ? "NULL" : label.toString().trim());
                series.values.add(toDouble(result.getValue(i, valueColumn), series.valueTitle));
            }
            return series;
        }

        private static double toDouble(Object value, String column) {
            if (value == null) {
                return 0;
            }
            if (value instanceof Number) {
                return ((Number) value).doubleValue();
            }
            try {
                return Double.parseDouble(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new ChartException("Column " + column + " is not numeric: " + value);
            }
        }

        int size() {
            return values.size();
        }

        int labelWidth() {
            int w = 0;
            for (String label : labels) {
                w = Math.max(w, label.length());
            }
            return w;
        }

        String title() {
            return valueTitle + " by " + labelTitle;
        }
    }
}
