package com.sqlshell.result;

import com.sqlshell.CommonConstant;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * QueryResult - 查询结果集
 *
 * 列名 + 全部行数据,一次取完后不可修改。
 * 显示时按最大行数截断,超出部分只显示首尾,中间用 "..." 代替。
 *
 * 输出示例(maxRows=4, 共6行):
 * <pre>
 * +-----+-------+
 * | ID  | NAME  |
 * +-----+-------+
 * | 1   | Alice |
 * | 2   | Bob   |
 * | ... | ...   |
 * | 5   | Eve   |
 * | 6   | Frank |
 * +-----+-------+
 * [6 rows x 2 columns]
 * </pre>
 */
public class QueryResult {

    private static final String NULL_TEXT = "NULL";
    private static final String ELLIPSIS = "...";

    /** 列名 */
    private final List<String> columns;

    /** 行数据,每行一个有序列值列表(允许null) */
    private final List<List<Object>> rows;

    /**
     * 创建查询结果集
     *
     * @param columns 列名
     * @param rows 行数据
     */
    public QueryResult(List<String> columns, List<List<Object>> rows) {
        if (columns == null) {
            throw new IllegalArgumentException("Columns cannot be null");
        }
        if (rows == null) {
            throw new IllegalArgumentException("Rows cannot be null");
        }

        this.columns = List.copyOf(columns);
        List<List<Object>> copied = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            if (row.size() != columns.size()) {
                throw new IllegalArgumentException(
                        "Column count mismatch: columns=" + columns.size() + ", values=" + row.size());
            }
            copied.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copied);
    }

    /**
     * 没有列也没有行的结果(例如强制按查询执行了一条不返回结果集的语句)
     */
    public static QueryResult empty() {
        return new QueryResult(List.of(), List.of());
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<List<Object>> getRows() {
        return rows;
    }

    public int getRowCount() {
        return rows.size();
    }

    public int getColumnCount() {
        return columns.size();
    }

    /**
     * 取某行某列的值
     *
     * @param row 行号(从0开始)
     * @param column 列号(从0开始)
     * @return 列值,可能为null
     */
    public Object getValue(int row, int column) {
        return rows.get(row).get(column);
    }

    /**
     * 行数据的可变拷贝,不带列名(-r 选项的返回值)
     *
     * @return 新的嵌套列表
     */
    public List<List<Object>> toArray() {
        List<List<Object>> array = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            array.add(new ArrayList<>(row));
        }
        return array;
    }

    /**
     * 格式化为表格
     *
     * @param maxRows 最多显示的行数,{@link CommonConstant#UNLIMITED_ROWS} 或其他负数表示全部显示
     * @return 表格文本
     */
    public String render(int maxRows) {
        if (columns.isEmpty()) {
            return "Empty result";
        }
        if (rows.isEmpty()) {
            return "Empty set";
        }

        List<String[]> visible = new ArrayList<>();
        boolean truncated = maxRows >= 0 && rows.size() > maxRows;
        if (truncated) {
            int tail = maxRows / 2;
            int head = maxRows - tail;
            for (int i = 0; i < head; i++) {
                visible.add(toText(rows.get(i)));
            }
            String[] gap = new String[columns.size()];
            Arrays.fill(gap, ELLIPSIS);
            visible.add(gap);
            for (int i = rows.size() - tail; i < rows.size(); i++) {
                visible.add(toText(rows.get(i)));
            }
        } else {
            for (List<Object> row : rows) {
                visible.add(toText(row));
            }
        }

        // 计算每列的最大宽度
        int[] columnWidths = new int[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            columnWidths[i] = columns.get(i).length();
        }
        for (String[] row : visible) {
            for (int i = 0; i < row.length; i++) {
                columnWidths[i] = Math.max(columnWidths[i], row[i].length());
            }
        }

        String separator = buildSeparator(columnWidths);

        StringBuilder sb = new StringBuilder();
        sb.append(separator).append("\n");
        appendLine(sb, columns.toArray(new String[0]), columnWidths);
        sb.append(separator).append("\n");
        for (String[] row : visible) {
            appendLine(sb, row, columnWidths);
        }
        sb.append(separator).append("\n");

        if (truncated) {
            sb.append("[").append(rows.size()).append(" rows x ").append(columns.size()).append(" columns]");
        } else {
            sb.append(rows.size()).append(" row").append(rows.size() > 1 ? "s" : "").append(" in set");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return render(CommonConstant.UNLIMITED_ROWS);
    }

    private String[] toText(List<Object> row) {
        String[] text = new String[row.size()];
        for (int i = 0; i < row.size(); i++) {
            Object value = row.get(i);
            text[i] = value != null ? value.toString() : NULL_TEXT;
        }
        return text;
    }

    private void appendLine(StringBuilder sb, String[] cells, int[] columnWidths) {
        sb.append("| ");
        for (int i = 0; i < cells.length; i++) {
            sb.append(padRight(cells[i], columnWidths[i]));
            sb.append(" | ");
        }
        sb.append("\n");
    }

    private String buildSeparator(int[] columnWidths) {
        StringBuilder sb = new StringBuilder("+");
        for (int width : columnWidths) {
            sb.append("-".repeat(width + 2));
            sb.append("+");
        }
        return sb.toString();
    }

    private String padRight(String str, int width) {
        if (str.length() >= width) {
            return str;
        }
        return str + " ".repeat(width - str.length());
    }
}
