package com.sqlshell.executor;

import java.util.regex.Pattern;

/**
 * 驱动错误信息的整理
 *
 * <pre>
 * "[IBM][CLI Driver][DB2/LINUXX8664] SQL0204N "T" is an undefined name."  →  "SQL0204N "T" is an undefined name."
 * "DB2 SQL Error: SQLCODE=-204, SQLSTATE=42704, DRIVER=4.33.31"           →  "DB2 SQL Error: SQLCODE=-204, SQLSTATE=42704"
 * "Table "T" not found; SQL statement: SELECT * FROM T [42102-224]"        →  "Table "T" not found; SQL statement: SELECT * FROM T"
 * </pre>
 */
public final class SqlErrorFormatter {

    private static final Pattern LINE_BREAKS = Pattern.compile("[\r\n]+");
    private static final Pattern LEADING_BRACKETS = Pattern.compile("^(\\s*\\[[^\\]]*\\])+");
    private static final Pattern TRAILING_BRACKET = Pattern.compile("\\s*\\[[^\\]]*\\]\\s*$");
    private static final Pattern DRIVER_VERSION = Pattern.compile(",?\\s*DRIVER=\\S+");
    private static final Pattern SPACES = Pattern.compile("\\s{2,}");

    private SqlErrorFormatter() {
    }

    /**
     * 整理异常信息
     *
     * @param error 驱动抛出的异常
     * @return 可读信息,整理后为空时返回异常类名
     */
    public static String format(Throwable error) {
        String message = error.getMessage();
        if (message == null) {
            return error.getClass().getSimpleName();
        }
        String formatted = format(message);
        return formatted.isEmpty() ? error.getClass().getSimpleName() : formatted;
    }

    static String format(String message) {
        String text = LINE_BREAKS.matcher(message).replaceAll(" ");
        text = LEADING_BRACKETS.matcher(text).replaceFirst("");
        text = TRAILING_BRACKET.matcher(text).replaceFirst("");
        text = DRIVER_VERSION.matcher(text).replaceAll("");
        return SPACES.matcher(text).replaceAll(" ").trim();
    }
}
