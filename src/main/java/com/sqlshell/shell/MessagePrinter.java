package com.sqlshell.shell;

import java.io.PrintStream;

/**
 * MessagePrinter - 面向用户的输出
 *
 * 提示信息由调用方根据quiet决定是否输出,错误信息总是输出。
 * 诊断日志走SLF4J,不经过这里。
 */
public class MessagePrinter {

    private static final String ERROR_PREFIX = "Error: ";

    private final PrintStream out;

    public MessagePrinter(PrintStream out) {
        if (out == null) {
            throw new IllegalArgumentException("Output stream cannot be null");
        }
        this.out = out;
    }

    public PrintStream getOut() {
        return out;
    }

    /** 提示信息 */
    public void success(String message) {
        out.println(message);
    }

    /** 错误信息 */
    public void error(String message) {
        out.println(ERROR_PREFIX + message);
    }

    public void println(String text) {
        out.println(text);
    }

    public void println() {
        out.println();
    }

    public void flush() {
        out.flush();
    }
}
