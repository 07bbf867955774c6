package com.sqlshell.shell;

import com.sqlshell.CommonConstant;
import com.sqlshell.executor.ExecutionResult;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.UserInterruptException;

/**
 * Shell - 交互式命令行
 *
 * 输入约定:
 * - 普通一行: 单行形式,选项 + 一条语句
 * - 以 %% 开头的一行: 块形式,该行其余部分是选项,之后的各行直到空行为止是语句块
 * - exit / quit: 退出
 *
 * Ctrl-C 放弃当前输入,Ctrl-D 退出。
 */
public class Shell {

    private final SqlFrontEnd frontEnd;
    private final LineReader reader;
    private final MessagePrinter printer;

    public Shell(SqlFrontEnd frontEnd, LineReader reader, MessagePrinter printer) {
        this.frontEnd = frontEnd;
        this.reader = reader;
        this.printer = printer;
    }

    public void run() {
        while (true) {
            String line;
            try {
                line = reader.readLine(CommonConstant.PROMPT);
            } catch (UserInterruptException e) {
                continue;
            } catch (EndOfFileException e) {
                break;
            }

            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if ("exit".equalsIgnoreCase(trimmed) || "quit".equalsIgnoreCase(trimmed)) {
                break;
            }

            ExecutionResult result;
            if (trimmed.startsWith(CommonConstant.BLOCK_MARKER)) {
                String block;
                try {
                    block = readBlock();
                } catch (UserInterruptException e) {
                    continue;
                } catch (EndOfFileException e) {
                    break;
                }
                result = frontEnd.execute(trimmed.substring(CommonConstant.BLOCK_MARKER.length()), block);
            } else {
                result = frontEnd.execute(trimmed, null);
            }
            display(result);
        }
    }

    private String readBlock() {
        StringBuilder block = new StringBuilder();
        while (true) {
            String line = reader.readLine("... ");
            if (line.isBlank()) {
                return block.toString();
            }
            block.append(line).append('\n');
        }
    }

    /**
     * 显示调用的返回值: 表格按行数限制渲染,数组原样输出
     */
    public void display(ExecutionResult result) {
        switch (result.getKind()) {
            case TABLE:
                printer.println(result.getTable().render(result.getDisplayLimit()));
                break;
            case ROWS:
                printer.println(result.getRows().toString());
                break;
            default:
                break;
        }
        printer.flush();
    }
}
