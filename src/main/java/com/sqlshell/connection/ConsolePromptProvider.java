package com.sqlshell.connection;

import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.UserInterruptException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 基于JLine的提示输入,密码以 '*' 回显
 *
 * Ctrl-C / Ctrl-D 视为空输入,即采用默认值。
 */
public class ConsolePromptProvider implements PromptProvider {

    private static final Logger logger = LoggerFactory.getLogger(ConsolePromptProvider.class);

    private static final char MASK = '*';

    private final LineReader reader;

    public ConsolePromptProvider(LineReader reader) {
        if (reader == null) {
            throw new IllegalArgumentException("LineReader cannot be null");
        }
        this.reader = reader;
    }

    @Override
    public String prompt(String message) {
        return read(message, null);
    }

    @Override
    public String promptMasked(String message) {
        return read(message, MASK);
    }

    private String read(String message, Character mask) {
        try {
            String line = reader.readLine(message, mask);
            return line == null ? "" : line.trim();
        } catch (UserInterruptException | EndOfFileException e) {
            logger.debug("输入被中断,使用默认值");
            return "";
        }
    }
}
