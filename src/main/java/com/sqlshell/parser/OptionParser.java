package com.sqlshell.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * OptionParser - 行首选项解析器
 *
 * 从行首开始按空白切分token,依次识别选项表中的token,
 * 遇到第一个不是选项的token即停止,该token开始的原文逐字作为剩余文本返回。
 *
 * 选项可以重复、可以任意顺序:
 * <pre>
 * "-q -d -q SELECT * FROM T"  →  quiet, delimiter='@', remainder="SELECT * FROM T"
 * "SELECT '-q' FROM T"        →  没有选项, remainder原样返回
 * </pre>
 *
 * 只扫描前缀: SQL字面量里的 "-q" 之类不会被当作选项。
 */
public class OptionParser {

    private static final Logger logger = LoggerFactory.getLogger(OptionParser.class);

    /**
     * 解析一行输入
     *
     * @param line 原始行(null视为空串)
     * @return 选项与剩余文本
     */
    public ParsedLine parse(String line) {
        InvocationOptions options = new InvocationOptions();
        if (line == null) {
            return new ParsedLine(options, "");
        }

        int pos = 0;
        int length = line.length();
        while (true) {
            while (pos < length && Character.isWhitespace(line.charAt(pos))) {
                pos++;
            }
            if (pos >= length) {
                return logged(new ParsedLine(options, ""));
            }

            int end = pos;
            while (end < length && !Character.isWhitespace(line.charAt(end))) {
                end++;
            }

            Optional<OptionFlag> flag = OptionFlag.fromToken(line.substring(pos, end));
            if (flag.isEmpty()) {
                return logged(new ParsedLine(options, line.substring(pos)));
            }
            flag.get().applyTo(options);
            pos = end;
        }
    }

    private ParsedLine logged(ParsedLine parsed) {
        logger.debug("选项解析完成: {}", parsed.getOptions());
        return parsed;
    }
}
