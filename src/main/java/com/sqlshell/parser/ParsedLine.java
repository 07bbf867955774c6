package com.sqlshell.parser;

/**
 * 选项解析结果: 选项 + 去掉选项后的原文
 */
public class ParsedLine {

    private static final String CONNECT = "CONNECT";

    private final InvocationOptions options;
    private final String remainder;

    public ParsedLine(InvocationOptions options, String remainder) {
        this.options = options;
        this.remainder = remainder;
    }

    public InvocationOptions getOptions() {
        return options;
    }

    /**
     * 第一个非选项token开始的原文,逐字保留
     */
    public String getRemainder() {
        return remainder;
    }

    /**
     * 剩余文本的第一个单词是否为 CONNECT(不区分大小写)
     */
    public boolean isConnect() {
        String[] words = remainder.trim().split("\\s+", 2);
        return CONNECT.equalsIgnoreCase(words[0]);
    }
}
