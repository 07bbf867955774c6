package com.sqlshell.parser;

import com.sqlshell.CommonConstant;

import java.util.List;
import java.util.regex.Pattern;

/**
 * StatementSplitter - 语句拆分
 *
 * 块输入的处理顺序:
 * 1. 逐行去掉行注释(从 "--" 到行尾)
 * 2. 换行替换成空格
 * 3. 按分隔符切分,保留顺序
 *
 * 单行输入不切分,整行就是一条语句。
 * 切出来的空白片段原样保留,由分类阶段跳过。
 */
public class StatementSplitter {

    private static final Pattern LINE_COMMENT =
            Pattern.compile(Pattern.quote(CommonConstant.LINE_COMMENT) + ".*$", Pattern.MULTILINE);

    private static final Pattern LINE_BREAK = Pattern.compile("\r\n|\r|\n");

    /**
     * 拆分块输入
     *
     * @param block 多行文本
     * @param delimiter 分隔符
     * @return 按出现顺序排列的原始片段
     */
    public List<String> split(String block, char delimiter) {
        if (block == null) {
            return List.of();
        }
        String uncommented = LINE_COMMENT.matcher(block).replaceAll("");
        String flattened = LINE_BREAK.matcher(uncommented).replaceAll(" ");
        return List.of(flattened.split(Pattern.quote(String.valueOf(delimiter)), -1));
    }

    /**
     * 单行输入: 不切分
     *
     * @param line 去掉选项后的行
     * @return 只有一个元素
     */
    public List<String> splitLine(String line) {
        return List.of(line == null ? "" : line);
    }
}
