package com.sqlshell.parser;

import java.util.Locale;
import java.util.Set;

/**
 * StatementClassifier - 判断语句按查询还是按命令执行
 *
 * 规则(按顺序):
 * 1. FORCE_QUERY → 查询
 * 2. FORCE_COMMAND → 命令
 * 3. 首个单词(大写)属于 SELECT / WITH / VALUES → 查询,否则命令
 */
public class StatementClassifier {

    private static final Set<String> QUERY_KEYWORDS = Set.of("SELECT", "WITH", "VALUES");

    /**
     * 分类
     *
     * @param fragment 拆分得到的原始片段
     * @param shape 结果形态模式
     * @return 分类后的语句;片段为空白时返回null,调用方跳过
     */
    public Statement classify(String fragment, ResultShape shape) {
        if (fragment == null) {
            return null;
        }
        String sql = fragment.trim();
        if (sql.isEmpty()) {
            return null;
        }

        String keyword = sql.split("\\s+", 2)[0].toUpperCase(Locale.ROOT);

        Statement.Kind kind;
        switch (shape) {
            case FORCE_QUERY:
                kind = Statement.Kind.QUERY;
                break;
            case FORCE_COMMAND:
                kind = Statement.Kind.COMMAND;
                break;
            default:
                kind = QUERY_KEYWORDS.contains(keyword) ? Statement.Kind.QUERY : Statement.Kind.COMMAND;
        }
        return new Statement(sql, keyword, kind);
    }
}
