package com.sqlshell.parser;

/**
 * Statement - 拆分后的一条SQL语句
 *
 * 只记录执行路径(查询或命令),不做语法分析。
 * 同一批次中的每条语句独立分类。
 */
public class Statement {

    /**
     * 执行路径
     */
    public enum Kind {
        /** 产生结果集 */
        QUERY,
        /** 只为副作用执行,不取结果集 */
        COMMAND
    }

    private final String sql;
    private final String keyword;
    private final Kind kind;

    public Statement(String sql, String keyword, Kind kind) {
        this.sql = sql;
        this.keyword = keyword;
        this.kind = kind;
    }

    /** 去掉首尾空白的语句文本 */
    public String getSql() {
        return sql;
    }

    /** 首个关键字(大写) */
    public String getKeyword() {
        return keyword;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isQuery() {
        return kind == Kind.QUERY;
    }

    @Override
    public String toString() {
        return kind + ": " + sql;
    }
}
