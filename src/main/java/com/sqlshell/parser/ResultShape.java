package com.sqlshell.parser;

/**
 * 结果形态模式
 */
public enum ResultShape {
    /** 按首个关键字判断 */
    AUTO,
    /** -s: 全部按查询执行 */
    FORCE_QUERY,
    /** -n: 全部按命令执行,不取结果集 */
    FORCE_COMMAND
}
