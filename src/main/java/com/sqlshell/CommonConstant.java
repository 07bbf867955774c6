package com.sqlshell;

/**
 * 全局常量
 */
public final class CommonConstant {

    private CommonConstant() {
    }

    /** 配置文件(classpath) */
    public static final String CONFIG_RESOURCE = "sqlshell.properties";

    /** 默认语句分隔符 */
    public static final char DEFAULT_DELIMITER = ';';

    /** -d 选项启用的分隔符,用于存储过程、触发器等包含分号的脚本 */
    public static final char SCRIPT_DELIMITER = '@';

    /** 行注释标记 */
    public static final String LINE_COMMENT = "--";

    /** 交互提示符 */
    public static final String PROMPT = "sql> ";

    /** 块输入的起始标记,同一行的其余部分是选项 */
    public static final String BLOCK_MARKER = "%%";

    /** 密码占位符,出现时改为隐藏输入 */
    public static final String PASSWORD_PLACEHOLDER = "?";

    /** 表示不限制显示行数 */
    public static final int UNLIMITED_ROWS = -1;

    public static final String COMMAND_COMPLETED = "Command completed.";
}
