package com.sqlshell.parser;

/**
 * 绘图模式
 *
 * 同时给出多个绘图选项时,声明顺序靠后的优先(INTERACTIVE最高)。
 */
public enum PlotMode {
    NONE,
    /** -pb */
    BAR,
    /** -pp */
    PIE,
    /** -pl */
    LINE,
    /** -i: 交给外部查看器 */
    INTERACTIVE;

    boolean outranks(PlotMode other) {
        return ordinal() > other.ordinal();
    }
}
