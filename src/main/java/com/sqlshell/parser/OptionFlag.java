package com.sqlshell.parser;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * OptionFlag - 选项表
 *
 * 每个选项是一个完整的空白分隔token,只做整词匹配,
 * 所以出现在SQL文本内部的 "-d"、"-t" 等子串不会被误识别。
 */
public enum OptionFlag {

    DELIMITER("-d", "Change SQL delimiter to \"@\" from \";\"", InvocationOptions::useScriptDelimiter),
    QUIET("-q", "Quiet results - no messages returned from the function", InvocationOptions::setQuiet),
    NO_RESULT_SET("-n", "Execute all of the SQL as commands rather than select statements (no answer sets)",
            InvocationOptions::forceCommand),
    SELECT("-s", "Execute everything as SELECT statements", InvocationOptions::forceQuery),
    RETURN_ARRAY("-r", "Return the result set as an array of values", InvocationOptions::setReturnArray),
    TIMER("-t", "Time the SQL statement and return the number of times it executes in the time limit",
            InvocationOptions::setTimer),
    JSON("-j", "Create a pretty JSON representation. Only the first column is formatted",
            InvocationOptions::setJson),
    ALL_ROWS("-a", "Return all rows in answer set and do not limit display", InvocationOptions::setAllRows),
    PLOT_BAR("-pb", "Plot the results as a bar chart", o -> o.requestPlot(PlotMode.BAR)),
    PLOT_PIE("-pp", "Plot the results as a pie chart", o -> o.requestPlot(PlotMode.PIE)),
    PLOT_LINE("-pl", "Plot the results as a line chart", o -> o.requestPlot(PlotMode.LINE)),
    INTERACTIVE("-i", "Hand the result to the interactive data viewer", o -> o.requestPlot(PlotMode.INTERACTIVE)),
    SAMPLE_DATA("-sampledata", "Create and load the EMPLOYEE and DEPARTMENT tables",
            InvocationOptions::setSampleData);

    private static final Map<String, OptionFlag> BY_TOKEN = Arrays.stream(values())
            .collect(Collectors.toMap(OptionFlag::getToken, Function.identity()));

    private final String token;
    private final String description;
    private final Consumer<InvocationOptions> effect;

    OptionFlag(String token, String description, Consumer<InvocationOptions> effect) {
        this.token = token;
        this.description = description;
        this.effect = effect;
    }

    public String getToken() {
        return token;
    }

    public String getDescription() {
        return description;
    }

    void applyTo(InvocationOptions options) {
        effect.accept(options);
    }

    /**
     * 按token查找选项(区分大小写)
     *
     * @param token 空白分隔的单词
     * @return 对应选项,不是选项时为空
     */
    public static Optional<OptionFlag> fromToken(String token) {
        return Optional.ofNullable(BY_TOKEN.get(token));
    }
}
