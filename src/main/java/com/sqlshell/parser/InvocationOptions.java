package com.sqlshell.parser;

import com.sqlshell.CommonConstant;

/**
 * InvocationOptions - 单次调用的选项
 *
 * 由OptionParser根据行首选项生成,调用结束即丢弃,从不持久化。
 */
public class InvocationOptions {

    private char delimiter = CommonConstant.DEFAULT_DELIMITER;
    private boolean quiet;
    private ResultShape resultShape = ResultShape.AUTO;
    private boolean json;
    private boolean returnArray;
    private boolean allRows;
    private boolean timer;
    private PlotMode plotMode = PlotMode.NONE;
    private boolean sampleData;

    public char getDelimiter() {
        return delimiter;
    }

    void useScriptDelimiter() {
        this.delimiter = CommonConstant.SCRIPT_DELIMITER;
    }

    public boolean isQuiet() {
        return quiet;
    }

    void setQuiet() {
        this.quiet = true;
    }

    public ResultShape getResultShape() {
        return resultShape;
    }

    void forceQuery() {
        // -n 优先于 -s
        if (resultShape != ResultShape.FORCE_COMMAND) {
            resultShape = ResultShape.FORCE_QUERY;
        }
    }

    void forceCommand() {
        resultShape = ResultShape.FORCE_COMMAND;
    }

    public boolean isJson() {
        return json;
    }

    void setJson() {
        this.json = true;
    }

    public boolean isReturnArray() {
        return returnArray;
    }

    void setReturnArray() {
        this.returnArray = true;
    }

    public boolean isAllRows() {
        return allRows;
    }

    void setAllRows() {
        this.allRows = true;
    }

    public boolean isTimer() {
        return timer;
    }

    void setTimer() {
        this.timer = true;
    }

    public PlotMode getPlotMode() {
        return plotMode;
    }

    void requestPlot(PlotMode mode) {
        if (mode.outranks(plotMode)) {
            plotMode = mode;
        }
    }

    public boolean isSampleData() {
        return sampleData;
    }

    void setSampleData() {
        this.sampleData = true;
    }

    @Override
    public String toString() {
        return "InvocationOptions{delimiter=" + delimiter + ", quiet=" + quiet + ", resultShape=" + resultShape
                + ", json=" + json + ", returnArray=" + returnArray + ", allRows=" + allRows
                + ", timer=" + timer + ", plotMode=" + plotMode + ", sampleData=" + sampleData + "}";
    }
}
