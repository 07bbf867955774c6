package com.sqlshell.connection;

/**
 * 交互式输入能力
 *
 * 控制台实现使用JLine,测试中使用预先写好的应答。
 */
public interface PromptProvider {

    /**
     * 提示并读取一行
     *
     * @param message 提示文字
     * @return 用户输入,未输入时为空串
     */
    String prompt(String message);

    /**
     * 提示并以隐藏方式读取一行(密码)
     *
     * @param message 提示文字
     * @return 用户输入,未输入时为空串
     */
    String promptMasked(String message);
}
