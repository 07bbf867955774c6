package com.sqlshell.connection;

import java.util.Locale;

/**
 * ConnectDirective - 解析后的 CONNECT 语句
 *
 * 语法(关键字不区分大小写,顺序任意):
 * <pre>
 * CONNECT [TO db] [USER uid] [USING pwd|?] [HOST host] [PORT port] | RESET
 * </pre>
 *
 * 只做解析,不修改任何状态;参数缺值时抛出 {@link ConfigurationException}。
 * 数据库名和用户名转为大写,不认识的单词跳过。
 */
public class ConnectDirective {

    private String database;
    private String user;
    private String password;
    private String host;
    private String port;
    private boolean reset;

    private ConnectDirective() {
    }

    /**
     * 解析 CONNECT 语句
     *
     * @param text 以 CONNECT 开头的文本
     * @return 解析结果
     * @throws ConfigurationException 关键字后缺少参数值
     */
    public static ConnectDirective parse(String text) {
        ConnectDirective directive = new ConnectDirective();
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.isEmpty()) {
            return directive;
        }

        String[] words = trimmed.split("\\s+");
        int i = 0;
        while (i < words.length) {
            String keyword = words[i].toUpperCase(Locale.ROOT);
            switch (keyword) {
                case "TO":
                    directive.database = valueAfter(words, i, "database").toUpperCase(Locale.ROOT);
                    i += 2;
                    break;
                case "USER":
                    directive.user = valueAfter(words, i, "userid").toUpperCase(Locale.ROOT);
                    i += 2;
                    break;
                case "USING":
                    directive.password = valueAfter(words, i, "password");
                    i += 2;
                    break;
                case "HOST":
                    directive.host = valueAfter(words, i, "hostname");
                    i += 2;
                    break;
                case "PORT":
                    directive.port = valueAfter(words, i, "port");
                    i += 2;
                    break;
                case "RESET":
                    directive.reset = true;
                    i++;
                    break;
                default:
                    i++;
            }
        }
        return directive;
    }

    private static String valueAfter(String[] words, int index, String what) {
        if (index + 1 >= words.length) {
            throw new ConfigurationException("No " + what + " specified in the CONNECT statement");
        }
        return words[index + 1];
    }

    /**
     * 没有任何参数: 复用上次的参数,必要时提示输入
     */
    public boolean isBare() {
        return !reset && database == null && user == null && password == null && host == null && port == null;
    }

    public String getDatabase() {
        return database;
    }

    public String getUser() {
        return user;
    }

    public String getPassword() {
        return password;
    }

    public String getHost() {
        return host;
    }

    public String getPort() {
        return port;
    }

    public boolean isReset() {
        return reset;
    }
}
