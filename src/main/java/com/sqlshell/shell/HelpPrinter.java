package com.sqlshell.shell;

import com.sqlshell.config.ShellConfig;
import com.sqlshell.parser.OptionFlag;

/**
 * 帮助信息: "?" 输出选项说明, "? CONNECT" 输出连接说明
 */
public class HelpPrinter {

    private final MessagePrinter printer;
    private final ShellConfig config;

    public HelpPrinter(MessagePrinter printer, ShellConfig config) {
        this.printer = printer;
        this.config = config;
    }

    public void printOptionsHelp() {
        printer.println("SQL Options");
        printer.println("The following options are available at the beginning of a SQL statement.");
        printer.println("Options are always preceded with a minus sign (i.e. -q).");
        printer.println();
        for (OptionFlag flag : OptionFlag.values()) {
            printer.println(String.format("  %-12s %s", flag.getToken(), flag.getDescription()));
        }
        printer.println();
        printer.println("Start a line with %% to enter a block of statements; an empty line ends the block.");
    }

    public void printConnectionHelp() {
        printer.println("Connecting to the database");
        printer.println("  CONNECT TO <database> USER <userid> USING <password|?> HOST <ip address> PORT <port number>");
        printer.println();
        printer.println("If you use a \"?\" for the password field, the system will prompt you for a password.");
        printer.println("When prompted for the host you can use ip:port or #x:port, where #x stands for "
                + config.getContainerPrefix() + "x.");
        printer.println("If the connection is successful, the parameters are saved and used the next time");
        printer.println("you run a SQL statement, or when you issue CONNECT with no parameters.");
        printer.println("CONNECT RESET deletes the saved values.");
        printer.println();
        printer.println("Defaults used when you just hit return:");
        printer.println("  Database      " + config.getDefaultDatabase());
        printer.println("  Hostname      " + config.getDefaultHost());
        printer.println("  Port          " + config.getDefaultPort());
        printer.println("  Userid        " + config.getDefaultUser());
        printer.println("  Password      " + config.getDefaultPassword());
        printer.println("  Maximum Rows  " + config.getDefaultMaxRows());
    }
}
