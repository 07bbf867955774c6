package com.sqlshell.sample;

import com.sqlshell.executor.Executor;
import com.sqlshell.executor.StatementException;
import com.sqlshell.shell.MessagePrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * SampleDataLoader - -sampledata 选项
 *
 * 创建并填充 DEPARTMENT 和 EMPLOYEE 两张演示表。
 * 每个脚本是一个复合语句,表已存在时什么都不做,可以重复执行。
 * 脚本按命令整体执行,不做拆分。
 */
public class SampleDataLoader {

    private static final Logger logger = LoggerFactory.getLogger(SampleDataLoader.class);

    static final List<String> SCRIPTS = List.of("sample/department.sql", "sample/employee.sql");

    private final MessagePrinter printer;

    public SampleDataLoader(MessagePrinter printer) {
        this.printer = printer;
    }

    /**
     * 执行全部脚本
     *
     * @param executor 已连接的Executor
     * @param quiet 是否省略完成提示
     * @return 全部脚本是否执行成功
     */
    public boolean load(Executor executor, boolean quiet) {
        boolean ok = true;
        for (String script : SCRIPTS) {
            try {
                executor.runCommand(readScript(script));
                logger.debug("示例数据脚本执行完成: {}", script);
            } catch (StatementException e) {
                printer.error(e.getMessage());
                ok = false;
            }
        }
        if (ok && !quiet) {
            printer.success("Sample tables [EMPLOYEE, DEPARTMENT] created.");
        }
        return ok;
    }

    static String readScript(String resource) {
        try (InputStream in = SampleDataLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Missing sample data script: " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read sample data script: " + resource, e);
        }
    }
}
