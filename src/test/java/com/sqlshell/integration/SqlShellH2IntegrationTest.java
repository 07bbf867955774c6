package com.sqlshell.integration;

import com.sqlshell.chart.RecordingChartRenderer;
import com.sqlshell.config.ShellConfig;
import com.sqlshell.connection.ConnectionManager;
import com.sqlshell.connection.InMemorySettingsStore;
import com.sqlshell.connection.ScriptedPromptProvider;
import com.sqlshell.executor.ExecutionDispatcher;
import com.sqlshell.executor.ExecutionResult;
import com.sqlshell.executor.JdbcExecutorFactory;
import com.sqlshell.executor.JsonRowFormatter;
import com.sqlshell.parser.OptionParser;
import com.sqlshell.parser.StatementClassifier;
import com.sqlshell.parser.StatementSplitter;
import com.sqlshell.result.QueryResult;
import com.sqlshell.sample.SampleDataLoader;
import com.sqlshell.session.Session;
import com.sqlshell.shell.HelpPrinter;
import com.sqlshell.shell.MessagePrinter;
import com.sqlshell.shell.SqlFrontEnd;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SqlShellH2IntegrationTest - 端到端测试
 *
 * 通过JDBC连接H2内存数据库,走完整的 CONNECT → 拆分 → 分派 → JDBC 流程。
 */
@DisplayName("端到端测试(H2)")
class SqlShellH2IntegrationTest {

    private static final AtomicInteger DATABASES = new AtomicInteger();

    private ByteArrayOutputStream out;
    private Session session;
    private InMemorySettingsStore store;
    private SqlFrontEnd frontEnd;
    private String database;

    @BeforeEach
    void setUp() {
        Properties props = new Properties();
        props.setProperty(ShellConfig.JDBC_URL, "jdbc:h2:mem:{database};DB_CLOSE_DELAY=-1");
        props.setProperty(ShellConfig.TIMER_SECONDS, "0.05");
        ShellConfig config = new ShellConfig(props);

        out = new ByteArrayOutputStream();
        MessagePrinter printer = new MessagePrinter(new PrintStream(out, true, StandardCharsets.UTF_8));
        HelpPrinter help = new HelpPrinter(printer, config);

        session = new Session(config.defaultSettings());
        store = new InMemorySettingsStore();
        ConnectionManager connectionManager = new ConnectionManager(session, new JdbcExecutorFactory(config), store,
                new ScriptedPromptProvider(), help, printer, config);

        RecordingChartRenderer charts = new RecordingChartRenderer();
        ExecutionDispatcher dispatcher = new ExecutionDispatcher(session, new StatementClassifier(),
                new JsonRowFormatter(), charts, charts, printer, config.getTimerDuration());

        frontEnd = new SqlFrontEnd(session, new OptionParser(), new StatementSplitter(), dispatcher,
                connectionManager, new SampleDataLoader(printer), help);

        database = "ITEST" + DATABASES.incrementAndGet();
        frontEnd.execute("CONNECT TO " + database + " USER sa USING pw", null);
        assertTrue(session.isConnected(), output());
        out.reset();
    }

    @AfterEach
    void tearDown() {
        session.close();
    }

    private String output() {
        return out.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    @Test
    @DisplayName("CONNECT 成功后保存参数")
    void testConnectPersists() {
        assertEquals(database, store.getSaved().getDatabase());
        assertEquals("SA", store.getSaved().getUid());
    }

    @Test
    @DisplayName("块中建表、插入、查询")
    void testBlockRoundTrip() {
        ExecutionResult result = frontEnd.execute("",
                "CREATE TABLE EMP (ID INT, NAME VARCHAR(20));\n"
                        + "INSERT INTO EMP VALUES (1, 'Haas');\n"
                        + "INSERT INTO EMP VALUES (2, 'Thompson');\n"
                        + "SELECT * FROM EMP ORDER BY ID");

        assertEquals(ExecutionResult.Kind.TABLE, result.getKind());
        QueryResult table = result.getTable();
        assertEquals(List.of("ID", "NAME"), table.getColumns());
        assertEquals(2, table.getRowCount());
        assertEquals("Thompson", table.getValue(1, 1));
        assertEquals("", output());
    }

    @Test
    @DisplayName("语句失败不影响连接,错误信息去掉错误码")
    void testErrorKeepsConnection() {
        frontEnd.execute("CREATE TABLE T (A INT)", null);
        out.reset();

        ExecutionResult result = frontEnd.execute("SELECT * FROM MISSING", null);

        assertTrue(result.isFailed());
        String text = output();
        assertTrue(text.startsWith("Error: Table \"MISSING\" not found"), text);
        assertFalse(text.contains("42102"), text);
        assertTrue(session.isConnected());

        assertEquals(ExecutionResult.Kind.TABLE, frontEnd.execute("SELECT * FROM T", null).getKind());
    }

    @Test
    @DisplayName("-r 返回数组")
    void testReturnArray() {
        frontEnd.execute("-q", "CREATE TABLE T (A INT, B VARCHAR(5)); INSERT INTO T VALUES (7, 'x')");

        ExecutionResult result = frontEnd.execute("-r SELECT A, B FROM T", null);

        assertEquals(List.of(List.of(7, "x")), result.getRows());
    }

    @Test
    @DisplayName("-j 美化JSON列")
    void testJson() {
        ExecutionResult result = frontEnd.execute("-j VALUES '{\"a\":1}'", null);

        assertEquals(1, result.getJsonRowCount());
        assertEquals("Row: 1\n{\n    \"a\": 1\n}\n", output());
    }

    @Test
    @DisplayName("-j 读取CLOB列的文本")
    void testJsonFromClob() {
        frontEnd.execute("-q", "CREATE TABLE DOCS (D CLOB); INSERT INTO DOCS VALUES ('{\"a\":1}')");
        out.reset();

        ExecutionResult result = frontEnd.execute("-j SELECT D FROM DOCS", null);

        assertEquals(ExecutionResult.Kind.JSON, result.getKind(), output());
        assertEquals(1, result.getJsonRowCount());
        assertEquals("Row: 1\n{\n    \"a\": 1\n}\n", output());
    }

    @Test
    @DisplayName("LOB和二进制列在表格和数组中显示为值")
    void testLobValues() {
        frontEnd.execute("-q", "CREATE TABLE FILES (NOTE CLOB, DATA VARBINARY(4), BODY BLOB);"
                + " INSERT INTO FILES VALUES ('hello', X'CAFE', X'01FF')");

        ExecutionResult table = frontEnd.execute("SELECT NOTE, DATA, BODY FROM FILES", null);
        assertEquals(Arrays.asList("hello", "CAFE", "01FF"), table.getTable().getRows().get(0));

        ExecutionResult rows = frontEnd.execute("-r SELECT NOTE, DATA, BODY FROM FILES", null);
        assertEquals(List.of(List.of("hello", "CAFE", "01FF")), rows.getRows());
    }

    @Test
    @DisplayName("-t 返回执行次数")
    void testTimer() {
        ExecutionResult result = frontEnd.execute("-t VALUES 1", null);

        assertTrue(result.getIterations() > 0);
        assertTrue(output().startsWith("Total iterations in 0.05 second(s): "));
    }

    @Test
    @DisplayName("密码错误时连接失败,清空数据库名")
    void testWrongPassword() {
        frontEnd.execute("CONNECT TO " + database + " USER sa USING wrong", null);

        assertFalse(session.isConnected());
        assertEquals("", session.getSettings().getDatabase());
        assertTrue(output().startsWith("Error: "));
    }

    @Test
    @DisplayName("CONNECT RESET 断开连接")
    void testReset() {
        frontEnd.execute("CONNECT RESET", null);

        assertFalse(session.isConnected());
        assertNull(store.getSaved());
        assertEquals("Connection reset.\n", output());
    }
}
