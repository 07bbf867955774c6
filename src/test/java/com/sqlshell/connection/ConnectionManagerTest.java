package com.sqlshell.connection;

import com.sqlshell.config.ShellConfig;
import com.sqlshell.executor.FakeExecutor;
import com.sqlshell.executor.FakeExecutorFactory;
import com.sqlshell.session.Session;
import com.sqlshell.session.SessionSettings;
import com.sqlshell.shell.HelpPrinter;
import com.sqlshell.shell.MessagePrinter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ConnectionManagerTest - 连接管理测试
 */
@DisplayName("连接管理测试")
class ConnectionManagerTest {

    private ShellConfig config;
    private Session session;
    private FakeExecutorFactory factory;
    private InMemorySettingsStore store;
    private ByteArrayOutputStream out;
    private MessagePrinter printer;

    @BeforeEach
    void setUp() {
        config = new ShellConfig(new Properties());
        session = new Session(config.defaultSettings());
        factory = new FakeExecutorFactory();
        store = new InMemorySettingsStore();
        out = new ByteArrayOutputStream();
        printer = new MessagePrinter(new PrintStream(out, true, StandardCharsets.UTF_8));
    }

    private ConnectionManager manager(PromptProvider prompts) {
        return new ConnectionManager(session, factory, store, prompts, new HelpPrinter(printer, config), printer, config);
    }

    private ConnectionManager manager() {
        return manager(new ScriptedPromptProvider());
    }

    private String output() {
        return out.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private void useSavedSettings(String database) {
        SessionSettings settings = config.defaultSettings();
        settings.setDatabase(database);
        session.setSettings(settings);
    }

    @Test
    @DisplayName("CONNECT 成功: 挂上连接,保存参数")
    void testConnectSuccess() {
        manager().connect("CONNECT TO sample USER db2inst1 USING secret HOST dbhost PORT 50001");

        assertTrue(session.isConnected());
        SessionSettings used = factory.getAttempts().get(0);
        assertEquals("SAMPLE", used.getDatabase());
        assertEquals("DB2INST1", used.getUid());
        assertEquals("secret", used.getPwd());
        assertEquals("dbhost", used.getHostname());
        assertEquals("50001", used.getPort());

        assertEquals("SAMPLE", session.getSettings().getDatabase());
        assertEquals("dbhost", store.getSaved().getHostname());
        assertEquals(1, store.getSaveCount());
        assertEquals("Connection successful.\n", output());
    }

    @Test
    @DisplayName("USING ? 时隐藏输入密码")
    void testPasswordPrompt() {
        ScriptedPromptProvider prompts = new ScriptedPromptProvider("typed-secret");

        manager(prompts).connect("CONNECT TO SAMPLE USING ?");

        assertEquals(1, prompts.getMaskedPrompts().size());
        assertEquals("typed-secret", factory.getAttempts().get(0).getPwd());
        assertTrue(session.isConnected());
    }

    @Test
    @DisplayName("USING ? 输入为空时使用默认密码")
    void testPasswordPromptDefault() {
        manager(new ScriptedPromptProvider("")).connect("CONNECT TO SAMPLE USING ?");

        assertEquals("password", factory.getAttempts().get(0).getPwd());
    }

    @Test
    @DisplayName("连接失败: 报告错误,清空数据库名,保留其他参数")
    void testConnectFailure() {
        useSavedSettings("SAMPLE");
        factory.failWith("SQL30082N Security processing failed");

        manager().connect("CONNECT TO OTHER HOST badhost");

        assertFalse(session.isConnected());
        assertEquals("", session.getSettings().getDatabase());
        assertEquals("localhost", session.getSettings().getHostname());
        assertNull(store.getSaved());
        assertEquals("Error: SQL30082N Security processing failed\n", output());
    }

    @Test
    @DisplayName("连接失败后下次重新提示输入")
    void testPromptAfterFailure() {
        useSavedSettings("SAMPLE");
        factory.failWith("SQL1013N The database alias name could not be found");
        manager().connect("CONNECT");
        factory.succeed();

        ScriptedPromptProvider prompts = new ScriptedPromptProvider("SAMPLE", "", "", "", "");
        assertTrue(manager(prompts).ensureConnected());
        assertEquals(5, prompts.getPrompts().size());
    }

    @Test
    @DisplayName("参数错误时不改变任何状态")
    void testConfigurationErrorKeepsState() {
        manager().connect("CONNECT TO SAMPLE");
        FakeExecutor first = factory.getExecutor();
        out.reset();

        manager().connect("CONNECT TO SAMPLE USER");

        assertTrue(session.isConnected());
        assertFalse(first.isClosed());
        assertEquals(1, factory.getAttempts().size());
        assertEquals("Error: No userid specified in the CONNECT statement\n", output());
    }

    @Test
    @DisplayName("重新 CONNECT 先关闭旧连接")
    void testReconnectClosesOldExecutor() {
        manager().connect("CONNECT TO SAMPLE");
        FakeExecutor first = factory.getExecutor();
        FakeExecutor second = new FakeExecutor();
        factory.returning(second);

        manager().connect("CONNECT TO BLUDB");

        assertTrue(first.isClosed());
        assertSame(second, session.getExecutor());
        assertEquals("BLUDB", session.getSettings().getDatabase());
    }

    @Test
    @DisplayName("没有参数的 CONNECT 复用当前参数")
    void testBareConnectReusesSettings() {
        useSavedSettings("BLUDB");
        ScriptedPromptProvider prompts = new ScriptedPromptProvider();

        manager(prompts).connect("CONNECT");

        assertTrue(session.isConnected());
        assertEquals("BLUDB", factory.getAttempts().get(0).getDatabase());
        assertTrue(prompts.getPrompts().isEmpty());
    }

    @Test
    @DisplayName("没有数据库名时输出连接帮助并逐项提示")
    void testInteractivePrompts() {
        ScriptedPromptProvider prompts = new ScriptedPromptProvider("", "#2", "db2user", "", "25");

        manager(prompts).connect("CONNECT");

        SessionSettings used = factory.getAttempts().get(0);
        assertEquals("SAMPLE", used.getDatabase());
        assertEquals("172.17.0.2", used.getHostname());
        assertEquals("50000", used.getPort());
        assertEquals("DB2USER", used.getUid());
        assertEquals("password", used.getPwd());
        assertEquals(25, used.getMaxrows());
        assertEquals(5, prompts.getPrompts().size());
        assertEquals(1, prompts.getMaskedPrompts().size());
        assertTrue(output().startsWith("Connecting to the database"));
    }

    @Test
    @DisplayName("最大行数不是数字时使用默认值")
    void testInvalidMaxRows() {
        manager(new ScriptedPromptProvider("", "", "", "", "lots")).connect("CONNECT");

        assertEquals(10, factory.getAttempts().get(0).getMaxrows());
        assertTrue(output().contains("Error: Invalid number of rows: lots, using 10"));
        assertTrue(session.isConnected());
    }

    @Test
    @DisplayName("最大行数为0或小于-1时使用默认值")
    void testOutOfRangeMaxRows() {
        manager(new ScriptedPromptProvider("", "", "", "", "-5")).connect("CONNECT");

        assertEquals(10, factory.getAttempts().get(0).getMaxrows());
        assertTrue(output().contains("Error: Invalid number of rows: -5, using 10"));

        session.detach();
        session.getSettings().setDatabase("");
        out.reset();
        manager(new ScriptedPromptProvider("", "", "", "", "0")).connect("CONNECT");

        assertEquals(10, factory.getAttempts().get(1).getMaxrows());
        assertTrue(output().contains("Error: Invalid number of rows: 0, using 10"));
    }

    @Test
    @DisplayName("最大行数 -1 表示不限制")
    void testUnlimitedMaxRows() {
        manager(new ScriptedPromptProvider("", "", "", "", "-1")).connect("CONNECT");

        assertEquals(-1, factory.getAttempts().get(0).getMaxrows());
        assertFalse(output().contains("Error:"));
    }

    @Test
    @DisplayName("CONNECT RESET: 断开,恢复默认参数,删除保存的参数")
    void testReset() {
        manager().connect("CONNECT TO SAMPLE");
        FakeExecutor executor = factory.getExecutor();
        out.reset();

        manager().connect("CONNECT RESET");

        assertFalse(session.isConnected());
        assertTrue(executor.isClosed());
        assertEquals("", session.getSettings().getDatabase());
        assertEquals(10, session.getSettings().getMaxrows());
        assertNull(store.getSaved());
        assertEquals("Connection reset.\n", output());
    }

    @Test
    @DisplayName("保存参数失败不影响连接")
    void testPersistenceFailure() {
        store.failingOnSave();

        manager().connect("CONNECT TO SAMPLE");

        assertTrue(session.isConnected());
        assertEquals("Error: Failed trying to write connection settings\nConnection successful.\n", output());
    }

    @Test
    @DisplayName("已连接时ensureConnected不重新连接")
    void testEnsureConnectedWhenConnected() {
        ConnectionManager manager = manager();
        manager.connect("CONNECT TO SAMPLE");

        assertTrue(manager.ensureConnected());
        assertEquals(1, factory.getAttempts().size());
    }

    @Test
    @DisplayName("未连接时使用上次保存的参数自动连接")
    void testAutoConnect() {
        store.withSaved(savedSettings());
        ConnectionManager manager = manager();
        manager.loadSettings();

        assertTrue(manager.ensureConnected());
        assertEquals("SAVEDDB", factory.getAttempts().get(0).getDatabase());
        assertEquals(50, session.getSettings().getMaxrows());
    }

    @Test
    @DisplayName("自动连接失败返回false")
    void testAutoConnectFailure() {
        store.withSaved(savedSettings());
        factory.failWith("SQL30081N A communication error has been detected");
        ConnectionManager manager = manager();
        manager.loadSettings();

        assertFalse(manager.ensureConnected());
        assertFalse(session.isConnected());
        assertTrue(output().contains("Error: SQL30081N"));
    }

    private static SessionSettings savedSettings() {
        SessionSettings settings = new SessionSettings();
        settings.setDatabase("SAVEDDB");
        settings.setHostname("10.0.0.9");
        settings.setPort("50000");
        settings.setUid("DB2INST1");
        settings.setPwd("pw");
        settings.setMaxrows(50);
        return settings;
    }
}
