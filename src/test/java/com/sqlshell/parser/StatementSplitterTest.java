package com.sqlshell.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StatementSplitterTest - 语句拆分测试
 */
@DisplayName("语句拆分测试")
class StatementSplitterTest {

    private final StatementSplitter splitter = new StatementSplitter();

    @Test
    @DisplayName("按分号拆分,保持顺序")
    void testSplitBySemicolon() {
        List<String> parts = splitter.split("CREATE TABLE T (A INT);\nINSERT INTO T VALUES 1;\nSELECT * FROM T", ';');

        assertEquals(3, parts.size());
        assertEquals("CREATE TABLE T (A INT)", parts.get(0));
        assertEquals(" INSERT INTO T VALUES 1", parts.get(1));
        assertEquals(" SELECT * FROM T", parts.get(2));
    }

    @Test
    @DisplayName("-d 时按 @ 拆分,分号留在语句内部")
    void testSplitByAt() {
        String block = "CREATE PROCEDURE P() BEGIN INSERT INTO T VALUES 1; END@\nCALL P()@";

        List<String> parts = splitter.split(block, '@');

        assertEquals(3, parts.size());
        assertEquals("CREATE PROCEDURE P() BEGIN INSERT INTO T VALUES 1; END", parts.get(0));
        assertEquals(" CALL P()", parts.get(1));
        assertTrue(parts.get(2).isBlank());
    }

    @Test
    @DisplayName("去掉行注释")
    void testStripLineComments() {
        String block = "-- setup\nCREATE TABLE T (A INT); -- table\nDROP TABLE T";

        List<String> parts = splitter.split(block, ';');

        assertEquals(2, parts.size());
        assertEquals(" CREATE TABLE T (A INT)", parts.get(0));
        assertFalse(parts.get(1).contains("table"));
        assertEquals("DROP TABLE T", parts.get(1).trim());
    }

    @Test
    @DisplayName("换行替换为空格,多行语句合成一行")
    void testLineBreaksFlattened() {
        List<String> parts = splitter.split("SELECT A,\r\n       B\nFROM T", ';');

        assertEquals(1, parts.size());
        assertEquals("SELECT A,        B FROM T", parts.get(0));
    }

    @Test
    @DisplayName("没有注释和换行时,拆分后用分隔符拼接得到原文")
    void testSplitThenJoinIsIdentity() {
        String block = "A;;B ; C;";

        List<String> parts = splitter.split(block, ';');

        assertEquals(block, String.join(";", parts));
    }

    @Test
    @DisplayName("单行输入不拆分")
    void testSplitLine() {
        List<String> parts = splitter.splitLine("INSERT INTO T VALUES 1; INSERT INTO T VALUES 2");

        assertEquals(1, parts.size());
        assertEquals("INSERT INTO T VALUES 1; INSERT INTO T VALUES 2", parts.get(0));
    }

    @Test
    @DisplayName("null输入")
    void testNullInput() {
        assertTrue(splitter.split(null, ';').isEmpty());
        assertEquals(List.of(""), splitter.splitLine(null));
    }
}
