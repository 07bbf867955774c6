package com.sqlshell.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

/**
 * JsonRowFormatter - -j 选项的JSON美化输出
 *
 * 4空格缩进,键保持文档顺序,键值之间用 ": " 分隔:
 * <pre>
 * {"a":1,"b":[1,2]}
 *
 * {
 *     "a": 1,
 *     "b": [
 *         1,
 *         2
 *     ]
 * }
 * </pre>
 */
public class JsonRowFormatter {

    private static final String INDENT = "    ";

    private final ObjectMapper mapper;
    private final ObjectWriter writer;

    public JsonRowFormatter() {
        this.mapper = new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

        Separators separators = Separators.createDefaultInstance()
                .withObjectFieldValueSpacing(Separators.Spacing.AFTER)
                .withObjectEmptySeparator("")
                .withArrayEmptySeparator("");
        DefaultIndenter indenter = new DefaultIndenter(INDENT, "\n");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter(separators);
        printer.indentObjectsWith(indenter);
        printer.indentArraysWith(indenter);

        this.writer = mapper.writer(printer);
    }

    /**
     * 解析并美化一个JSON文档
     *
     * @param document 首列的文本
     * @return 美化后的文本
     * @throws MalformedJsonException 不是合法JSON
     */
    public String format(String document) {
        if (document == null) {
            throw new MalformedJsonException("Value is NULL, not a JSON document");
        }
        try {
            JsonNode node = mapper.readTree(document);
            if (node == null || node.isMissingNode()) {
                throw new MalformedJsonException("Value is empty, not a JSON document");
            }
            return writer.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new MalformedJsonException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
