package com.sqlshell.connection;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sqlshell.session.SessionSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * JsonFileSettingsStore - 以JSON文件保存连接参数
 *
 * 文件内容是一条完整的SessionSettings记录,每次整体覆盖。
 */
public class JsonFileSettingsStore implements SettingsStore {

    private static final Logger logger = LoggerFactory.getLogger(JsonFileSettingsStore.class);

    private final Path file;
    private final ObjectMapper mapper;

    public JsonFileSettingsStore(Path file) {
        if (file == null) {
            throw new IllegalArgumentException("Settings file cannot be null");
        }
        this.file = file;
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public Optional<SessionSettings> load() {
        if (!Files.exists(file)) {
            logger.debug("连接参数文件不存在: {}", file);
            return Optional.empty();
        }
        try {
            SessionSettings settings = mapper.readValue(file.toFile(), SessionSettings.class);
            logger.debug("读取连接参数: {}", settings);
            return Optional.of(settings);
        } catch (IOException e) {
            throw new SettingsStoreException("Failed trying to read connection settings from " + file, e);
        }
    }

    @Override
    public void save(SessionSettings settings) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(file.toFile(), settings);
            logger.debug("保存连接参数到 {}", file);
        } catch (IOException e) {
            throw new SettingsStoreException("Failed trying to write connection settings to " + file, e);
        }
    }

    @Override
    public void clear() {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new SettingsStoreException("Failed trying to remove connection settings " + file, e);
        }
    }
}
