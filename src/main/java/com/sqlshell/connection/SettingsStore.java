package com.sqlshell.connection;

import com.sqlshell.session.SessionSettings;

import java.util.Optional;

/**
 * 连接参数的持久化
 *
 * 启动时读取一次,每次连接成功后写入,CONNECT RESET 时清除。
 */
public interface SettingsStore {

    /**
     * 读取上次保存的参数
     *
     * @return 没有保存过时为空
     * @throws SettingsStoreException 读取失败
     */
    Optional<SessionSettings> load();

    /**
     * @throws SettingsStoreException 写入失败
     */
    void save(SessionSettings settings);

    /**
     * @throws SettingsStoreException 删除失败
     */
    void clear();
}
