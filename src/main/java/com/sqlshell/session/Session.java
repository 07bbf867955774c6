package com.sqlshell.session;

import com.sqlshell.executor.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Session - 会话状态
 *
 * 持有当前连接参数和唯一的连接句柄(Executor)。
 * 整个进程只有一个Session,显式传给需要访问连接的组件,不使用静态状态。
 *
 * 生命周期:
 * <pre>
 * Disconnected --attach()--> Connected
 * Connected --detach()--> Disconnected
 * </pre>
 *
 * 语句运行时出错不会改变connected标志,
 * 只有显式的 CONNECT RESET 或重连失败才会回到Disconnected。
 */
public class Session implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Session.class);

    private SessionSettings settings;

    /** 连接句柄,仅在connected时有效 */
    private Executor executor;

    private boolean connected;

    public Session(SessionSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("Settings cannot be null");
        }
        this.settings = settings;
    }

    public SessionSettings getSettings() {
        return settings;
    }

    public void setSettings(SessionSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("Settings cannot be null");
        }
        this.settings = settings;
    }

    public boolean isConnected() {
        return connected && executor != null;
    }

    /**
     * 获取连接句柄
     *
     * @return 当前Executor
     * @throws IllegalStateException 未连接
     */
    public Executor getExecutor() {
        if (!isConnected()) {
            throw new IllegalStateException("Session is not connected");
        }
        return executor;
    }

    /**
     * 连接成功后挂上新的句柄和对应参数
     *
     * @param executor 新句柄
     * @param connectedWith 本次成功连接使用的参数
     */
    public void attach(Executor executor, SessionSettings connectedWith) {
        if (executor == null) {
            throw new IllegalArgumentException("Executor cannot be null");
        }
        detach();
        this.executor = executor;
        this.settings = connectedWith;
        this.connected = true;
    }

    /**
     * 关闭并丢弃句柄
     */
    public void detach() {
        if (executor != null) {
            try {
                executor.close();
            } catch (RuntimeException e) {
                logger.warn("关闭连接失败: {}", e.getMessage());
            }
        }
        executor = null;
        connected = false;
    }

    @Override
    public void close() {
        detach();
    }
}
