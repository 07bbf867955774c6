package com.sqlshell.session;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * SessionSettings - 会话连接参数
 *
 * 数据库名、主机、端口、协议、用户、密码以及默认显示行数。
 * 每次连接成功后整体持久化,启动时读取一次。
 *
 * 不变式: 数据库名为空表示"尚未连接过",
 * 否则这里保存的是最近一次成功连接的参数,失败连接的参数不会留在这里。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SessionSettings {

    private String database = "";
    private String hostname;
    private String port;
    private String protocol;
    private String uid;
    private String pwd;
    private int maxrows;

    public SessionSettings() {
    }

    /**
     * 拷贝,连接尝试总是在副本上进行
     *
     * @return 新实例
     */
    public SessionSettings copy() {
        SessionSettings copy = new SessionSettings();
        copy.database = database;
        copy.hostname = hostname;
        copy.port = port;
        copy.protocol = protocol;
        copy.uid = uid;
        copy.pwd = pwd;
        copy.maxrows = maxrows;
        return copy;
    }

    @JsonIgnore
    public boolean hasDatabase() {
        return database != null && !database.isEmpty();
    }

    public String getDatabase() {
        return database;
    }

    public void setDatabase(String database) {
        this.database = database == null ? "" : database;
    }

    public String getHostname() {
        return hostname;
    }

    public void setHostname(String hostname) {
        this.hostname = hostname;
    }

    public String getPort() {
        return port;
    }

    public void setPort(String port) {
        this.port = port;
    }

    public String getProtocol() {
        return protocol;
    }

    public void setProtocol(String protocol) {
        this.protocol = protocol;
    }

    public String getUid() {
        return uid;
    }

    public void setUid(String uid) {
        this.uid = uid;
    }

    public String getPwd() {
        return pwd;
    }

    public void setPwd(String pwd) {
        this.pwd = pwd;
    }

    public int getMaxrows() {
        return maxrows;
    }

    public void setMaxrows(int maxrows) {
        this.maxrows = maxrows;
    }

    @Override
    public String toString() {
        // 不输出密码
        return "SessionSettings{database=" + database + ", hostname=" + hostname + ", port=" + port
                + ", protocol=" + protocol + ", uid=" + uid + ", maxrows=" + maxrows + "}";
    }
}
