package com.mvccdb.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.mvccdb.backend.dbm.DatabaseManager;
import com.mvccdb.backend.txm.IsolationLevel;

@ConfigurationProperties(prefix = "mvccdb.engine")
public class MvccDbProperties {

    /**
     * 启动时创建、新会话默认使用的数据库
     */
    private String defaultDatabase = DatabaseManager.DEFAULT_DATABASE;

    /**
     * BEGIN 未指定隔离级别以及隐式事务使用的级别
     */
    private IsolationLevel defaultIsolation = IsolationLevel.READ_COMMITTED;

    /**
     * 同时存在的会话上限
     */
    private int maxSessions = 100;

    private final Monitor monitor = new Monitor();

    public String getDefaultDatabase() {
        return defaultDatabase;
    }

    public void setDefaultDatabase(String defaultDatabase) {
        this.defaultDatabase = defaultDatabase;
    }

    public IsolationLevel getDefaultIsolation() {
        return defaultIsolation;
    }

    public void setDefaultIsolation(IsolationLevel defaultIsolation) {
        this.defaultIsolation = defaultIsolation;
    }

    public int getMaxSessions() {
        return maxSessions;
    }

    public void setMaxSessions(int maxSessions) {
        this.maxSessions = maxSessions;
    }

    public Monitor getMonitor() {
        return monitor;
    }

    public static class Monitor {
        /**
         * 是否定期输出事务登记表快照
         */
        private boolean enabled = false;

        private long intervalMs = 5000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }
    }
}
