package com.mvccdb.api.session;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;

import com.mvccdb.api.config.MvccDbProperties;
import com.mvccdb.api.exception.SessionNotFoundException;
import com.mvccdb.backend.dbm.DatabaseManager;
import com.mvccdb.backend.server.Executor;
import com.mvccdb.common.Error;

/**
 * 会话注册表，负责创建、缓存及关闭多个 Executor 会话。
 * 关闭会话时回滚其未结束的事务。
 */
@Component
public class SessionManager implements DisposableBean {

    private static final Logger LOGGER = LoggerFactory.getLogger(SessionManager.class);

    private final DatabaseManager databaseManager;
    private final int maxSessions;
    private final Map<String, Executor> sessions = new ConcurrentHashMap<>();

    public SessionManager(DatabaseManager databaseManager, MvccDbProperties properties) {
        this.databaseManager = databaseManager;
        this.maxSessions = properties.getMaxSessions();
    }

    /**
     * 创建一个新的 session，并返回 sessionId。
     */
    public synchronized String createSession() {
        if(sessions.size() >= maxSessions) {
            LOGGER.warn("session limit {} reached", maxSessions);
            throw Error.TooManySessionsException;
        }
        String sessionId = UUID.randomUUID().toString();
        sessions.put(sessionId, new Executor(databaseManager, sessionId));
        LOGGER.debug("session {} created", sessionId);
        return sessionId;
    }

    /**
     * 根据 sessionId 获取会话，不存在时抛出异常。
     */
    public Executor getRequiredSession(String sessionId) {
        Executor executor = sessionId == null ? null : sessions.get(sessionId);
        if (executor == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return executor;
    }

    /**
     * 关闭并移除指定 session。
     *
     * @return true 表示存在且已关闭，false 表示 sessionId 不存在
     */
    public boolean closeSession(String sessionId) {
        Executor executor = sessionId == null ? null : sessions.remove(sessionId);
        if (executor == null) {
            return false;
        }
        closeQuietly(sessionId, executor);
        return true;
    }

    public int size() {
        return sessions.size();
    }

    @Override
    public void destroy() {
        sessions.forEach(this::closeQuietly);
        sessions.clear();
    }

    private void closeQuietly(String sessionId, Executor executor) {
        // 与正在执行的语句互斥
        synchronized (executor) {
            try {
                executor.close();
            } catch (RuntimeException ex) {
                LOGGER.warn("关闭 session {} 失败", sessionId, ex);
            }
        }
    }
}
