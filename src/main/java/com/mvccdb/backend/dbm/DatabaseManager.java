package com.mvccdb.backend.dbm;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mvccdb.backend.txm.IsolationLevel;
import com.mvccdb.common.Error;

/**
 * 管理多个相互独立的数据库实例，负责创建、删除、恢复以及在会话间复用。
 */
public class DatabaseManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(DatabaseManager.class);
    public static final String DEFAULT_DATABASE = "system";

    private final IsolationLevel defaultLevel;
    private final Map<String, DatabaseContext> contexts = new ConcurrentHashMap<>();

    public DatabaseManager() {
        this(IsolationLevel.defaultLevel());
    }

    /**
     * @param defaultLevel BEGIN 未指定隔离级别、以及隐式事务使用的级别
     */
    public DatabaseManager(IsolationLevel defaultLevel) {
        this.defaultLevel = defaultLevel == null ? IsolationLevel.defaultLevel() : defaultLevel;
    }

    public IsolationLevel getDefaultLevel() {
        return defaultLevel;
    }

    /**
     * 如果没有任何数据库，则自动创建默认 database。
     */
    public void createDefault() {
        createDefault(DEFAULT_DATABASE);
    }

    public synchronized void createDefault(String name) {
        if(!contexts.isEmpty()) {
            return;
        }
        create(name);
    }

    /**
     * 创建新数据库（独立的 TM/VM/TBM）。
     */
    public synchronized void create(String name) {
        validateDbName(name);
        if(contexts.containsKey(name)) {
            throw Error.DatabaseExistsException;
        }
        contexts.put(name, DatabaseContext.newContext(name, defaultLevel));
        LOGGER.debug("database '{}' created", name);
    }

    /**
     * 删除数据库，要求没有会话正在使用。
     */
    public synchronized void drop(String name) {
        drop(name, null);
    }

    /**
     * 删除数据库，调用方自己持有的那一次引用不算占用。
     * 删除成功时释放该引用；失败时引用保持不变。
     *
     * @param held 调用方当前持有的上下文，可以为 null
     */
    public synchronized void drop(String name, DatabaseContext held) {
        validateDbName(name);
        DatabaseContext ctx = contexts.get(name);
        if(ctx == null) {
            throw Error.DatabaseNotFoundException;
        }
        int own = ctx == held ? 1 : 0;
        if(ctx.refCount() > own) {
            throw Error.DatabaseInUseException;
        }
        if(own == 1) {
            ctx.release();
        }
        contexts.remove(name);
        LOGGER.debug("database '{}' dropped", name);
    }

    /**
     * 从快照重建一个数据库，名称不能已存在。
     */
    public synchronized DatabaseContext restore(String name, DatabaseSnapshot snapshot) {
        validateDbName(name);
        if(contexts.containsKey(name)) {
            throw Error.DatabaseExistsException;
        }
        DatabaseContext ctx = DatabaseContext.fromSnapshot(name, snapshot, defaultLevel);
        contexts.put(name, ctx);
        LOGGER.debug("database '{}' restored: {} tables, {} transactions",
                name, snapshot.tables.size(), snapshot.transactions.size());
        return ctx;
    }

    /**
     * 获取数据库上下文并增加引用。
     */
    public synchronized DatabaseContext acquire(String name) {
        validateDbName(name);
        DatabaseContext ctx = contexts.get(name);
        if(ctx == null) {
            throw Error.DatabaseNotFoundException;
        }
        ctx.retain();
        return ctx;
    }

    /**
     * 释放引用。
     */
    public synchronized void release(DatabaseContext ctx) {
        if(ctx == null) {
            return;
        }
        ctx.release();
    }

    /**
     * 不增加引用地查看数据库，不存在返回 null
     */
    public DatabaseContext get(String name) {
        return name == null ? null : contexts.get(name);
    }

    /**
     * 列出所有数据库名称（字典序）。
     */
    public List<String> show() {
        List<String> names = new ArrayList<>(contexts.keySet());
        names.sort(Comparator.naturalOrder());
        return names;
    }

    /**
     * 所有已打开的数据库上下文，按名称排序
     */
    public List<DatabaseContext> contexts() {
        List<DatabaseContext> res = new ArrayList<>(contexts.values());
        res.sort(Comparator.comparing(DatabaseContext::getName));
        return res;
    }

    public void shutdown() {
        LOGGER.debug("shutting down {} databases", contexts.size());
        contexts.clear();
    }

    public String defaultDatabaseName() {
        List<String> dbs = show();
        if(dbs.contains(DEFAULT_DATABASE)) {
            return DEFAULT_DATABASE;
        }
        return dbs.isEmpty() ? null : dbs.get(0);
    }

    private void validateDbName(String name) {
        if(name == null || name.isEmpty()) {
            throw Error.InvalidCommandException;
        }
        for(char ch : name.toCharArray()) {
            if(!(Character.isLetterOrDigit(ch) || ch == '_' || ch == '-')) {
                throw Error.InvalidCommandException;
            }
        }
    }
}
