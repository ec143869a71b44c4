package com.mvccdb.backend.server;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mvccdb.backend.dbm.DatabaseContext;
import com.mvccdb.backend.dbm.DatabaseManager;
import com.mvccdb.backend.statement.Abort;
import com.mvccdb.backend.statement.Begin;
import com.mvccdb.backend.statement.Commit;
import com.mvccdb.backend.statement.Create;
import com.mvccdb.backend.statement.CreateDatabase;
import com.mvccdb.backend.statement.Delete;
import com.mvccdb.backend.statement.Describe;
import com.mvccdb.backend.statement.Drop;
import com.mvccdb.backend.statement.DropDatabase;
import com.mvccdb.backend.statement.Insert;
import com.mvccdb.backend.statement.Select;
import com.mvccdb.backend.statement.Show;
import com.mvccdb.backend.statement.Update;
import com.mvccdb.backend.statement.Use;
import com.mvccdb.backend.tbm.BeginResult;
import com.mvccdb.backend.tbm.TableManager;
import com.mvccdb.common.Error;
import com.mvccdb.common.ExecResult;
import com.mvccdb.common.QueryResult;
import com.mvccdb.common.ResultSet;

/**
 * Executor 负责接收结构化语句、调度 TableManager 执行具体操作，
 * 同时管理会话的事务上下文（xid）并返回结构化的 {@link ExecResult}。
 * <p>
 * 特点：
 * <ul>
 *     <li>支持显式事务（BEGIN/COMMIT/ABORT）</li>
 *     <li>数据语句不在事务中时自动包装隐式事务（begin → commit/abort）</li>
 *     <li>DDL 不参与事务，事务内外都可以执行</li>
 * </ul>
 * 一个 Executor 对应一个会话，不是线程安全的。
 */
public class Executor {

    private static final Logger LOGGER = LoggerFactory.getLogger(Executor.class);

    /** 当前事务 ID，0 表示未处于事务中 */
    private long xid;

    private final DatabaseManager databaseManager;
    private DatabaseContext dbContext;
    /** 用于日志的会话标识 */
    private final String clientId;

    public Executor(DatabaseManager databaseManager, String clientId) {
        this.databaseManager = databaseManager;
        this.clientId = clientId;
        this.xid = 0;
        tryUseDefaultDatabase();
    }

    public Executor(DatabaseManager databaseManager) {
        this(databaseManager, "default");
    }

    public long getXid() {
        return xid;
    }

    public String getClientId() {
        return clientId;
    }

    /**
     * @return 当前使用的数据库名，未选择时返回 null
     */
    public String getDatabaseName() {
        return dbContext == null ? null : dbContext.getName();
    }

    public boolean inTransaction() {
        return xid != 0;
    }

    /**
     * 关闭执行器，如果存在未完成的事务则回滚。
     */
    public void close() {
        try {
            if(xid != 0 && dbContext != null) {
                LOGGER.warn("[client={}] abnormal abort xid={}", clientId, xid);
                dbContext.getTableManager().abort(xid);
            }
        } finally {
            xid = 0;
            databaseManager.release(dbContext);
            dbContext = null;
        }
    }

    /**
     * 执行一条结构化语句。
     *
     * @param stat 语句对象，见 {@code com.mvccdb.backend.statement}
     * @return 执行结果
     */
    public ExecResult execute(Object stat) {
        if(stat == null) {
            throw Error.InvalidStatementException;
        }
        LOGGER.info("[client={}] Execute: {} xid={}", clientId, stat.getClass().getSimpleName(), xid);

        if(Use.class.isInstance(stat)) {
            return handleUse((Use) stat);

        } else if(CreateDatabase.class.isInstance(stat)) {
            return handleCreateDatabase((CreateDatabase) stat);

        } else if(DropDatabase.class.isInstance(stat)) {
            return handleDropDatabase((DropDatabase) stat);

        // BEGIN
        } else if(Begin.class.isInstance(stat)) {
            TableManager tbm = getTableManager();
            if(xid != 0) {
                throw Error.NestedTransactionException;
            }
            long start = System.nanoTime();
            BeginResult r = tbm.begin((Begin) stat);
            xid = r.xid;
            return ExecResult.from(r.result, resultType(stat), xid, System.nanoTime() - start);

        // COMMIT
        } else if(Commit.class.isInstance(stat)) {
            TableManager tbm = getTableManager();
            if(xid == 0) {
                throw Error.NoTransactionException;
            }
            long start = System.nanoTime();
            long committing = xid;
            try {
                QueryResult res = tbm.commit(committing);
                return ExecResult.from(res, resultType(stat), 0, System.nanoTime() - start);
            } finally {
                // 提交成功或因冲突被回滚，事务都已结束
                xid = 0;
            }

        // ROLLBACK
        } else if(Abort.class.isInstance(stat)) {
            TableManager tbm = getTableManager();
            if(xid == 0) {
                throw Error.NoTransactionException;
            }
            long start = System.nanoTime();
            QueryResult res = tbm.abort(xid);
            xid = 0;
            return ExecResult.from(res, resultType(stat), 0, System.nanoTime() - start);

        } else if(isSchemaStatement(stat)) {
            return executeSchema(stat);

        } else if(isDataStatement(stat)) {
            return executeData(stat);
        }
        throw Error.InvalidStatementException;
    }

    /**
     * SHOW / DESCRIBE / CREATE / DROP，不参与事务
     */
    private ExecResult executeSchema(Object stat) {
        long start = System.nanoTime();
        // SHOW DATABASES 不依赖具体 DB，单独处理
        if(stat instanceof Show && ((Show) stat).isDatabases) {
            return ExecResult.from(showDatabases(), resultType(stat), xid, System.nanoTime() - start);
        }
        TableManager tbm = getTableManager();
        QueryResult res;
        if(Show.class.isInstance(stat)) {
            res = tbm.show((Show) stat);
        } else if(Describe.class.isInstance(stat)) {
            res = tbm.describe((Describe) stat);
        } else if(Create.class.isInstance(stat)) {
            res = tbm.create((Create) stat);
        } else {
            res = tbm.drop((Drop) stat);
        }
        return ExecResult.from(res, resultType(stat), xid, System.nanoTime() - start);
    }

    /**
     * SELECT / INSERT / UPDATE / DELETE，不在事务中时自动开启临时事务。
     */
    private ExecResult executeData(Object stat) {
        TableManager tbm = getTableManager();
        boolean tmpTransaction = false;
        RuntimeException e = null;

        if(xid == 0) {
            tmpTransaction = true;
            BeginResult r = tbm.begin(new Begin());
            xid = r.xid;
        }

        long start = System.nanoTime();
        try {
            QueryResult res;
            if(Select.class.isInstance(stat)) {
                res = tbm.read(xid, (Select) stat);
            } else if(Insert.class.isInstance(stat)) {
                res = tbm.insert(xid, (Insert) stat);
            } else if(Delete.class.isInstance(stat)) {
                res = tbm.delete(xid, (Delete) stat);
            } else {
                res = tbm.update(xid, (Update) stat);
            }
            return ExecResult.from(res, resultType(stat), tmpTransaction ? 0 : xid, System.nanoTime() - start);

        } catch(RuntimeException e1) {
            e = e1;
            throw e1;
        } finally {
            // 自动处理临时事务（成功 → commit，失败 → abort）
            if(tmpTransaction) {
                long currentXid = xid;
                xid = 0;
                if(e != null) {
                    tbm.abort(currentXid);
                } else {
                    tbm.commit(currentXid);
                }
            }
        }
    }

    private boolean isSchemaStatement(Object stat) {
        return Show.class.isInstance(stat) ||
                Describe.class.isInstance(stat) ||
                Create.class.isInstance(stat) ||
                Drop.class.isInstance(stat);
    }

    private boolean isDataStatement(Object stat) {
        return Select.class.isInstance(stat) ||
                Insert.class.isInstance(stat) ||
                Update.class.isInstance(stat) ||
                Delete.class.isInstance(stat);
    }

    /** 判断语句是否属于查询类（SELECT/SHOW/DESCRIBE） */
    private boolean isQueryStatement(Object stat) {
        return Select.class.isInstance(stat) ||
                Show.class.isInstance(stat) ||
                Describe.class.isInstance(stat);
    }

    private ExecResult.Type resultType(Object stat) {
        return isQueryStatement(stat) ? ExecResult.Type.RESULT : ExecResult.Type.OK;
    }

    private ExecResult handleUse(Use use) {
        ensureNoTransaction();
        long start = System.nanoTime();
        DatabaseContext newCtx = databaseManager.acquire(use.databaseName);
        databaseManager.release(dbContext);
        dbContext = newCtx;
        QueryResult payload = QueryResult.message("Database changed to " + use.databaseName, 0);
        return ExecResult.from(payload, resultType(use), xid, System.nanoTime() - start);
    }

    private ExecResult handleCreateDatabase(CreateDatabase createDatabase) {
        long start = System.nanoTime();
        databaseManager.create(createDatabase.databaseName);
        QueryResult payload = QueryResult.message("create database " + createDatabase.databaseName, 0);
        return ExecResult.from(payload, resultType(createDatabase), xid, System.nanoTime() - start);
    }

    private ExecResult handleDropDatabase(DropDatabase dropDatabase) {
        ensureNoTransaction();
        long start = System.nanoTime();
        // 删除失败时会话仍停留在当前数据库
        databaseManager.drop(dropDatabase.databaseName, dbContext);
        if(dbContext != null && dbContext.getName().equals(dropDatabase.databaseName)) {
            dbContext = null;
        }
        QueryResult payload = QueryResult.message("drop database " + dropDatabase.databaseName, 0);
        return ExecResult.from(payload, resultType(dropDatabase), xid, System.nanoTime() - start);
    }

    private TableManager getTableManager() {
        if(dbContext == null) {
            throw Error.NoDatabaseSelectedException;
        }
        return dbContext.getTableManager();
    }

    private void ensureNoTransaction() {
        if(xid != 0) {
            throw Error.SwitchDatabaseInTxnException;
        }
    }

    /*
     * 获取数据库列表
     */
    private QueryResult showDatabases() {
        List<List<String>> rows = new ArrayList<>();
        for (String db : databaseManager.show()) {
            rows.add(List.of(db));
        }
        return QueryResult.resultSet(new ResultSet(List.of("Database"), rows));
    }

    private void tryUseDefaultDatabase() {
        String defaultDb = databaseManager.defaultDatabaseName();
        if(defaultDb == null) {
            return;
        }
        try {
            dbContext = databaseManager.acquire(defaultDb);
            LOGGER.debug("[client={}] default database selected: {}", clientId, defaultDb);
        } catch (RuntimeException e) {
            // 默认库可能刚被删除，会话仍可用，之后用 USE 选择
            LOGGER.warn("[client={}] failed to acquire default database {}: {}", clientId, defaultDb, e.getMessage());
        }
    }
}
