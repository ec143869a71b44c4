package com.mvccdb.api.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.mvccdb.api.session.SessionManager;
import com.mvccdb.backend.dbm.DatabaseContext;
import com.mvccdb.backend.dbm.DatabaseManager;
import com.mvccdb.backend.dbm.SnapshotCodec;
import com.mvccdb.backend.server.Executor;
import com.mvccdb.backend.txm.RegistrySnapshot;
import com.mvccdb.common.Error;
import com.mvccdb.common.ExecResult;

@Service
public class StatementService {

    private static final Logger LOGGER = LoggerFactory.getLogger(StatementService.class);

    private final SessionManager sessionManager;
    private final DatabaseManager databaseManager;

    public StatementService(SessionManager sessionManager, DatabaseManager databaseManager) {
        this.sessionManager = sessionManager;
        this.databaseManager = databaseManager;
    }

    /**
     * 在指定会话上执行一条结构化语句。会话不存在时抛出 SessionNotFoundException，
     * 执行失败时返回失败响应。
     */
    public StatementResponse<ExecResult> execute(String sessionId, Object statement) {
        Executor executor = sessionManager.getRequiredSession(sessionId);
        // 同一会话的语句串行执行
        synchronized (executor) {
            try {
                return StatementResponse.success(executor.execute(statement));
            } catch (RuntimeException ex) {
                if(ex == Error.SerializationConflictException) {
                    LOGGER.warn("[session={}] transaction aborted: {}", sessionId, ex.getMessage());
                } else {
                    LOGGER.error("执行语句失败: {}", statement == null ? null : statement.getClass().getSimpleName(), ex);
                }
                return StatementResponse.failure(ex.getMessage());
            }
        }
    }

    /**
     * 事务登记表快照
     */
    public StatementResponse<RegistrySnapshot> registry(String databaseName) {
        DatabaseContext ctx = databaseManager.get(databaseName);
        if(ctx == null) {
            return StatementResponse.failure(Error.DatabaseNotFoundException.getMessage());
        }
        return StatementResponse.success(ctx.getTableManager().registrySnapshot());
    }

    /**
     * 导出数据库为 JSON
     */
    public StatementResponse<String> export(String databaseName) {
        DatabaseContext ctx = databaseManager.get(databaseName);
        if(ctx == null) {
            return StatementResponse.failure(Error.DatabaseNotFoundException.getMessage());
        }
        return StatementResponse.success(SnapshotCodec.encode(ctx.exportSnapshot()));
    }

    /**
     * 从 JSON 恢复为一个新的数据库
     */
    public StatementResponse<String> restore(String databaseName, String json) {
        try {
            databaseManager.restore(databaseName, SnapshotCodec.decode(json));
            return StatementResponse.success(databaseName);
        } catch (RuntimeException ex) {
            LOGGER.error("恢复数据库 {} 失败", databaseName, ex);
            return StatementResponse.failure(ex.getMessage());
        }
    }
}
