package com.mvccdb.backend.vm;

import java.util.List;
import java.util.Map;

import com.mvccdb.backend.txm.IsolationLevel;
import com.mvccdb.backend.txm.Transaction;
import com.mvccdb.backend.txm.TransactionManager;

/**
 * 版本管理：按隔离级别读取可见版本、追加新版本，并在提交时做冲突检测。
 * 所有读写都要求事务处于 ACTIVE，否则抛 InvalidTransactionException。
 */
public interface VersionManager {

    Transaction begin(IsolationLevel level);

    /**
     * 提交。RR / SERIALIZABLE 发现写写冲突时事务被置为 ABORTED 并抛 SerializationConflictException。
     */
    void commit(long xid);

    /**
     * 回滚，立即生效，不做冲突检测
     */
    void abort(long xid);

    /**
     * @return 对事务可见的版本，不存在时返回 null
     */
    Version read(long xid, String table, long recordId);

    /**
     * 表中所有对事务可见的版本，按 record id 升序
     */
    List<Version> scan(long xid, String table);

    Version insert(long xid, String table, long recordId, Map<String, Object> values);

    /**
     * 以最新已提交（或自己写入）的版本为基础生成新版本，newValues 覆盖同名列
     */
    Version update(long xid, String table, long recordId, Map<String, Object> newValues);

    void delete(long xid, String table, long recordId);

    VersionStore createPartition(String table);

    void dropPartition(String table);

    /**
     * @return 表的版本分区，不存在时返回 null
     */
    VersionStore partition(String table);

    TransactionManager getTransactionManager();

    static VersionManager newVersionManager(TransactionManager txm) {
        return new VersionManagerImpl(txm);
    }
}
