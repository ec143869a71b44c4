package com.mvccdb.backend.vm;

import com.mvccdb.backend.txm.IsolationLevel;
import com.mvccdb.backend.txm.ReadView;
import com.mvccdb.backend.txm.Transaction;
import com.mvccdb.backend.txm.TransactionManager;

/**
 * 每种隔离级别对应的单版本可见性判断。
 * 新增隔离级别时 {@link #of(IsolationLevel)} 的 switch 会提醒补全规则。
 */
enum VisibilityRule {

    /**
     * 不看提交状态，只排除已回滚事务的版本与删除标记
     */
    READ_UNCOMMITTED {
        @Override
        boolean admits(TransactionManager txm, ReadView view, Transaction tx, Version v) {
            if(txm.isAborted(v.getCreatedBy())) {
                return false;
            }
            for (long deleter : v.getDeleteMarks()) {
                if(!txm.isAborted(deleter)) {
                    return false;
                }
            }
            return true;
        }
    },

    /**
     * 自己写的或已提交的版本，且没有被自己或已提交事务删除。
     * “已提交”以读视图为准，视图在每次读时重新获取。
     */
    READ_COMMITTED {
        @Override
        boolean admits(TransactionManager txm, ReadView view, Transaction tx, Version v) {
            long creator = v.getCreatedBy();
            if(creator != tx.xid && !view.isCommitted(creator)) {
                return false;
            }
            for (long deleter : v.getDeleteMarks()) {
                if(deleter == tx.xid || view.isCommitted(deleter)) {
                    return false;
                }
            }
            return true;
        }
    },

    /**
     * 与 READ_COMMITTED 相同，只是“已提交”换成“在 begin 时冻结的快照中”
     */
    SNAPSHOT {
        @Override
        boolean admits(TransactionManager txm, ReadView view, Transaction tx, Version v) {
            long creator = v.getCreatedBy();
            if(creator != tx.xid && !tx.isInSnapshot(creator)) {
                return false;
            }
            for (long deleter : v.getDeleteMarks()) {
                if(deleter == tx.xid || tx.isInSnapshot(deleter)) {
                    return false;
                }
            }
            return true;
        }
    };

    abstract boolean admits(TransactionManager txm, ReadView view, Transaction tx, Version v);

    static VisibilityRule of(IsolationLevel level) {
        switch (level) {
            case READ_UNCOMMITTED:
                return READ_UNCOMMITTED;
            case READ_COMMITTED:
                return READ_COMMITTED;
            case REPEATABLE_READ:
            case SERIALIZABLE:
                return SNAPSHOT;
            default:
                throw new IllegalArgumentException("Unknown isolation level: " + level);
        }
    }
}
