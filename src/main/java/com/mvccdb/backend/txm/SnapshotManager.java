package com.mvccdb.backend.txm;

import java.util.Set;

/**
 * 在事务开始时捕获已提交事务集合。
 * 捕获结果冻结进 {@link Transaction#snapshot}，此后其他事务提交不会改变它，
 * 这正是 RR / SERIALIZABLE 下可重复读的来源。
 */
class SnapshotManager {

    private final TransactionManagerImpl txm;

    SnapshotManager(TransactionManagerImpl txm) {
        this.txm = txm;
    }

    /**
     * 调用方需持有登记表读锁，保证与提交的状态翻转互斥
     */
    Set<Long> capture() {
        return txm.committedXids();
    }
}
