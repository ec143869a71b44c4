package com.mvccdb.backend.txm;

import java.util.Map;

/**
 * 读视图：固定在某个提交序号上的“已提交”判断。
 * <p>
 * 只有提交序号不大于视图序号的事务才算已提交。视图创建之后才完成的提交对它不可见，
 * 一次版本链扫描内的所有判断因此看到同一个提交状态。
 */
public final class ReadView {

    private final Map<Long, Transaction> transactions;
    private final long commitSeq;

    ReadView(Map<Long, Transaction> transactions, long commitSeq) {
        this.transactions = transactions;
        this.commitSeq = commitSeq;
    }

    public long getCommitSeq() {
        return commitSeq;
    }

    public boolean isCommitted(long xid) {
        Transaction tx = transactions.get(xid);
        return tx != null
                && tx.getStatus() == TransactionStatus.COMMITTED
                && tx.getCommitSeq() <= commitSeq;
    }
}
