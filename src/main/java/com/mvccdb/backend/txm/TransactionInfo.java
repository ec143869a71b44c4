package com.mvccdb.backend.txm;

/**
 * 登记表快照中的一条事务摘要，时间戳为 epoch 毫秒，endedAt 为 null 表示尚未结束。
 */
public class TransactionInfo {
    private long id;
    private IsolationLevel isolation;
    private TransactionStatus status;
    private long startedAt;
    private Long endedAt;
    private int writeCount;

    // 默认构造函数供序列化框架使用
    public TransactionInfo() {}

    public TransactionInfo(long id, IsolationLevel isolation, TransactionStatus status,
                           long startedAt, Long endedAt, int writeCount) {
        this.id = id;
        this.isolation = isolation;
        this.status = status;
        this.startedAt = startedAt;
        this.endedAt = endedAt;
        this.writeCount = writeCount;
    }

    public static TransactionInfo of(Transaction tx) {
        return new TransactionInfo(
                tx.xid,
                tx.level,
                tx.getStatus(),
                tx.startedAt.toEpochMilli(),
                tx.getEndedAt() == null ? null : tx.getEndedAt().toEpochMilli(),
                tx.writeSet.size());
    }

    public long getId() {
        return id;
    }

    public IsolationLevel getIsolation() {
        return isolation;
    }

    public TransactionStatus getStatus() {
        return status;
    }

    public long getStartedAt() {
        return startedAt;
    }

    public Long getEndedAt() {
        return endedAt;
    }

    public int getWriteCount() {
        return writeCount;
    }
}
