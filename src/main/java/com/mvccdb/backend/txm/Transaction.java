package com.mvccdb.backend.txm;

import java.time.Instant;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

import com.google.common.collect.ImmutableSet;

/**
 * 事务登记表中的一条事务记录。
 * 其他组件只读取它，状态只由 {@link TransactionManager} 推进。
 */
public class Transaction {
    public final long xid;
    public final IsolationLevel level;
    public final Instant startedAt;
    /**
     * begin 时已提交的事务 ID，只有 RR / SERIALIZABLE 会填充，之后不再变化
     */
    public final Set<Long> snapshot;
    /**
     * 本事务创建或标记删除过版本的 (表, 记录)
     */
    public final Set<RecordKey> writeSet;

    private final AtomicReference<TransactionStatus> status;
    private volatile Instant endedAt;
    /**
     * 提交序号，未提交时为 Long.MAX_VALUE，恢复出的已提交事务为 0
     */
    private volatile long commitSeq = Long.MAX_VALUE;

    private Transaction(long xid, IsolationLevel level, Set<Long> snapshot,
                        TransactionStatus status, Instant startedAt, Instant endedAt) {
        this.xid = xid;
        this.level = level;
        this.snapshot = snapshot;
        this.writeSet = ConcurrentHashMap.newKeySet();
        this.status = new AtomicReference<>(status);
        this.startedAt = startedAt;
        this.endedAt = endedAt;
    }

    static Transaction newTransaction(long xid, IsolationLevel level, Set<Long> snapshot) {
        Set<Long> frozen = snapshot == null ? Collections.emptySet() : ImmutableSet.copyOf(snapshot);
        return new Transaction(xid, level, frozen, TransactionStatus.ACTIVE, Instant.now(), null);
    }

    /**
     * 从外部快照恢复一个已结束的事务
     */
    static Transaction restored(long xid, IsolationLevel level, TransactionStatus status,
                                Instant startedAt, Instant endedAt) {
        return new Transaction(xid, level, Collections.emptySet(), status, startedAt, endedAt);
    }

    /**
     * 判断事务是否在本事务的快照中，即在本事务开始前已提交
     */
    public boolean isInSnapshot(long xid) {
        return snapshot.contains(xid);
    }

    public TransactionStatus getStatus() {
        return status.get();
    }

    public boolean isActive() {
        return status.get() == TransactionStatus.ACTIVE;
    }

    public Instant getEndedAt() {
        return endedAt;
    }

    public long getCommitSeq() {
        return commitSeq;
    }

    void setCommitSeq(long commitSeq) {
        this.commitSeq = commitSeq;
    }

    public void addWrite(RecordKey key) {
        writeSet.add(key);
    }

    /**
     * ACTIVE -> 终态，只会成功一次
     */
    boolean finish(TransactionStatus terminal) {
        if(!status.compareAndSet(TransactionStatus.ACTIVE, terminal)) {
            return false;
        }
        endedAt = Instant.now();
        return true;
    }

    @Override
    public String toString() {
        return "Transaction{xid=" + xid + ", level=" + level + ", status=" + status.get() + "}";
    }
}
