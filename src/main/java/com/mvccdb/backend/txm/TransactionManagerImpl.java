package com.mvccdb.backend.txm;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.google.common.collect.ImmutableSet;

import com.mvccdb.common.Error;

public class TransactionManagerImpl implements TransactionManager {

    private final Map<Long, Transaction> transactions = new ConcurrentHashMap<>();
    // 已提交事务 ID，快照从这里拷贝
    private final Set<Long> committed = ConcurrentHashMap.newKeySet();
    private final AtomicLong xidCounter = new AtomicLong(0);
    // 最近一次完成的提交序号，读视图固定在它上面；只在写锁内推进
    private volatile long commitSeq = 0;
    private final SnapshotManager snapshotManager;

    // 读锁：begin 捕获快照；写锁：提交翻转状态。二者互斥，快照不会看到“提交到一半”的集合
    private final Lock rLock;
    private final Lock wLock;

    TransactionManagerImpl() {
        ReadWriteLock rwLock = new ReentrantReadWriteLock();
        this.rLock = rwLock.readLock();
        this.wLock = rwLock.writeLock();
        this.snapshotManager = new SnapshotManager(this);
    }

    @Override
    public Transaction begin(IsolationLevel level) {
        if(level == null) {
            throw Error.InvalidIsolationException;
        }
        rLock.lock();
        try {
            long xid = xidCounter.incrementAndGet();
            Set<Long> snapshot = level.usesSnapshot() ? snapshotManager.capture() : null;
            Transaction tx = Transaction.newTransaction(xid, level, snapshot);
            transactions.put(xid, tx);
            return tx;
        } finally {
            rLock.unlock();
        }
    }

    @Override
    public void commit(long xid) {
        Transaction tx = get(xid);
        wLock.lock();
        try {
            if(!tx.finish(TransactionStatus.COMMITTED)) {
                throw Error.InvalidTransactionException;
            }
            long seq = commitSeq + 1;
            tx.setCommitSeq(seq);
            committed.add(xid);
            // 序号最后发布，之前拿到的读视图仍把该事务当作未提交
            commitSeq = seq;
        } finally {
            wLock.unlock();
        }
    }

    @Override
    public void abort(long xid) {
        Transaction tx = get(xid);
        if(tx.finish(TransactionStatus.ABORTED)) {
            return;
        }
        // 重复回滚不报错，已提交的事务不能再回滚
        if(tx.getStatus() != TransactionStatus.ABORTED) {
            throw Error.InvalidTransactionException;
        }
    }

    @Override
    public Transaction get(long xid) {
        Transaction tx = transactions.get(xid);
        if(tx == null) {
            throw Error.InvalidTransactionException;
        }
        return tx;
    }

    @Override
    public Transaction getActive(long xid) {
        Transaction tx = get(xid);
        if(!tx.isActive()) {
            throw Error.InvalidTransactionException;
        }
        return tx;
    }

    @Override
    public TransactionStatus statusOf(long xid) {
        return get(xid).getStatus();
    }

    @Override
    public boolean isActive(long xid) {
        return checkStatus(xid, TransactionStatus.ACTIVE);
    }

    @Override
    public boolean isCommitted(long xid) {
        return checkStatus(xid, TransactionStatus.COMMITTED);
    }

    @Override
    public boolean isAborted(long xid) {
        return checkStatus(xid, TransactionStatus.ABORTED);
    }

    @Override
    public ReadView readView() {
        return new ReadView(transactions, commitSeq);
    }

    @Override
    public RegistrySnapshot snapshot() {
        List<TransactionInfo> active = new ArrayList<>();
        List<TransactionInfo> committedInfos = new ArrayList<>();
        List<TransactionInfo> aborted = new ArrayList<>();
        for (Transaction tx : transactions()) {
            TransactionInfo info = TransactionInfo.of(tx);
            switch (info.getStatus()) {
                case ACTIVE:
                    active.add(info);
                    break;
                case COMMITTED:
                    committedInfos.add(info);
                    break;
                case ABORTED:
                    aborted.add(info);
                    break;
            }
        }
        return new RegistrySnapshot(active, committedInfos, aborted, xidCounter.get() + 1);
    }

    @Override
    public List<Transaction> transactions() {
        List<Transaction> all = new ArrayList<>(transactions.values());
        all.sort(Comparator.comparingLong(tx -> tx.xid));
        return all;
    }

    @Override
    public void restore(Collection<TransactionInfo> infos, long nextXid) {
        wLock.lock();
        try {
            transactions.clear();
            committed.clear();
            long maxXid = 0;
            Instant now = Instant.now();
            for (TransactionInfo info : infos) {
                TransactionStatus status = info.getStatus();
                Instant endedAt = info.getEndedAt() == null ? null : Instant.ofEpochMilli(info.getEndedAt());
                // 导出时仍活跃的事务已无人继续，按回滚处理
                if(status == TransactionStatus.ACTIVE) {
                    status = TransactionStatus.ABORTED;
                    endedAt = now;
                }
                Transaction tx = Transaction.restored(info.getId(), info.getIsolation(), status,
                        Instant.ofEpochMilli(info.getStartedAt()), endedAt);
                transactions.put(tx.xid, tx);
                if(status == TransactionStatus.COMMITTED) {
                    tx.setCommitSeq(0);
                    committed.add(tx.xid);
                }
                maxXid = Math.max(maxXid, tx.xid);
            }
            xidCounter.set(Math.max(maxXid, nextXid - 1));
            commitSeq = 0;
        } finally {
            wLock.unlock();
        }
    }

    Set<Long> committedXids() {
        return ImmutableSet.copyOf(committed);
    }

    private boolean checkStatus(long xid, TransactionStatus status) {
        Transaction tx = transactions.get(xid);
        return tx != null && tx.getStatus() == status;
    }
}
