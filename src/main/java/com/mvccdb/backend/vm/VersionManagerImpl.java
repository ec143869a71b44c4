package com.mvccdb.backend.vm;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mvccdb.backend.txm.IsolationLevel;
import com.mvccdb.backend.txm.ReadView;
import com.mvccdb.backend.txm.RecordKey;
import com.mvccdb.backend.txm.Transaction;
import com.mvccdb.backend.txm.TransactionManager;
import com.mvccdb.common.Error;

public class VersionManagerImpl implements VersionManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(VersionManagerImpl.class);

    private final TransactionManager txm;
    private final Map<String, VersionStore> partitions = new ConcurrentHashMap<>();
    private final CommitLockTable commitLocks;
    private final ConflictDetector conflictDetector;

    public VersionManagerImpl(TransactionManager txm) {
        this.txm = txm;
        this.commitLocks = new CommitLockTable();
        this.conflictDetector = new ConflictDetector(txm, partitions::get);
    }

    @Override
    public TransactionManager getTransactionManager() {
        return txm;
    }

    /**
     * 开启事务
     * @param level 事务隔离级别
     */
    @Override
    public Transaction begin(IsolationLevel level) {
        Transaction tx = txm.begin(level);
        LOGGER.debug("begin xid={} level={} snapshot={}", tx.xid, level, tx.snapshot.size());
        return tx;
    }

    @Override
    public void commit(long xid) {
        Transaction tx = txm.getActive(xid);
        // 写集合为空时 lockAll 不加任何锁
        List<Lock> locks = commitLocks.lockAll(new ArrayList<>(tx.writeSet));
        try {
            if(tx.level.checksConflicts()) {
                RecordKey conflict = conflictDetector.findConflict(tx);
                if(conflict != null) {
                    txm.abort(xid);
                    LOGGER.debug("xid={} aborted, concurrent committed writer on {}", xid, conflict);
                    throw Error.SerializationConflictException;
                }
            }
            txm.commit(xid);
            LOGGER.debug("commit xid={} writes={}", xid, tx.writeSet.size());
        } finally {
            commitLocks.unlockAll(locks);
        }
    }

    @Override
    public void abort(long xid) {
        txm.abort(xid);
        LOGGER.debug("abort xid={}", xid);
    }

    @Override
    public Version read(long xid, String table, long recordId) {
        Transaction tx = txm.getActive(xid);
        VersionStore store = requirePartition(table);
        return Visibility.visibleVersion(txm, tx, store.chainOf(recordId));
    }

    @Override
    public List<Version> scan(long xid, String table) {
        Transaction tx = txm.getActive(xid);
        VersionStore store = requirePartition(table);
        List<Version> visible = new ArrayList<>();
        ReadView view = txm.readView();
        for (Long recordId : store.allRecordIds()) {
            Version v = Visibility.visibleVersion(txm, view, tx, store.chainOf(recordId));
            if(v != null) {
                visible.add(v);
            }
        }
        return visible;
    }

    @Override
    public Version insert(long xid, String table, long recordId, Map<String, Object> values) {
        Transaction tx = txm.getActive(xid);
        VersionStore store = requirePartition(table);
        VersionChain chain = store.getOrCreateChain(recordId);
        Version created;
        synchronized (chain) {
            // 不允许遮住一条写者可见的存活记录
            if(Visibility.latestForWrite(txm, tx, chain) != null) {
                throw Error.DuplicateKeyException;
            }
            created = new Version(recordId, values, xid);
            chain.append(created);
        }
        tx.addWrite(new RecordKey(table, recordId));
        return created;
    }

    @Override
    public Version update(long xid, String table, long recordId, Map<String, Object> newValues) {
        Transaction tx = txm.getActive(xid);
        VersionStore store = requirePartition(table);
        VersionChain chain = store.chainOf(recordId);
        if(chain == null) {
            throw Error.RecordNotFoundException;
        }
        Version created;
        synchronized (chain) {
            Version current = Visibility.latestForWrite(txm, tx, chain);
            if(current == null) {
                throw Error.RecordNotFoundException;
            }
            Map<String, Object> merged = new LinkedHashMap<>(current.getValues());
            merged.putAll(newValues);
            created = new Version(recordId, merged, xid);
            // 先追加新版本再标记旧版本，读未提交的读者不会看到记录短暂消失
            chain.append(created);
            current.markDeleted(xid);
        }
        tx.addWrite(new RecordKey(table, recordId));
        return created;
    }

    @Override
    public void delete(long xid, String table, long recordId) {
        Transaction tx = txm.getActive(xid);
        VersionStore store = requirePartition(table);
        VersionChain chain = store.chainOf(recordId);
        if(chain == null) {
            throw Error.RecordNotFoundException;
        }
        synchronized (chain) {
            Version current = Visibility.latestForWrite(txm, tx, chain);
            if(current == null) {
                throw Error.RecordNotFoundException;
            }
            current.markDeleted(xid);
        }
        tx.addWrite(new RecordKey(table, recordId));
    }

    @Override
    public VersionStore createPartition(String table) {
        VersionStore store = new VersionStore(table);
        if(partitions.putIfAbsent(table, store) != null) {
            throw Error.DuplicatedTableException;
        }
        return store;
    }

    @Override
    public void dropPartition(String table) {
        if(partitions.remove(table) == null) {
            throw Error.TableNotFoundException;
        }
    }

    @Override
    public VersionStore partition(String table) {
        return partitions.get(table);
    }

    private VersionStore requirePartition(String table) {
        VersionStore store = partitions.get(table);
        if(store == null) {
            throw Error.TableNotFoundException;
        }
        return store;
    }
}
