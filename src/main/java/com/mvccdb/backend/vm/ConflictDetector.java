package com.mvccdb.backend.vm;

import java.util.function.Function;

import com.mvccdb.backend.txm.RecordKey;
import com.mvccdb.backend.txm.Transaction;
import com.mvccdb.backend.txm.TransactionManager;

/**
 * 提交时的写写冲突检测（first-committer-wins）。
 * <p>
 * 对写集合中的每个 (表, 记录)，若存在另一个不在本事务快照中、且已提交的事务
 * 也创建或标记删除过这条记录的版本，则判定冲突。
 * 调用方需持有这些记录的提交锁。
 */
class ConflictDetector {

    private final TransactionManager txm;
    private final Function<String, VersionStore> partitions;

    ConflictDetector(TransactionManager txm, Function<String, VersionStore> partitions) {
        this.txm = txm;
        this.partitions = partitions;
    }

    /**
     * @return 第一个发生冲突的记录，没有冲突返回 null
     */
    RecordKey findConflict(Transaction tx) {
        for (RecordKey key : tx.writeSet) {
            VersionStore store = partitions.apply(key.getTable());
            if(store == null) {
                // 表已被删除，不再有并发写者
                continue;
            }
            VersionChain chain = store.chainOf(key.getRecordId());
            if(chain == null) {
                continue;
            }
            for (Version v : chain.versions()) {
                if(isConcurrentWriter(tx, v.getCreatedBy())) {
                    return key;
                }
                for (long deleter : v.getDeleteMarks()) {
                    if(isConcurrentWriter(tx, deleter)) {
                        return key;
                    }
                }
            }
        }
        return null;
    }

    private boolean isConcurrentWriter(Transaction tx, long writer) {
        return writer != tx.xid && !tx.isInSnapshot(writer) && txm.isCommitted(writer);
    }
}
