package com.mvccdb.backend.vm;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.locks.Lock;

import com.google.common.util.concurrent.Striped;

import com.mvccdb.backend.txm.RecordKey;

/**
 * 提交时按写集合加的锁。
 * <p>
 * Striped#bulkGet 返回的锁按条带下标排序，所有提交者以同一全局顺序加锁，不会互相死锁。
 * 同一条带可能出现多次，底层是可重入锁，按同样次数释放即可。
 */
class CommitLockTable {

    private static final int DEFAULT_STRIPES = 256;

    private final Striped<Lock> stripes;

    CommitLockTable() {
        this(DEFAULT_STRIPES);
    }

    CommitLockTable(int stripes) {
        this.stripes = Striped.lock(stripes);
    }

    /**
     * 按全局顺序锁住 keys 对应的全部条带
     *
     * @return 已加的锁，交给 {@link #unlockAll(List)} 释放
     */
    List<Lock> lockAll(Collection<RecordKey> keys) {
        List<Lock> acquired = new ArrayList<>(keys.size());
        try {
            for (Lock lock : stripes.bulkGet(keys)) {
                lock.lock();
                acquired.add(lock);
            }
        } catch (RuntimeException e) {
            unlockAll(acquired);
            throw e;
        }
        return acquired;
    }

    void unlockAll(List<Lock> acquired) {
        for (int i = acquired.size() - 1; i >= 0; i--) {
            acquired.get(i).unlock();
        }
    }
}
