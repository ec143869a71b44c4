package com.mvccdb.backend.vm;

import java.util.NavigableSet;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * 一张表的版本分区：record id -> 版本链，record id 有序
 */
public class VersionStore {
    private final String table;
    private final ConcurrentSkipListMap<Long, VersionChain> chains = new ConcurrentSkipListMap<>();

    VersionStore(String table) {
        this.table = table;
    }

    public String getTable() {
        return table;
    }

    /**
     * @return 版本链，记录从未写入过时返回 null
     */
    public VersionChain chainOf(long recordId) {
        return chains.get(recordId);
    }

    public NavigableSet<Long> allRecordIds() {
        return chains.navigableKeySet();
    }

    public void append(long recordId, Version version) {
        getOrCreateChain(recordId).append(version);
    }

    public int size() {
        return chains.size();
    }

    VersionChain getOrCreateChain(long recordId) {
        return chains.computeIfAbsent(recordId, VersionChain::new);
    }
}
