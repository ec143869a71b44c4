package com.mvccdb.backend.vm;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * 单条记录的版本链，按创建顺序只追加。
 * <p>
 * 版本列表以不可变 List 整体发布：读者拿到的永远是完整的一份，不需要加锁；
 * 写者在本对象的监视器上串行追加。
 */
public class VersionChain {
    private final long recordId;
    private volatile ImmutableList<Version> versions = ImmutableList.of();

    VersionChain(long recordId) {
        this.recordId = recordId;
    }

    public long getRecordId() {
        return recordId;
    }

    /**
     * 旧 -> 新
     */
    public List<Version> versions() {
        return versions;
    }

    /**
     * 新 -> 旧
     */
    public List<Version> newestFirst() {
        return versions.reverse();
    }

    public boolean isEmpty() {
        return versions.isEmpty();
    }

    synchronized void append(Version version) {
        versions = ImmutableList.<Version>builderWithExpectedSize(versions.size() + 1)
                .addAll(versions)
                .add(version)
                .build();
    }
}
