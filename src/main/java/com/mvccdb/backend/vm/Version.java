package com.mvccdb.backend.vm;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 记录的一个版本。
 * 内容创建后不可变，删除/被替代只通过追加删除标记表达。
 * <p>
 * 删除标记可能来自多个并发写者（写者之间不互相等待），
 * 读者按自己的可见性规则判断其中是否有生效的标记。
 */
public class Version {
    private final long recordId;
    private final Map<String, Object> values;
    private final long createdBy;
    // 仅用于诊断，可见性只看事务 ID
    private final Instant createdAt;
    private final Set<Long> deleteMarks = ConcurrentHashMap.newKeySet();

    Version(long recordId, Map<String, Object> values, long createdBy) {
        this(recordId, values, createdBy, Instant.now());
    }

    private Version(long recordId, Map<String, Object> values, long createdBy, Instant createdAt) {
        this.recordId = recordId;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.createdBy = createdBy;
        this.createdAt = createdAt;
    }

    /**
     * 从外部快照恢复版本
     */
    public static Version restored(long recordId, Map<String, Object> values, long createdBy,
                                   Instant createdAt, Collection<Long> deleteMarks) {
        Version v = new Version(recordId, values, createdBy, createdAt);
        v.deleteMarks.addAll(deleteMarks);
        return v;
    }

    public long getRecordId() {
        return recordId;
    }

    public Map<String, Object> getValues() {
        return values;
    }

    public long getCreatedBy() {
        return createdBy;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Set<Long> getDeleteMarks() {
        return Collections.unmodifiableSet(deleteMarks);
    }

    public boolean isMarkedBy(long xid) {
        return deleteMarks.contains(xid);
    }

    void markDeleted(long xid) {
        deleteMarks.add(xid);
    }

    @Override
    public String toString() {
        return "Version{recordId=" + recordId
                + ", createdBy=" + createdBy
                + ", deleteMarks=" + deleteMarks
                + ", values=" + values + "}";
    }
}
