package com.mvccdb.backend.txm;

import java.util.Objects;

import com.google.common.collect.ComparisonChain;

/**
 * 写集合中的一项：(表名, 记录 ID)
 */
public final class RecordKey implements Comparable<RecordKey> {
    private final String table;
    private final long recordId;

    public RecordKey(String table, long recordId) {
        this.table = Objects.requireNonNull(table);
        this.recordId = recordId;
    }

    public String getTable() {
        return table;
    }

    public long getRecordId() {
        return recordId;
    }

    @Override
    public int compareTo(RecordKey o) {
        return ComparisonChain.start()
                .compare(table, o.table)
                .compare(recordId, o.recordId)
                .result();
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) return true;
        if(!(o instanceof RecordKey)) return false;
        RecordKey that = (RecordKey) o;
        return recordId == that.recordId && table.equals(that.table);
    }

    @Override
    public int hashCode() {
        return Objects.hash(table, recordId);
    }

    @Override
    public String toString() {
        return table + "#" + recordId;
    }
}
