package com.mvccdb.backend.tbm;

import java.util.Map;

import com.mvccdb.backend.vm.Version;

/**
 * 对某个事务可见的一行：record id + 该版本的列值
 */
public class Row {
    private final long recordId;
    private final Map<String, Object> values;

    public Row(long recordId, Map<String, Object> values) {
        this.recordId = recordId;
        this.values = values;
    }

    static Row of(Version v) {
        return new Row(v.getRecordId(), v.getValues());
    }

    public long getRecordId() {
        return recordId;
    }

    public Map<String, Object> getValues() {
        return values;
    }

    public Object get(String field) {
        return values.get(field);
    }

    @Override
    public String toString() {
        return "Row{id=" + recordId + ", values=" + values + "}";
    }
}
