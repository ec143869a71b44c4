package com.mvccdb.backend.statement;

import java.util.Map;

public class Insert {
    public String tableName;
    /**
     * 为 null 时由表分配下一个 record id
     */
    public Long recordId;
    /**
     * 列名 -> 值，未给出的列取类型默认值
     */
    public Map<String, Object> values;
}
