package com.mvccdb.backend.statement;

import java.util.Map;

import com.mvccdb.backend.statement.condition.Condition;

public class Update {
    public String tableName;
    /**
     * 指定记录时只更新这一条；为 null 时更新所有满足 where 的可见记录
     */
    public Long recordId;
    public Map<String, Object> values;
    public Condition where;
}
