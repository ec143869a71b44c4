package com.mvccdb.backend.statement;

import com.mvccdb.backend.statement.condition.Condition;

public class Delete {
    public String tableName;
    /**
     * 指定记录时只删除这一条；为 null 时删除所有满足 where 的可见记录
     */
    public Long recordId;
    public Condition where;
}
