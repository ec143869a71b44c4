package com.mvccdb.backend.statement;

import com.mvccdb.backend.statement.condition.Condition;

public class Select {
    public String tableName;
    /**
     * 投影列，null 或 {"*"} 表示全部列
     */
    public String[] fields;
    public Condition where;
}
