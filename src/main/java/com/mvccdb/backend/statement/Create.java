package com.mvccdb.backend.statement;

public class Create {
    public String tableName;
    public String[] fieldName;
    /**
     * 与 fieldName 一一对应：int32 / int64 / float64 / string / bool
     */
    public String[] fieldType;
}
