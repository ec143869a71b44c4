package com.mvccdb.backend.statement;

public class Drop {
    public String tableName;
}
