package com.mvccdb.backend.statement;

public class Describe {
    public String tableName;
}
