package com.mvccdb.backend.statement;

public class Use {
    public String databaseName;
}
