package com.mvccdb.backend.statement;

public class DropDatabase {
    public String databaseName;
}
