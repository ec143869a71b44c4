package com.mvccdb.backend.statement;

public class CreateDatabase {
    public String databaseName;
}
