package com.mvccdb.backend.statement;

/**
 * SHOW：isDatabases 为 true 时列出数据库，否则列出当前库的表
 */
public class Show {
    public boolean isDatabases;
}
