package com.mvccdb.backend.statement;

import com.mvccdb.backend.txm.IsolationLevel;

public class Begin {
    /**
     * 事务隔离级别，为 null 时使用引擎默认级别
     */
    public IsolationLevel isolationLevel;

    public static Begin of(IsolationLevel level) {
        Begin begin = new Begin();
        begin.isolationLevel = level;
        return begin;
    }
}
