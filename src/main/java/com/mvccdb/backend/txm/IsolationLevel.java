package com.mvccdb.backend.txm;

import java.util.Locale;

import com.mvccdb.common.Error;

/**
 * 事务隔离级别
 */
public enum IsolationLevel {
    READ_UNCOMMITTED,
    READ_COMMITTED,
    REPEATABLE_READ,
    SERIALIZABLE;

    /**
     * RR 与 SERIALIZABLE 在 begin 时冻结已提交事务快照
     */
    public boolean usesSnapshot() {
        return this == REPEATABLE_READ || this == SERIALIZABLE;
    }

    /**
     * 提交时是否需要做写写冲突检测（first-committer-wins）
     */
    public boolean checksConflicts() {
        return usesSnapshot();
    }

    public static IsolationLevel defaultLevel() {
        return READ_COMMITTED;
    }

    /**
     * 解析隔离级别，兼容 "read committed" / "READ_COMMITTED" / "read-committed" 写法
     */
    public static IsolationLevel from(String s) {
        if(s == null || s.isBlank()) {
            throw Error.InvalidIsolationException;
        }
        String normalized = s.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        try {
            return IsolationLevel.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw Error.InvalidIsolationException;
        }
    }
}
