package com.mvccdb.backend.txm;

/**
 * ACTIVE 是唯一的非终态，COMMITTED / ABORTED 互斥且只能进入一次
 */
public enum TransactionStatus {
    ACTIVE,
    COMMITTED,
    ABORTED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
