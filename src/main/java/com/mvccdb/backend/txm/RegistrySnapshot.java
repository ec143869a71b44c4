package com.mvccdb.backend.txm;

import java.util.List;

/**
 * 事务登记表在某一时刻的视图，按状态分组、组内按 ID 升序。
 * 监控层轮询它来展示事务状态。
 */
public class RegistrySnapshot {
    private final List<TransactionInfo> active;
    private final List<TransactionInfo> committed;
    private final List<TransactionInfo> aborted;
    private final long nextXid;

    public RegistrySnapshot(List<TransactionInfo> active, List<TransactionInfo> committed,
                            List<TransactionInfo> aborted, long nextXid) {
        this.active = active;
        this.committed = committed;
        this.aborted = aborted;
        this.nextXid = nextXid;
    }

    public List<TransactionInfo> getActive() {
        return active;
    }

    public List<TransactionInfo> getCommitted() {
        return committed;
    }

    public List<TransactionInfo> getAborted() {
        return aborted;
    }

    public long getNextXid() {
        return nextXid;
    }

    public int getTotal() {
        return active.size() + committed.size() + aborted.size();
    }

    @Override
    public String toString() {
        return "RegistrySnapshot{total=" + getTotal()
                + ", active=" + active.size()
                + ", committed=" + committed.size()
                + ", aborted=" + aborted.size()
                + ", nextXid=" + nextXid + "}";
    }
}
