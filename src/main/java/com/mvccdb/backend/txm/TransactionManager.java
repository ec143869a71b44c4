package com.mvccdb.backend.txm;

import java.util.Collection;
import java.util.List;

/**
 * 事务登记表：分配事务 ID，维护每个事务的状态与元信息。
 * <p>
 * 这里的 commit / abort 只负责状态翻转；
 * 提交前的冲突检测由 {@code VersionManager#commit} 完成后再调用这里。
 */
public interface TransactionManager {

    /**
     * 开启事务。RR / SERIALIZABLE 会在返回前冻结快照。
     *
     * @param level 隔离级别，为 null 时抛 InvalidIsolationException
     */
    Transaction begin(IsolationLevel level);

    /**
     * ACTIVE -> COMMITTED，非 ACTIVE 或未知事务抛 InvalidTransactionException
     */
    void commit(long xid);

    /**
     * ACTIVE -> ABORTED。已 ABORTED 的事务视为成功，COMMITTED 或未知事务抛 InvalidTransactionException
     */
    void abort(long xid);

    Transaction get(long xid);

    /**
     * 获取事务并要求其处于 ACTIVE
     */
    Transaction getActive(long xid);

    TransactionStatus statusOf(long xid);

    boolean isActive(long xid);

    boolean isCommitted(long xid);

    boolean isAborted(long xid);

    /**
     * 当前提交状态的读视图。同一个视图内的判断不会看到提交到一半的事务。
     */
    ReadView readView();

    RegistrySnapshot snapshot();

    /**
     * 全部事务，按 ID 升序
     */
    List<Transaction> transactions();

    /**
     * 用外部快照中的事务替换当前登记表，仅在引擎对外可见之前调用
     */
    void restore(Collection<TransactionInfo> infos, long nextXid);

    static TransactionManager create() {
        return new TransactionManagerImpl();
    }
}
