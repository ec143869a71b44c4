package com.mvccdb.backend.vm;

import com.mvccdb.backend.txm.ReadView;
import com.mvccdb.backend.txm.Transaction;
import com.mvccdb.backend.txm.TransactionManager;

/**
 * 版本可见性解析：从新到旧扫描版本链，返回第一个满足规则的版本。
 * 一次解析内的所有判断共用同一个读视图。
 */
public class Visibility {

    private Visibility() {
    }

    public static boolean isVisible(TransactionManager txm, Transaction tx, Version v) {
        return VisibilityRule.of(tx.level).admits(txm, txm.readView(), tx, v);
    }

    /**
     * 按事务自身隔离级别解析可见版本
     *
     * @return 可见版本，记录对该事务不存在时返回 null
     */
    public static Version visibleVersion(TransactionManager txm, Transaction tx, VersionChain chain) {
        return visibleVersion(txm, txm.readView(), tx, chain);
    }

    /**
     * 用调用方给定的读视图解析，整表扫描时所有记录共用一个视图
     */
    public static Version visibleVersion(TransactionManager txm, ReadView view, Transaction tx, VersionChain chain) {
        return resolve(VisibilityRule.of(tx.level), txm, view, tx, chain);
    }

    /**
     * 写者总是基于最新已提交状态（或自己的写入）操作，与事务隔离级别无关
     */
    public static Version latestForWrite(TransactionManager txm, Transaction tx, VersionChain chain) {
        return latestForWrite(txm, txm.readView(), tx, chain);
    }

    public static Version latestForWrite(TransactionManager txm, ReadView view, Transaction tx, VersionChain chain) {
        return resolve(VisibilityRule.READ_COMMITTED, txm, view, tx, chain);
    }

    private static Version resolve(VisibilityRule rule, TransactionManager txm, ReadView view,
                                   Transaction tx, VersionChain chain) {
        if(chain == null) {
            return null;
        }
        for (Version v : chain.newestFirst()) {
            if(rule.admits(txm, view, tx, v)) {
                return v;
            }
        }
        return null;
    }
}
