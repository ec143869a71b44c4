package com.mvccdb.backend.tbm;

import java.time.Instant;
import java.util.List;

import com.mvccdb.backend.statement.Begin;
import com.mvccdb.backend.statement.Create;
import com.mvccdb.backend.statement.Delete;
import com.mvccdb.backend.statement.Describe;
import com.mvccdb.backend.statement.Drop;
import com.mvccdb.backend.statement.Insert;
import com.mvccdb.backend.statement.Select;
import com.mvccdb.backend.statement.Show;
import com.mvccdb.backend.statement.Update;
import com.mvccdb.backend.txm.IsolationLevel;
import com.mvccdb.backend.txm.RegistrySnapshot;
import com.mvccdb.backend.vm.VersionManager;
import com.mvccdb.common.QueryResult;

/**
 * 表管理：DDL（不参与事务）+ 事务内的增删改查。
 */
public interface TableManager {
    VersionManager getVersionManager();

    BeginResult begin(Begin begin);
    QueryResult commit(long xid);
    QueryResult abort(long xid);

    QueryResult show(Show show);
    QueryResult describe(Describe describe);
    QueryResult create(Create create);
    QueryResult drop(Drop drop);

    QueryResult insert(long xid, Insert insert);
    QueryResult read(long xid, Select select);
    QueryResult update(long xid, Update update);
    QueryResult delete(long xid, Delete delete);

    /**
     * 事务注册表快照，供监控使用
     */
    RegistrySnapshot registrySnapshot();

    /**
     * @return 表，不存在时返回 null
     */
    Table getTable(String name);

    /**
     * 所有表，按表名排序
     */
    List<Table> tables();

    /**
     * 从外部快照恢复一张空表，版本由调用方写入 {@link Table#getStore()}
     */
    Table restoreTable(String name, List<Field> fields, Instant createdAt, long nextRecordId);

    /**
     * 创建一个表管理器
     * @param vm 版本管理器
     * @param defaultLevel BEGIN 未指定隔离级别时使用的级别
     */
    static TableManager create(VersionManager vm, IsolationLevel defaultLevel) {
        return new TableManagerImpl(vm, defaultLevel);
    }
}
