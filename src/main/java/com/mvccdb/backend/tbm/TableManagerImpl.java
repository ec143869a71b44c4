package com.mvccdb.backend.tbm;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

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
import com.mvccdb.backend.txm.Transaction;
import com.mvccdb.backend.vm.VersionManager;
import com.mvccdb.backend.vm.VersionStore;
import com.mvccdb.common.Error;
import com.mvccdb.common.QueryResult;
import com.mvccdb.common.ResultSet;

public class TableManagerImpl implements TableManager {
    private final VersionManager vm;
    private final IsolationLevel defaultLevel;
    private final Map<String, Table> tableCache;
    // 读锁：表上的读写操作；写锁：建表/删表
    private final Lock rLock;
    private final Lock wLock;

    TableManagerImpl(VersionManager vm, IsolationLevel defaultLevel) {
        this.vm = vm;
        this.defaultLevel = defaultLevel == null ? IsolationLevel.defaultLevel() : defaultLevel;
        this.tableCache = new HashMap<>();
        ReadWriteLock rwLock = new ReentrantReadWriteLock();
        rLock = rwLock.readLock();
        wLock = rwLock.writeLock();
    }

    @Override
    public VersionManager getVersionManager() {
        return vm;
    }

    @Override
    public BeginResult begin(Begin begin) {
        BeginResult res = new BeginResult();
        IsolationLevel level = begin == null || begin.isolationLevel == null ? defaultLevel : begin.isolationLevel;
        Transaction tx = vm.begin(level);
        res.xid = tx.xid;
        res.result = QueryResult.message("begin " + level, 0);
        return res;
    }

    @Override
    public QueryResult commit(long xid) {
        vm.commit(xid);
        return QueryResult.message("commit", 0);
    }

    @Override
    public QueryResult abort(long xid) {
        vm.abort(xid);
        return QueryResult.message("abort", 0);
    }

    /**
     * 显示所有表
     */
    @Override
    public QueryResult show(Show show) {
        List<String> headers = List.of("Table", "Columns", "Records", "Created");
        List<List<String>> rows = new ArrayList<>();
        for (Table tb : tables()) {
            List<String> columns = new ArrayList<>();
            for (Field field : tb.fields) {
                columns.add(field.fieldName + " " + field.getTypeName());
            }
            rows.add(List.of(tb.name, String.join(", ", columns),
                    String.valueOf(tb.store.size()), tb.createdAt.toString()));
        }
        return QueryResult.resultSet(new ResultSet(headers, rows));
    }

    @Override
    public QueryResult describe(Describe describe) {
        return QueryResult.resultSet(requireTable(describe.tableName).describe());
    }

    @Override
    public QueryResult create(Create create) {
        wLock.lock();
        try {
            if(tableCache.containsKey(create.tableName)) {
                throw Error.DuplicatedTableException;
            }
            Table table = Table.createTable(this, create);
            tableCache.put(create.tableName, table);
            return QueryResult.message("create " + create.tableName, 0);
        } finally {
            wLock.unlock();
        }
    }

    @Override
    public QueryResult drop(Drop drop) {
        wLock.lock();
        try {
            if(!tableCache.containsKey(drop.tableName)) {
                throw Error.TableNotFoundException;
            }
            vm.dropPartition(drop.tableName);
            tableCache.remove(drop.tableName);
            return QueryResult.message("drop table " + drop.tableName, 0);
        } finally {
            wLock.unlock();
        }
    }

    @Override
    public QueryResult insert(long xid, Insert insert) {
        rLock.lock();
        try {
            long recordId = requireTableLocked(insert.tableName).insert(xid, insert);
            return QueryResult.inserted(recordId);
        } finally {
            rLock.unlock();
        }
    }

    @Override
    public QueryResult read(long xid, Select read) {
        rLock.lock();
        try {
            ResultSet data = requireTableLocked(read.tableName).read(xid, read);
            return QueryResult.resultSet(data);
        } finally {
            rLock.unlock();
        }
    }

    @Override
    public QueryResult update(long xid, Update update) {
        rLock.lock();
        try {
            int count = requireTableLocked(update.tableName).update(xid, update);
            return QueryResult.message("update", count);
        } finally {
            rLock.unlock();
        }
    }

    @Override
    public QueryResult delete(long xid, Delete delete) {
        rLock.lock();
        try {
            int count = requireTableLocked(delete.tableName).delete(xid, delete);
            return QueryResult.message("delete", count);
        } finally {
            rLock.unlock();
        }
    }

    @Override
    public RegistrySnapshot registrySnapshot() {
        return vm.getTransactionManager().snapshot();
    }

    @Override
    public Table getTable(String name) {
        rLock.lock();
        try {
            return tableCache.get(name);
        } finally {
            rLock.unlock();
        }
    }

    @Override
    public List<Table> tables() {
        List<Table> res;
        rLock.lock();
        try {
            res = new ArrayList<>(tableCache.values());
        } finally {
            rLock.unlock();
        }
        res.sort((a, b) -> a.name.compareTo(b.name));
        return res;
    }

    @Override
    public Table restoreTable(String name, List<Field> fields, Instant createdAt, long nextRecordId) {
        wLock.lock();
        try {
            if(tableCache.containsKey(name)) {
                throw Error.DuplicatedTableException;
            }
            VersionStore store = vm.createPartition(name);
            Table table = new Table(this, name, fields, store, createdAt, nextRecordId);
            tableCache.put(name, table);
            return table;
        } finally {
            wLock.unlock();
        }
    }

    private Table requireTable(String name) {
        rLock.lock();
        try {
            return requireTableLocked(name);
        } finally {
            rLock.unlock();
        }
    }

    private Table requireTableLocked(String name) {
        Table table = tableCache.get(name);
        if(table == null) {
            throw Error.TableNotFoundException;
        }
        return table;
    }
}
