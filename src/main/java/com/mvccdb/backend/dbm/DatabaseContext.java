package com.mvccdb.backend.dbm;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import com.mvccdb.backend.tbm.Field;
import com.mvccdb.backend.tbm.FieldType;
import com.mvccdb.backend.tbm.Table;
import com.mvccdb.backend.tbm.TableManager;
import com.mvccdb.backend.txm.IsolationLevel;
import com.mvccdb.backend.txm.RegistrySnapshot;
import com.mvccdb.backend.txm.Transaction;
import com.mvccdb.backend.txm.TransactionInfo;
import com.mvccdb.backend.txm.TransactionManager;
import com.mvccdb.backend.vm.Version;
import com.mvccdb.backend.vm.VersionChain;
import com.mvccdb.backend.vm.VersionManager;
import com.mvccdb.backend.vm.VersionStore;
import com.mvccdb.common.Error;

/**
 * 封装单个数据库实例关联的 TM/VM/TBM 组件，
 * 并用引用计数控制其生命周期，支持在多个会话之间复用。
 * <p>
 * 每个实例持有独立的事务登记表和版本存储，互不共享任何状态。
 */
public class DatabaseContext {

    private final String name;
    private final Instant createdAt;

    private final TransactionManager txm;
    private final VersionManager vm;
    private final TableManager tbm;

    /** 当前有多少个 Executor 持有这个上下文 */
    private final AtomicInteger refCount = new AtomicInteger(0);

    DatabaseContext(String name, TransactionManager txm, VersionManager vm, TableManager tbm) {
        this.name = name;
        this.createdAt = Instant.now();
        this.txm = txm;
        this.vm = vm;
        this.tbm = tbm;
    }

    /**
     * 新建一个空的引擎实例
     */
    public static DatabaseContext newContext(String name, IsolationLevel defaultLevel) {
        TransactionManager txm = TransactionManager.create();
        VersionManager vm = VersionManager.newVersionManager(txm);
        TableManager tbm = TableManager.create(vm, defaultLevel);
        return new DatabaseContext(name, txm, vm, tbm);
    }

    /**
     * 从快照重建引擎实例。导出时仍为 ACTIVE 的事务恢复为 ABORTED。
     */
    public static DatabaseContext fromSnapshot(String name, DatabaseSnapshot snapshot, IsolationLevel defaultLevel) {
        SnapshotCodec.validate(snapshot);
        DatabaseContext ctx = newContext(name, defaultLevel);
        ctx.txm.restore(snapshot.transactions, snapshot.nextXid);
        for (DatabaseSnapshot.TableData data : snapshot.tables) {
            List<Field> fields = new ArrayList<>();
            for (DatabaseSnapshot.ColumnData column : data.columns) {
                if(column == null || column.name == null) {
                    throw Error.BadSnapshotException;
                }
                fields.add(new Field(column.name, FieldType.from(column.type)));
            }
            Table table = ctx.tbm.restoreTable(data.name, fields,
                    Instant.ofEpochMilli(data.createdAt), data.nextRecordId);
            for (DatabaseSnapshot.VersionData v : data.versions) {
                table.getStore().append(v.recordId, Version.restored(v.recordId, restoreValues(fields, v.values),
                        v.createdBy, Instant.ofEpochMilli(v.createdAt), v.deleteMarks));
            }
        }
        return ctx;
    }

    // JSON 数字解析成 Long 或 Double，按列类型规整回来
    private static Map<String, Object> restoreValues(List<Field> fields, Map<String, Object> raw) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (Field field : fields) {
            Object v = raw.get(field.getName());
            values.put(field.getName(), v == null ? field.getType().defaultValue() : field.getType().coerce(v));
        }
        return values;
    }

    /**
     * 导出当前状态。
     * <p>
     * 先取事务登记表，再取版本；登记表之后才出现的事务写下的版本和删除标记不导出。
     */
    public DatabaseSnapshot exportSnapshot() {
        DatabaseSnapshot snapshot = new DatabaseSnapshot();
        snapshot.name = name;
        snapshot.exportedAt = System.currentTimeMillis();

        RegistrySnapshot registry = txm.snapshot();
        snapshot.nextXid = registry.getNextXid();
        Set<Long> known = new HashSet<>();
        for (Transaction tx : txm.transactions()) {
            if(tx.xid < registry.getNextXid()) {
                snapshot.transactions.add(TransactionInfo.of(tx));
                known.add(tx.xid);
            }
        }

        for (Table table : tbm.tables()) {
            DatabaseSnapshot.TableData data = new DatabaseSnapshot.TableData();
            data.name = table.getName();
            data.createdAt = table.getCreatedAt().toEpochMilli();
            data.nextRecordId = table.getNextRecordId();
            for (Field field : table.getFields()) {
                data.columns.add(new DatabaseSnapshot.ColumnData(field.getName(), field.getTypeName()));
            }
            VersionStore store = table.getStore();
            for (Long recordId : store.allRecordIds()) {
                VersionChain chain = store.chainOf(recordId);
                for (Version v : chain.versions()) {
                    if(!known.contains(v.getCreatedBy())) {
                        continue;
                    }
                    DatabaseSnapshot.VersionData vd = new DatabaseSnapshot.VersionData();
                    vd.recordId = v.getRecordId();
                    vd.createdBy = v.getCreatedBy();
                    vd.createdAt = v.getCreatedAt().toEpochMilli();
                    for (Long mark : v.getDeleteMarks()) {
                        if(known.contains(mark)) {
                            vd.deleteMarks.add(mark);
                        }
                    }
                    vd.values.putAll(v.getValues());
                    data.versions.add(vd);
                }
            }
            snapshot.tables.add(data);
        }
        return snapshot;
    }

    public String getName() {
        return name;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public TransactionManager getTransactionManager() {
        return txm;
    }

    public VersionManager getVersionManager() {
        return vm;
    }

    public TableManager getTableManager() {
        return tbm;
    }

    /** 增加一次引用：某个会话开始使用这个数据库实例 */
    public void retain() {
        refCount.incrementAndGet();
    }

    /** 释放一次引用：会话结束使用 */
    public void release() {
        refCount.updateAndGet(c -> c > 0 ? c - 1 : 0);
    }

    /** 是否仍有会话在使用这个数据库实例 */
    public boolean inUse() {
        return refCount.get() > 0;
    }

    public int refCount() {
        return refCount.get();
    }
}
