package com.mvccdb.backend.tbm;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import com.mvccdb.backend.statement.Create;
import com.mvccdb.backend.statement.Delete;
import com.mvccdb.backend.statement.Insert;
import com.mvccdb.backend.statement.Select;
import com.mvccdb.backend.statement.Update;
import com.mvccdb.backend.statement.condition.BinaryCondition;
import com.mvccdb.backend.statement.condition.Condition;
import com.mvccdb.backend.statement.condition.PredicateCondition;
import com.mvccdb.backend.statement.operator.CompareOperator;
import com.mvccdb.backend.vm.Version;
import com.mvccdb.backend.vm.VersionManager;
import com.mvccdb.backend.vm.VersionStore;
import com.mvccdb.common.Error;
import com.mvccdb.common.ResultSet;

/**
 * 表（Table）对象，维护表的元信息、字段定义以及增删改查的核心流程。
 *
 * <p>行数据不存放在表里，而是存放在 VM 中属于本表的版本分区（{@link VersionStore}），
 * 每次读写都经过 VM 的可见性判断。</p>
 *
 * <ul>
 *   <li>record id 由表内计数器分配，从 1 开始；显式指定的 id 会把计数器推到它之后</li>
 *   <li>列 {@code id} 保留给 record id，WHERE 和投影里都可以引用</li>
 * </ul>
 */
public class Table {
    public static final String ID_FIELD = "id";

    final TableManager tbm;
    final String name;
    final Instant createdAt;
    final VersionStore store;
    private final AtomicLong nextRecordId;

    /**
     * 表里所有字段（列）的定义列表
     */
    final List<Field> fields;

    Table(TableManager tbm, String name, List<Field> fields, VersionStore store,
          Instant createdAt, long nextRecordId) {
        this.tbm = tbm;
        this.name = name;
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
        this.store = store;
        this.createdAt = createdAt;
        this.nextRecordId = new AtomicLong(Math.max(1, nextRecordId));
    }

    /**
     * 根据 CREATE 语句解析字段定义并建表。
     *
     * @throws RuntimeException 字段名为空/重复/占用保留名，或类型非法
     */
    static Table createTable(TableManager tbm, Create create) {
        if(create.tableName == null || create.tableName.isBlank()) {
            throw Error.InvalidCommandException;
        }
        if(create.fieldName == null || create.fieldType == null
                || create.fieldName.length != create.fieldType.length) {
            throw Error.InvalidFieldException;
        }
        List<Field> fields = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < create.fieldName.length; i++) {
            String fieldName = create.fieldName[i];
            if(fieldName == null || fieldName.isBlank() || ID_FIELD.equals(fieldName) || !seen.add(fieldName)) {
                throw Error.InvalidFieldException;
            }
            fields.add(new Field(fieldName, FieldType.from(create.fieldType[i])));
        }
        VersionStore store = tbm.getVersionManager().createPartition(create.tableName);
        return new Table(tbm, create.tableName, fields, store, Instant.now(), 1);
    }

    public String getName() {
        return name;
    }

    public List<Field> getFields() {
        return fields;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public VersionStore getStore() {
        return store;
    }

    /**
     * 下一个将被分配的 record id
     */
    public long getNextRecordId() {
        return nextRecordId.get();
    }

    /**
     * 插入一条记录。
     *
     * @return 新记录的 record id
     * @throws RuntimeException 列不存在、值非法、record id 冲突或事务非法
     */
    public long insert(long xid, Insert insert) {
        Map<String, Object> rowData = normalize(insert.values, true);
        long recordId;
        if(insert.recordId == null) {
            recordId = nextRecordId.getAndIncrement();
        } else {
            recordId = insert.recordId;
            if(recordId < 1) {
                throw Error.InvalidValuesException;
            }
            nextRecordId.accumulateAndGet(recordId + 1, Math::max);
        }
        vm().insert(xid, name, recordId, rowData);
        return recordId;
    }

    /**
     * 执行 SELECT 查询并返回结构化结果。
     */
    public ResultSet read(long xid, Select read) {
        List<String> targetFields = resolveSelectFields(read.fields);
        return formatTable(targetFields, rows(xid, read.where));
    }

    /**
     * 当前事务可见、且满足条件的所有行，按 record id 升序
     */
    public List<Row> rows(long xid, Condition where) {
        List<Row> res = new ArrayList<>();
        for (Version v : vm().scan(xid, name)) {
            Row row = Row.of(v);
            if(matchWhere(row, where)) {
                res.add(row);
            }
        }
        return res;
    }

    /**
     * 更新记录，新值覆盖同名列。
     *
     * <p>指定 record id 时只处理这一条，不存在则抛 RecordNotFoundException；
     * 否则处理所有可见且满足 WHERE 的行，按写者规则已经找不到的行跳过。</p>
     *
     * @return 受影响的行数
     */
    public int update(long xid, Update update) {
        Map<String, Object> newValues = normalize(update.values, false);
        if(update.recordId != null) {
            if(!matchesById(xid, update.recordId, update.where)) {
                return 0;
            }
            vm().update(xid, name, update.recordId, newValues);
            return 1;
        }
        int count = 0;
        for (Row row : rows(xid, update.where)) {
            if(applySkippingMissing(() -> vm().update(xid, name, row.getRecordId(), newValues))) {
                count ++;
            }
        }
        return count;
    }

    /**
     * 删除记录，规则同 {@link #update(long, Update)}。
     *
     * @return 实际删除的行数
     */
    public int delete(long xid, Delete delete) {
        if(delete.recordId != null) {
            if(!matchesById(xid, delete.recordId, delete.where)) {
                return 0;
            }
            vm().delete(xid, name, delete.recordId);
            return 1;
        }
        int count = 0;
        for (Row row : rows(xid, delete.where)) {
            if(applySkippingMissing(() -> vm().delete(xid, name, row.getRecordId()))) {
                count ++;
            }
        }
        return count;
    }

    /**
     * 列定义的结构化描述
     */
    public ResultSet describe() {
        List<String> headers = List.of("Field", "Type", "Default");
        List<List<String>> rows = new ArrayList<>();
        rows.add(List.of(ID_FIELD, FieldType.INT64.typeName(), "AUTO"));
        for (Field field : fields) {
            rows.add(List.of(field.fieldName, field.getTypeName(), field.fieldType.print(field.fieldType.defaultValue())));
        }
        return new ResultSet(headers, rows);
    }

    private VersionManager vm() {
        return tbm.getVersionManager();
    }

    /**
     * 指定 record id 时的 WHERE 过滤：可见版本存在且不满足条件时不处理；
     * 可见版本不存在时交给 VM 按写者规则判定（找不到会抛 RecordNotFoundException）
     */
    private boolean matchesById(long xid, long recordId, Condition where) {
        if(where == null) {
            return true;
        }
        Version v = vm().read(xid, name, recordId);
        return v == null || matchWhere(Row.of(v), where);
    }

    /**
     * 谓词更新/删除时，可见的行可能已被别的已提交事务删除，跳过即可
     */
    private static boolean applySkippingMissing(Runnable write) {
        try {
            write.run();
            return true;
        } catch (RuntimeException e) {
            if(e != Error.RecordNotFoundException) {
                throw e;
            }
            return false;
        }
    }

    /**
     * 按列定义校验并规整外部传入的值。
     *
     * @param fillDefaults 为 true 时补齐未给出的列（插入）；为 false 时只保留给出的列（更新）
     */
    private Map<String, Object> normalize(Map<String, Object> values, boolean fillDefaults) {
        Map<String, Object> res = new LinkedHashMap<>();
        if(!fillDefaults && (values == null || values.isEmpty())) {
            throw Error.InvalidValuesException;
        }
        if(values != null) {
            for (String key : values.keySet()) {
                if(getFieldByName(key) == null) {
                    throw Error.FieldNotFoundException;
                }
            }
        }
        for (Field field : fields) {
            if(values != null && values.containsKey(field.fieldName)) {
                res.put(field.fieldName, field.fieldType.coerce(values.get(field.fieldName)));
            } else if(fillDefaults) {
                res.put(field.fieldName, field.fieldType.defaultValue());
            }
        }
        return res;
    }

    boolean matchWhere(Row row, Condition where) {
        if(where == null) {
            return true;
        }
        if(where instanceof PredicateCondition) {
            return matchExp(row, (PredicateCondition) where);
        }
        if(where instanceof BinaryCondition) {
            BinaryCondition bc = (BinaryCondition) where;
            if(bc.lop == null) {
                throw Error.InvalidLogOpException;
            }
            switch(bc.lop) {
                case AND:
                    return matchWhere(row, bc.left) && matchWhere(row, bc.right);
                case OR:
                    return matchWhere(row, bc.left) || matchWhere(row, bc.right);
                default:
                    throw Error.InvalidLogOpException;
            }
        }
        throw Error.InvalidCommandException;
    }

    private boolean matchExp(Row row, PredicateCondition exp) {
        CompareOperator op = exp.cop;
        if(op == null) {
            throw Error.InvalidLogOpException;
        }
        // 1. 找到字段类型和当前值，id 指 record id
        FieldType type;
        Object curVal;
        if(ID_FIELD.equals(exp.field)) {
            type = FieldType.INT64;
            curVal = row.getRecordId();
        } else {
            Field target = getFieldByName(exp.field);
            if(target == null) {
                throw Error.FieldNotFoundException;
            }
            type = target.fieldType;
            curVal = row.get(target.fieldName);
        }
        if(curVal == null) return false;

        // 2. 把右值转成对应类型后用 FieldType 的策略比较
        Object expectVal = type.coerce(exp.value);
        int cmp = type.compare(curVal, expectVal);

        // 3. 用 CompareOperator 的策略判断是否满足运算符
        return op.match(cmp);
    }

    private Field getFieldByName(String fieldName) {
        for (Field field : fields) {
            if (field.fieldName.equals(fieldName)) {
                return field;
            }
        }
        return null;
    }

    /**
     * 解析 SELECT 列清单。
     *
     * <p>支持：空/星号（id + 全部字段）/指定字段名列表。</p>
     */
    private List<String> resolveSelectFields(String[] selectFields) {
        List<String> targetFields = new ArrayList<>();
        if(selectFields == null || selectFields.length == 0
                || (selectFields.length == 1 && "*".equals(selectFields[0]))) {
            targetFields.add(ID_FIELD);
            for (Field field : fields) {
                targetFields.add(field.fieldName);
            }
            return targetFields;
        }
        for (String fieldName : selectFields) {
            if(!ID_FIELD.equals(fieldName) && getFieldByName(fieldName) == null) {
                throw Error.FieldNotFoundException;
            }
            targetFields.add(fieldName);
        }
        return targetFields;
    }

    /**
     * To ResultSet
     */
    private ResultSet formatTable(List<String> targetFields, List<Row> rows) {
        List<List<String>> dataRows = new ArrayList<>();
        for (Row row : rows) {
            List<String> rowValues = new ArrayList<>();
            for (String fieldName : targetFields) {
                if(ID_FIELD.equals(fieldName)) {
                    rowValues.add(String.valueOf(row.getRecordId()));
                } else {
                    rowValues.add(getFieldByName(fieldName).fieldType.print(row.get(fieldName)));
                }
            }
            dataRows.add(rowValues);
        }
        return new ResultSet(new ArrayList<>(targetFields), dataRows);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        sb.append(name).append(": ");
        for (int i = 0; i < fields.size(); i++) {
            sb.append(fields.get(i));
            if(i < fields.size() - 1) {
                sb.append(", ");
            }
        }
        return sb.append("}").toString();
    }
}
