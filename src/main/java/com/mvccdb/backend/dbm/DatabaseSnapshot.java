package com.mvccdb.backend.dbm;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.mvccdb.backend.txm.TransactionInfo;

/**
 * 一个数据库实例的完整导出：事务登记表 + 每张表的列定义和全部版本链。
 * 时间戳均为 epoch 毫秒。
 */
public class DatabaseSnapshot {
    public String name;
    public long exportedAt;
    public long nextXid;
    public List<TransactionInfo> transactions = new ArrayList<>();
    public List<TableData> tables = new ArrayList<>();

    public static class TableData {
        public String name;
        public long createdAt;
        public long nextRecordId;
        public List<ColumnData> columns = new ArrayList<>();
        /**
         * 按 record id 升序，同一条记录的版本按创建顺序排列
         */
        public List<VersionData> versions = new ArrayList<>();
    }

    public static class ColumnData {
        public String name;
        public String type;

        public ColumnData() {}

        public ColumnData(String name, String type) {
            this.name = name;
            this.type = type;
        }
    }

    public static class VersionData {
        public long recordId;
        public long createdBy;
        public long createdAt;
        public List<Long> deleteMarks = new ArrayList<>();
        public Map<String, Object> values = new LinkedHashMap<>();
    }
}
