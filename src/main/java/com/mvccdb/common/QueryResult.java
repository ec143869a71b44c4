package com.mvccdb.common;

/**
 * 表管理层一次操作的结果：要么是事务读到的行，要么是写操作的说明与影响行数。
 * 插入额外带回分配到的 record id。
 */
public class QueryResult {
    private final ResultSet resultSet;
    private final String message;
    private final int affectedRows;
    private final Long insertedId;

    private QueryResult(ResultSet resultSet, String message, int affectedRows, Long insertedId) {
        this.resultSet = resultSet;
        this.message = message;
        this.affectedRows = affectedRows;
        this.insertedId = insertedId;
    }

    public static QueryResult resultSet(ResultSet data) {
        return new QueryResult(data == null ? ResultSet.empty() : data, null, -1, null);
    }

    public static QueryResult message(String message, int affectedRows) {
        return new QueryResult(null, message, affectedRows, null);
    }

    public static QueryResult inserted(long recordId) {
        return new QueryResult(null, "insert id=" + recordId, 1, recordId);
    }

    public boolean hasRows() {
        return resultSet != null;
    }

    public ResultSet getResultSet() {
        return resultSet;
    }

    public String getMessage() {
        return message;
    }

    public int getAffectedRows() {
        return affectedRows;
    }

    /**
     * 查询返回的行数，非查询结果为 -1
     */
    public int getResultRows() {
        return resultSet == null ? -1 : resultSet.size();
    }

    /**
     * 插入分配到的 record id，其他操作为 null
     */
    public Long getInsertedId() {
        return insertedId;
    }
}
