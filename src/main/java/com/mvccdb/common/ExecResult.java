package com.mvccdb.common;

/**
 * 一条语句执行后的结构化结果，供会话层决定如何展示。
 */
public class ExecResult {

    public enum Type {
        RESULT,
        OK
    }

    private final Type type;
    private final QueryResult queryResult;
    /** 执行完成后会话所处的事务，0 表示不在事务中 */
    private final long xid;
    private final long elapsedNanos;

    private ExecResult(Type type, QueryResult queryResult, long xid, long elapsedNanos) {
        this.type = type;
        this.queryResult = queryResult;
        this.xid = xid;
        this.elapsedNanos = elapsedNanos;
    }

    public static ExecResult from(QueryResult queryResult, Type type, long xid, long elapsedNanos) {
        QueryResult effective = queryResult;
        if(effective == null) {
            if(type == Type.RESULT) {
                effective = QueryResult.resultSet(ResultSet.empty());
            } else {
                effective = QueryResult.message("", -1);
            }
        }
        return new ExecResult(type, effective, xid, elapsedNanos);
    }

    public Type getType() {
        return type;
    }

    public QueryResult getQueryResult() {
        return queryResult;
    }

    public ResultSet getResultSet() {
        return queryResult.getResultSet();
    }

    public String getMessage() {
        return queryResult.getMessage();
    }

    public long getXid() {
        return xid;
    }

    public long getElapsedNanos() {
        return elapsedNanos;
    }

    public int getResultRows() {
        return queryResult.getResultRows();
    }

    public int getAffectedRows() {
        return queryResult.getAffectedRows();
    }

    public Long getInsertedId() {
        return queryResult.getInsertedId();
    }
}
